package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.model.Side;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.tradeflow.backend.util.TestFixtures.NOW;
import static com.tradeflow.backend.util.TestFixtures.proposal;
import static org.assertj.core.api.Assertions.assertThat;

class ProposalBufferTest {

    @Test
    void drainKeepsProposalsGeneratedAfterBoundaryForNextCycle() {
        ProposalBuffer buffer = new ProposalBuffer(10);
        Proposal early = proposal("a", "BTC/USDT", Side.BUY, "1", 0.5, NOW.minusSeconds(1));
        Proposal onBoundary = proposal("b", "BTC/USDT", Side.BUY, "1", 0.5, NOW);
        Proposal late = proposal("c", "BTC/USDT", Side.BUY, "1", 0.5, NOW.plusSeconds(1));
        buffer.offer(early);
        buffer.offer(late);
        buffer.offer(onBoundary);

        List<Proposal> drained = buffer.drain(NOW);

        assertThat(drained).containsExactly(early, onBoundary);
        assertThat(buffer.size()).isEqualTo(1);
        assertThat(buffer.drain(NOW.plusSeconds(30))).containsExactly(late);
    }

    @Test
    void offerFailsWhenFull() {
        ProposalBuffer buffer = new ProposalBuffer(2);

        assertThat(buffer.offer(proposal("a", "BTC/USDT", Side.BUY, "1", 0.5, NOW))).isTrue();
        assertThat(buffer.offer(proposal("b", "BTC/USDT", Side.BUY, "1", 0.5, NOW))).isTrue();
        assertThat(buffer.offer(proposal("c", "BTC/USDT", Side.BUY, "1", 0.5, NOW))).isFalse();
        assertThat(buffer.size()).isEqualTo(2);
    }

    @Test
    void concurrentOffersAreNeitherLostNorDuplicated() throws Exception {
        ProposalBuffer buffer = new ProposalBuffer(10_000);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        for (int t = 0; t < 4; t++) {
            String agent = "agent" + t;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    if (buffer.offer(proposal(agent, "ETH/USDT", Side.SELL, "1", 0.5, NOW))) {
                        accepted.incrementAndGet();
                    }
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(accepted.get()).isEqualTo(2000);
        assertThat(buffer.drain(NOW)).hasSize(2000);
    }
}
