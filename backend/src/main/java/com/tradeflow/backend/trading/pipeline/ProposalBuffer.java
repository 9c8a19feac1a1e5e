package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded hand-off between agents and the cycle. Agents offer concurrently; the
 * cycle drains everything generated at or before its boundary and leaves later
 * proposals for the next cycle.
 */
@Component
public class ProposalBuffer {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Proposal> pending = new ArrayList<>();

    @Autowired
    public ProposalBuffer(PipelineProperties pipelineProperties) {
        this(pipelineProperties.getBufferCapacity());
    }

    ProposalBuffer(int capacity) {
        this.capacity = capacity;
    }

    /**
     * @return false when the buffer is full and the proposal was not accepted
     */
    public boolean offer(Proposal proposal) {
        lock.lock();
        try {
            if (pending.size() >= capacity) {
                return false;
            }
            pending.add(proposal);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public List<Proposal> drain(Instant boundary) {
        lock.lock();
        try {
            List<Proposal> drained = new ArrayList<>();
            Iterator<Proposal> it = pending.iterator();
            while (it.hasNext()) {
                Proposal proposal = it.next();
                if (!proposal.generatedAt().isAfter(boundary)) {
                    drained.add(proposal);
                    it.remove();
                }
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }
}
