package com.tradeflow.backend.service.execution;

import com.tradeflow.backend.model.ExecutionResult;
import com.tradeflow.backend.trading.pipeline.ApprovedOrder;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-side view of a submitted order. Cancellation is cooperative: the
 * coordinator stops before its next venue call, a call already in flight runs to
 * completion and its fills are still applied.
 */
public class OrderHandle {

    private final ApprovedOrder order;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final CompletableFuture<ExecutionResult> result = new CompletableFuture<>();

    public OrderHandle(ApprovedOrder order) {
        this.order = order;
    }

    public String orderId() {
        return order.orderId();
    }

    public String instrument() {
        return order.instrument();
    }

    public ApprovedOrder order() {
        return order;
    }

    public CompletableFuture<ExecutionResult> result() {
        return result;
    }

    /**
     * @return true if this call requested cancellation, false if it was already requested
     */
    public boolean cancel() {
        if (cancelRequested.compareAndSet(false, true)) {
            cancelSignal.countDown();
            return true;
        }
        return false;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Waits up to {@code delay}, returning early when cancellation is requested.
     *
     * @return true if cancellation was requested before or during the wait
     */
    boolean awaitCancellation(Duration delay) throws InterruptedException {
        if (delay.isZero() || delay.isNegative()) {
            return isCancelRequested();
        }
        return cancelSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    void complete(ExecutionResult executionResult) {
        result.complete(executionResult);
    }
}
