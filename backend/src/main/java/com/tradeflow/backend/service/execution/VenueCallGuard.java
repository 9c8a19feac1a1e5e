package com.tradeflow.backend.service.execution;

import com.tradeflow.backend.exception.TransientVenueException;
import com.tradeflow.backend.exception.VenueException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounds every venue call with the venue time limiter. A timeout is reported as a
 * transient failure; the abandoned call is cancelled.
 */
@Component
public class VenueCallGuard {

    private final TimeLimiter timeLimiter;
    private final ExecutorService venueCallExecutor;

    public VenueCallGuard(TimeLimiter venueTimeLimiter,
                          @Qualifier("venueCallExecutor") ExecutorService venueCallExecutor) {
        this.timeLimiter = venueTimeLimiter;
        this.venueCallExecutor = venueCallExecutor;
    }

    public <T> T call(String venue, String operation, Supplier<T> call) throws InterruptedException {
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, venueCallExecutor));
        } catch (TimeoutException e) {
            throw TransientVenueException.timeout(venue, operation,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis());
        } catch (ExecutionException e) {
            throw unwrap(venue, operation, e.getCause());
        } catch (InterruptedException e) {
            throw e;
        } catch (VenueException e) {
            throw e;
        } catch (Exception e) {
            throw unwrap(venue, operation, e);
        }
    }

    private RuntimeException unwrap(String venue, String operation, Throwable cause) {
        Throwable root = cause;
        while ((root instanceof CompletionException || root instanceof ExecutionException)
                && root.getCause() != null) {
            root = root.getCause();
        }
        if (root instanceof RuntimeException runtime) {
            return runtime;
        }
        return new TransientVenueException(venue, "IO_ERROR", operation + " failed: " + root.getMessage(), root);
    }
}
