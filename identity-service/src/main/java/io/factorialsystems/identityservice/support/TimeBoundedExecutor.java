package io.factorialsystems.identityservice.support;

import io.factorialsystems.identityservice.exception.OperationTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs blocking calls to external dependencies on a dedicated pool and waits for them no
 * longer than the caller's {@link Deadline}.
 * <p>
 * A call that overruns is not cancelled: the caller receives an
 * {@link OperationTimeoutException} while the call itself keeps running to completion, since a
 * half-applied write (a stored hash, an inserted row) cannot be rolled back from here.
 */
@Slf4j
@Component
public class TimeBoundedExecutor {

    private final Executor executor;

    public TimeBoundedExecutor(@Qualifier("storeCallExecutor") Executor executor) {
        this.executor = executor;
    }

    public <T> T call(String operation, Deadline deadline, Supplier<T> call) {
        if (deadline.isExpired()) {
            throw new OperationTimeoutException(operation, deadline.getTimeout());
        }

        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return future.get(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("Operation {} exceeded its deadline of {}ms, leaving it to complete in the background",
                    operation, deadline.getTimeout().toMillis());
            throw new OperationTimeoutException(operation, deadline.getTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Operation " + operation + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException(operation, deadline.getTimeout());
        }
    }

    public void run(String operation, Deadline deadline, Runnable call) {
        call(operation, deadline, () -> {
            call.run();
            return null;
        });
    }
}
