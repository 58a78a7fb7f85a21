package com.catalogiq.engine.service;

import com.catalogiq.engine.service.batch.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs oracle calls in fixed-size batches with a bounded number in flight and a
 * per-call timeout. A call that times out or throws yields a failed {@link Outcome};
 * it is never retried.
 *
 * The timeout is measured from the moment a call starts running, so time spent queued
 * behind other calls of the batch is not charged to it. A call still queued once every
 * wave of the batch has had its full timeout fails as timed out without running.
 */
@Slf4j
public class OracleExecutor {

    private final int concurrency;
    private final long timeoutMs;
    private final int batchSize;

    public OracleExecutor(int concurrency, long timeoutMs, int batchSize) {
        this.concurrency = Math.max(1, concurrency);
        this.timeoutMs = Math.max(1, timeoutMs);
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * Invoke every call and return outcomes in input order. When the token is cancelled the
     * current batch completes and the remaining calls are reported as {@link Outcome#skipped()}.
     */
    public <T> List<Outcome<T>> invokeAll(List<Callable<T>> calls, CancellationToken token) {
        List<Outcome<T>> outcomes = new ArrayList<>(calls.size());
        if (calls.isEmpty()) {
            return outcomes;
        }

        int poolSize = Math.min(concurrency, calls.size());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            for (int start = 0; start < calls.size(); start += batchSize) {
                int end = Math.min(start + batchSize, calls.size());
                if (token.isCancelled()) {
                    log.info("Oracle batch {}-{} skipped: run cancelled", start, end);
                    for (int i = start; i < calls.size(); i++) {
                        outcomes.add(Outcome.skipped());
                    }
                    break;
                }

                long waves = (end - start + poolSize - 1) / poolSize;
                long queueDeadline = System.nanoTime() + waves * TimeUnit.MILLISECONDS.toNanos(timeoutMs);
                List<TimedCall<T>> submitted = new ArrayList<>(end - start);
                for (Callable<T> call : calls.subList(start, end)) {
                    TimedCall<T> timed = new TimedCall<>(call);
                    timed.future = executor.submit(timed);
                    submitted.add(timed);
                }
                for (TimedCall<T> timed : submitted) {
                    outcomes.add(await(timed, queueDeadline));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return outcomes;
    }

    private <T> Outcome<T> await(TimedCall<T> timed, long queueDeadline) {
        Future<T> future = timed.future;
        try {
            while (true) {
                try {
                    return Outcome.success(future.get(Math.max(0, timed.remainingNanos(timeoutMs, queueDeadline)),
                            TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    // a call that left the queue meanwhile gets its own full timeout
                    if (timed.remainingNanos(timeoutMs, queueDeadline) <= 0) {
                        future.cancel(true);
                        return Outcome.failure(new TimeoutException("Oracle call exceeded " + timeoutMs + "ms"));
                    }
                }
            }
        } catch (ExecutionException e) {
            return Outcome.failure(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Outcome.failure(e);
        }
    }

    private static final class TimedCall<T> implements Callable<T> {

        private final Callable<T> delegate;
        private volatile Long startedAt;
        private Future<T> future;

        private TimedCall(Callable<T> delegate) {
            this.delegate = delegate;
        }

        @Override
        public T call() throws Exception {
            startedAt = System.nanoTime();
            return delegate.call();
        }

        long remainingNanos(long timeoutMs, long queueDeadline) {
            Long started = startedAt;
            long deadline = started != null ? started + TimeUnit.MILLISECONDS.toNanos(timeoutMs) : queueDeadline;
            return deadline - System.nanoTime();
        }
    }

    public record Outcome<T>(T value, Throwable failure, boolean wasSkipped) {

        public static <T> Outcome<T> success(T value) {
            return new Outcome<>(value, null, false);
        }

        public static <T> Outcome<T> failure(Throwable failure) {
            return new Outcome<>(null, failure, false);
        }

        public static <T> Outcome<T> skipped() {
            return new Outcome<>(null, null, true);
        }

        public boolean isSuccess() {
            return !wasSkipped && failure == null;
        }

        public String failureMessage() {
            if (failure == null) {
                return null;
            }
            return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        }
    }
}
