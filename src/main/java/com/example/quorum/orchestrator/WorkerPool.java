package com.example.quorum.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded execution slots for one run plus the threads that run agent calls and timers.
 *
 * <p>A slot is held by a task from dispatch until it reaches a terminal state, including any retry
 * backoff. Agent calls themselves run on an unbounded executor because a consensus task fans out
 * several calls from a single slot.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final int slots;
    private final Semaphore available;
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;

    public WorkerPool(String name, int slots) {
        if (slots < 1) {
            throw new IllegalArgumentException("concurrency must be > 0: " + slots);
        }
        this.slots = slots;
        this.available = new Semaphore(slots);
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-agent-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name + "-timer");
            t.setDaemon(true);
            return t;
        });
    }

    public boolean tryAcquireSlot() {
        return available.tryAcquire();
    }

    public void releaseSlot() {
        available.release();
    }

    public int availableSlots() {
        return available.availablePermits();
    }

    public int getSlots() {
        return slots;
    }

    /**
     * Runs a call on the pool and fails the returned future with the supplied exception if it has not
     * finished within {@code timeout}; the call's thread is then interrupted.
     */
    public <T> CompletableFuture<T> submit(Callable<T> call, Duration timeout, Supplier<RuntimeException> onTimeout) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> running = executor.submit(() -> {
            try {
                result.complete(call.call());
            } catch (Throwable t) {
                result.completeExceptionally(t);
                if (t instanceof VirtualMachineError) {
                    throw (VirtualMachineError) t;
                }
            }
        });
        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            if (result.completeExceptionally(onTimeout.get())) {
                running.cancel(true);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        result.whenComplete((value, error) -> timer.cancel(false));
        return result;
    }

    /**
     * Runs an action on the pool without waiting for it.
     */
    public CompletableFuture<Void> execute(Runnable action) {
        return CompletableFuture.runAsync(action, executor);
    }

    public ScheduledFuture<?> schedule(Runnable action, Duration delay) {
        return scheduler.schedule(action, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops accepting work. Calls still running are interrupted when {@code interrupt} is set.
     */
    public void shutdown(boolean interrupt) {
        if (interrupt) {
            executor.shutdownNow();
            scheduler.shutdownNow();
        } else {
            executor.shutdown();
            scheduler.shutdown();
        }
        logger.debug("Worker pool shut down (interrupt={})", interrupt);
    }

    @Override
    public void close() {
        shutdown(false);
    }
}
