package io.fetch4j.internal;

import io.fetch4j.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bounded pool that runs queued tasks.
 *
 * <p>Tasks wait in a {@link DelayQueue} until their run time; a single dispatcher thread hands due tasks to a
 * fixed thread pool, gated by a semaphore so at most {@code maxConcurrency} run at once. Delayed resubmission
 * (retry backoff) never occupies a worker thread. Tasks may be submitted before {@link #start()}; they are
 * dispatched once the pool runs. Once {@link #stop(Duration)} has begun, submissions are refused until the next
 * {@link #start()}.
 */
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final int maxConcurrency;
    private final Consumer<Task> runner;
    private final Semaphore permits;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final DelayQueue<DelayedTask> queue = new DelayQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger running = new AtomicInteger();

    // closed is checked and the queue offered under this lock; stop() drains only after closing
    private final Object submitLock = new Object();
    private boolean closed = false;

    private ExecutorService executor;
    private Thread dispatcherThread;

    private static final class DelayedTask implements Delayed {
        private final Task task;
        private final Instant runAt;
        private final long seq;

        private DelayedTask(Task task, Instant runAt, long seq) {
            this.task = task;
            this.runAt = runAt;
            this.seq = seq;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(Instant.now(), runAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DelayedTask o) {
                int byTime = this.runAt.compareTo(o.runAt);
                return byTime != 0 ? byTime : Long.compare(this.seq, o.seq);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    public WorkerPool(int maxConcurrency, Consumer<Task> runner) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be a positive number");
        }
        this.maxConcurrency = maxConcurrency;
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.permits = new Semaphore(maxConcurrency);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        synchronized (submitLock) {
            closed = false;
        }

        AtomicInteger threadNo = new AtomicInteger();
        executor = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r);
            t.setName("fetch4j.worker-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("fetch4j.dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    /**
     * Stops dispatching, waits up to {@code timeout} for running tasks and returns the tasks that never ran.
     */
    public List<Task> stop(Duration timeout) {
        if (!started.compareAndSet(true, false)) {
            return List.of();
        }
        synchronized (submitLock) {
            closed = true;
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            try {
                dispatcherThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            dispatcherThread = null;
        }

        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            } finally {
                executor = null;
            }
        }

        List<DelayedTask> drained = new ArrayList<>();
        queue.drainTo(drained);
        // drainTo only takes expired entries
        drained.addAll(queue);
        queue.clear();

        List<Task> dropped = new ArrayList<>(drained.size());
        for (DelayedTask dt : drained) {
            dropped.add(dt.task);
        }
        return dropped;
    }

    public boolean submit(Task task) {
        return submit(task, Duration.ZERO);
    }

    /**
     * Queues {@code task} to run after {@code delay}.
     *
     * @return false if the pool is stopping or stopped and the task was not queued
     */
    public boolean submit(Task task, Duration delay) {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(delay, "delay must not be null");
        synchronized (submitLock) {
            if (closed) {
                return false;
            }
            return queue.offer(new DelayedTask(task, Instant.now().plus(delay), sequence.incrementAndGet()));
        }
    }

    public int queued() {
        return queue.size();
    }

    public int running() {
        return running.get();
    }

    private void dispatchLoop() {
        while (started.get()) {
            DelayedTask dt;
            try {
                dt = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                permits.acquire();
            } catch (InterruptedException e) {
                // keep it for stop() to report
                queue.offer(dt);
                Thread.currentThread().interrupt();
                break;
            }

            try {
                running.incrementAndGet();
                executor.execute(() -> {
                    try {
                        runner.accept(dt.task);
                    } catch (Exception e) {
                        log.error("fetch4j worker failed task={} msg={}", dt.task.id(), e.getMessage(), e);
                    } finally {
                        running.decrementAndGet();
                        permits.release();
                    }
                });
            } catch (Exception e) {
                running.decrementAndGet();
                permits.release();
                queue.offer(dt);
                log.error("fetch4j dispatcher failed task={} msg={}", dt.task.id(), e.getMessage(), e);
                break;
            }
        }
    }
}
