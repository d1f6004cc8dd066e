/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.framelog.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of long-lived worker threads running caller-supplied jobs.
 * <p>
 * Jobs are handed over through a {@link SynchronousQueue}: {@link #execute}
 * blocks until an idle worker takes the job, so a saturated pool makes
 * producers wait instead of buffering work. {@link #waitForCompletion()} is a
 * quiescence barrier that returns once no accepted job is still running.
 * <p>
 * Jobs are fire-and-forget. A job that throws is logged and its worker carries
 * on; nothing is reported back to the submitter. There is no cancellation and
 * no per-job timeout.
 * <p>
 * The submitter's SLF4J {@link MDC} is installed on the worker for the
 * duration of the job.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);

    /** How often a blocked {@link #execute} re-checks whether the pool was closed. */
    private static final long HANDOFF_POLL_MS = 50;

    private record Job(Runnable task, Map<String, String> context) {
    }

    private final SynchronousQueue<Job> handoff = new SynchronousQueue<>();
    private final AtomicInteger activeCount = new AtomicInteger();
    private final ReentrantLock completionLock = new ReentrantLock();
    private final Condition idle = completionLock.newCondition();
    private final List<Thread> workers;
    private volatile boolean closed;

    /**
     * Starts {@code size} worker threads.
     *
     * @throws IllegalArgumentException if {@code size < 1}
     */
    public WorkerPool(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1: " + size);
        }
        List<Thread> threads = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Thread t = new Thread(this::runWorker, "framelog-worker-" + i);
            t.setDaemon(true);
            threads.add(t);
        }
        this.workers = Collections.unmodifiableList(threads);
        workers.forEach(Thread::start);
        LOG.debug("WorkerPool started with {} workers", size);
    }

    /**
     * Hands {@code task} to an idle worker, blocking until one accepts it.
     *
     * @throws IllegalStateException if the pool is closed, or the caller is
     *                               interrupted before the job was accepted
     */
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (closed) {
            throw new IllegalStateException("pool is closed");
        }
        // counted before the handoff so a concurrent waitForCompletion() cannot miss it
        activeCount.incrementAndGet();
        Job job = new Job(task, MDC.getCopyOfContextMap());
        try {
            while (!handoff.offer(job, HANDOFF_POLL_MS, TimeUnit.MILLISECONDS)) {
                if (closed) {
                    jobFinished();
                    throw new IllegalStateException("pool is closed");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobFinished();
            throw new IllegalStateException("Interrupted while handing off job", e);
        }
    }

    /**
     * Blocks until every accepted job has finished. Returns immediately if
     * nothing is running.
     */
    public void waitForCompletion() throws InterruptedException {
        completionLock.lockInterruptibly();
        try {
            while (activeCount.get() > 0) {
                idle.await();
            }
        } finally {
            completionLock.unlock();
        }
    }

    /** Jobs accepted or being handed off that have not yet finished. */
    public int activeCount() {
        return activeCount.get();
    }

    public int size() {
        return workers.size();
    }

    /**
     * Interrupts every worker; each exits after its current job, if any.
     * Jobs not yet accepted are refused.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        workers.forEach(Thread::interrupt);
        LOG.debug("WorkerPool closed");
    }

    private void runWorker() {
        while (!closed) {
            Job job;
            try {
                job = handoff.take();
            } catch (InterruptedException e) {
                break;
            }
            run(job);
        }
        LOG.trace("{} exiting", Thread.currentThread().getName());
    }

    private void run(Job job) {
        if (job.context() != null) {
            MDC.setContextMap(job.context());
        }
        LOG.debug("pool count: {}", activeCount.get());
        try {
            job.task().run();
        } catch (Throwable t) {
            // errors thrown by a job (assertions, linkage) must not kill the worker
            LOG.error("Job failed on {}: {}", Thread.currentThread().getName(), t.getMessage(), t);
        } finally {
            MDC.clear();
            jobFinished();
        }
    }

    private void jobFinished() {
        int count = activeCount.decrementAndGet();
        LOG.debug("pool count decreased to: {}", count);
        if (count == 0) {
            completionLock.lock();
            try {
                idle.signalAll();
            } finally {
                completionLock.unlock();
            }
        }
    }
}
