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
package dev.mars.framelog.store;

import dev.mars.framelog.frame.Frame;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded channel carrying frames from the store to one reader.
 * <p>
 * The store is the only sender. It blocks while the channel is full, which is
 * how a slow reader pushes back on the store. The reader ends the
 * subscription by calling {@link #close()}; the store notices on its next
 * send and drops the channel. When the store has nothing more to send (replay
 * finished without follow, or the store closed) it completes the channel, and
 * {@link #receive()} returns empty once the buffer is drained.
 * <pre>{@code
 * try (FrameChannel frames = store.read(ReadOptions.defaults())) {
 *     Optional<Frame> frame;
 *     while ((frame = frames.receive()).isPresent()) {
 *         handle(frame.get());
 *     }
 * }
 * }</pre>
 */
public final class FrameChannel implements AutoCloseable {

    private final int capacity;
    private final ArrayDeque<Frame> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean completed;
    private boolean closed;

    FrameChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    // ========================================================================
    // Sender side (store only)
    // ========================================================================

    /**
     * Blocks until there is room, then enqueues the frame.
     *
     * @return false if the reader has closed the channel
     */
    boolean send(Frame frame) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.size() >= capacity && !closed) {
                notFull.await();
            }
            if (closed || completed) {
                return false;
            }
            buffer.addLast(frame);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues the frame if there is room right now.
     *
     * @return false if the channel is full, completed or closed
     */
    boolean offer(Frame frame) {
        lock.lock();
        try {
            if (closed || completed || buffer.size() >= capacity) {
                return false;
            }
            buffer.addLast(frame);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the end of the stream. Buffered frames remain readable.
     */
    void complete() {
        lock.lock();
        try {
            completed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Whether nothing more can ever be delivered through this channel. */
    boolean isDone() {
        lock.lock();
        try {
            return closed || completed;
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Reader side
    // ========================================================================

    /**
     * Blocks until a frame is available or the stream ends.
     *
     * @return the next frame, or empty at end of stream
     */
    public Optional<Frame> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !completed && !closed) {
                notEmpty.await();
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for a frame.
     *
     * @return the next frame, or empty on timeout or at end of stream
     */
    public Optional<Frame> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !completed && !closed) {
                if (nanos <= 0) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Receives until end of stream. Only meaningful for reads that do not follow.
     */
    public List<Frame> drain() throws InterruptedException {
        List<Frame> frames = new ArrayList<>();
        Optional<Frame> frame;
        while ((frame = receive()).isPresent()) {
            frames.add(frame.get());
        }
        return frames;
    }

    /** Whether the stream has ended and every buffered frame has been received. */
    public boolean isFinished() {
        lock.lock();
        try {
            return buffer.isEmpty() && (completed || closed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the read. Buffered frames are discarded and the store stops
     * delivering to this channel.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            buffer.clear();
            notFull.signalAll();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private Optional<Frame> take() {
        Frame frame = buffer.pollFirst();
        if (frame != null) {
            notFull.signal();
        }
        return Optional.ofNullable(frame);
    }
}
