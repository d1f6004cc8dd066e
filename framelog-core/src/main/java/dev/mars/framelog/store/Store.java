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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.framelog.cas.CasWriter;
import dev.mars.framelog.cas.ContentStore;
import dev.mars.framelog.cas.Integrity;
import dev.mars.framelog.frame.CorruptFrameException;
import dev.mars.framelog.frame.Frame;
import dev.mars.framelog.frame.FrameCodec;
import dev.mars.framelog.frame.FrameDraft;
import dev.mars.framelog.frame.FrameId;
import dev.mars.framelog.frame.FrameIdGenerator;
import dev.mars.framelog.frame.Ttl;
import dev.mars.framelog.storage.FilePartition;
import dev.mars.framelog.storage.KeyBound;
import dev.mars.framelog.storage.OrderedPartition;
import dev.mars.framelog.storage.StorageException;
import dev.mars.framelog.storage.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Append-only, totally ordered frame log with content-addressed payloads.
 * <p>
 * <b>Layout:</b>
 * <pre>
 * dataDir/
 *  ├─ partition/   // ordered frame records ({@link FilePartition})
 *  └─ cas/         // payloads by digest ({@link ContentStore})
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * Appends and reads are commands consumed in arrival order by one dedicated
 * thread, which alone assigns identifiers, writes the partition and owns the
 * subscriber list. A reader registered by a {@code Read} command therefore
 * receives every frame of every {@code Append} processed after it, in order,
 * with no gap and no duplicate. One {@code Store} may be shared freely
 * between threads.
 * <p>
 * <b>Read protocol:</b>
 * <ol>
 *   <li>Unless {@code tail}: replay persisted frames after {@code lastId} in
 *       order, or the latest frame per key when a compaction strategy is set</li>
 *   <li>If following without tail or compaction: send an {@code xs.threshold} frame</li>
 *   <li>If following: register for live frames, plus {@code xs.pulse} heartbeats
 *       when requested; otherwise complete the channel</li>
 * </ol>
 * <p>
 * <b>Failure:</b> a persisted record that cannot be decoded stops the command
 * loop; every subscriber is completed and later commands fail with
 * {@link IllegalStateException}.
 */
public final class Store implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Store.class);

    static final String PARTITION_DIR = "partition";
    static final String CAS_DIR = "cas";

    /** How long close() waits for queued commands before interrupting the loop. */
    private static final long SHUTDOWN_GRACE_MS = 5_000;

    // ========================================================================
    // Commands
    // ========================================================================

    private interface Command {
    }

    private record Append(FrameDraft draft, CompletableFuture<Frame> reply) implements Command {
    }

    private record Read(FrameChannel channel, ReadOptions options) implements Command {
    }

    private record CollectExpired(CompletableFuture<Integer> reply) implements Command {
    }

    private record Shutdown() implements Command {
    }

    // ========================================================================
    // State
    // ========================================================================

    private final StoreConfig config;
    private final Path path;
    private final OrderedPartition partition;
    private final ContentStore cas;
    private final FrameCodec codec = new FrameCodec();
    private final FrameIdGenerator ids;
    private final LongSupplier clock;
    private final BlockingQueue<Command> commands;
    private final ScheduledExecutorService heartbeats;
    private final Thread commandThread;
    private final AtomicBoolean closeRequested = new AtomicBoolean();

    private volatile boolean running = true;
    private volatile Throwable failure;

    /** Live readers. Only touched by the command thread. */
    private final List<FrameChannel> subscribers = new ArrayList<>();

    private Store(StoreConfig config, LongSupplier clock) {
        this.config = config;
        this.path = config.dataDir();
        this.clock = clock;
        this.ids = new FrameIdGenerator(clock);
        this.commands = new ArrayBlockingQueue<>(config.commandQueueCapacity());

        this.partition = new FilePartition(config);
        partition.open(path.resolve(PARTITION_DIR));
        Iterator<Map.Entry<FrameId, byte[]>> newest =
                partition.rangeDescending(KeyBound.unbounded(), KeyBound.unbounded());
        if (newest.hasNext()) {
            ids.advancePast(newest.next().getKey());
        }
        this.cas = new ContentStore(path.resolve(CAS_DIR), config.syncEnabled());
        try {
            cas.open();
        } catch (RuntimeException e) {
            partition.close();
            throw e;
        }

        this.heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "framelog-heartbeat");
            t.setDaemon(true);
            return t;
        });
        this.commandThread = new Thread(this::runCommandLoop, "framelog-store");
        commandThread.setDaemon(true);
    }

    /**
     * Opens or creates the store rooted at {@code path} and starts its command loop.
     * Remaining settings are resolved as described in {@link StoreConfig}.
     */
    public static Store spawn(Path path) {
        return spawn(StoreConfig.builder().dataDir(path).build());
    }

    public static Store spawn(StoreConfig config) {
        return spawn(config, System::currentTimeMillis);
    }

    static Store spawn(StoreConfig config, LongSupplier clock) {
        LOG.info("Spawning store: {}", config);
        Store store = new Store(config, clock);
        store.commandThread.start();
        return store;
    }

    public Path path() {
        return path;
    }

    /** False once the store is closed or its command loop has stopped on a fatal error. */
    public boolean isRunning() {
        return running && !closeRequested.get();
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Appends a frame: assigns its identifier, persists it unless it is
     * ephemeral, and delivers it to every live reader.
     *
     * @return the finalised frame
     * @throws StorageException if the frame could not be persisted
     * @throws IllegalStateException if the store is closed
     */
    public Frame append(FrameDraft draft) {
        CompletableFuture<Frame> reply = new CompletableFuture<>();
        submit(new Append(draft, reply));
        return await(reply);
    }

    /**
     * Writes {@code content} to the content store, then appends a frame referencing it.
     * If the content write fails nothing is appended.
     */
    public Frame appendWithContent(String topic, byte[] content, JsonNode meta) throws IOException {
        return appendWithContent(FrameDraft.of(topic).withMeta(meta), content);
    }

    public Frame appendWithContent(String topic, String content, JsonNode meta) throws IOException {
        return appendWithContent(topic, content.getBytes(StandardCharsets.UTF_8), meta);
    }

    public Frame appendWithContent(FrameDraft draft, byte[] content) throws IOException {
        ensureRunning();
        Integrity hash = cas.insert(content);
        return append(draft.withHash(hash));
    }

    /**
     * Starts a read. Replay and live frames arrive on the returned channel;
     * closing it cancels the read.
     */
    public FrameChannel read(ReadOptions options) {
        FrameChannel channel = new FrameChannel(config.readBufferCapacity());
        submit(new Read(channel, options));
        return channel;
    }

    /**
     * Point lookup.
     *
     * @return the frame, or empty if it does not exist or has expired
     */
    public Optional<Frame> get(FrameId id) {
        ensureOpen();
        long now = clock.getAsLong();
        return partition.get(id)
                .map(codec::decode)
                .filter(frame -> !isExpired(frame, now));
    }

    /**
     * Most recent persisted frame of {@code topic}.
     */
    public Optional<Frame> head(String topic) {
        ensureOpen();
        long now = clock.getAsLong();
        Iterator<Map.Entry<FrameId, byte[]>> records =
                partition.rangeDescending(KeyBound.unbounded(), KeyBound.unbounded());
        while (records.hasNext()) {
            Frame frame = codec.decode(records.next().getValue());
            if (frame.topic().equals(topic) && !isExpired(frame, now)) {
                return Optional.of(frame);
            }
        }
        return Optional.empty();
    }

    /**
     * Removes every persisted frame whose {@link Ttl.Time} has run out.
     *
     * @return number of frames removed
     */
    public int collectExpired() {
        CompletableFuture<Integer> reply = new CompletableFuture<>();
        submit(new CollectExpired(reply));
        return await(reply);
    }

    public CasWriter casWriter() throws IOException {
        ensureOpen();
        return cas.writer();
    }

    public Optional<InputStream> casReader(Integrity hash) throws IOException {
        ensureOpen();
        return cas.reader(hash);
    }

    public Integrity casInsert(byte[] content) throws IOException {
        ensureOpen();
        return cas.insert(content);
    }

    public Integrity casInsert(String content) throws IOException {
        ensureOpen();
        return cas.insert(content);
    }

    public Optional<byte[]> casRead(Integrity hash) throws IOException {
        ensureOpen();
        return cas.read(hash);
    }

    /**
     * Stops the command loop after the commands already queued, completes
     * every reader and syncs the partition.
     */
    @Override
    public void close() {
        if (!closeRequested.compareAndSet(false, true)) {
            LOG.debug("Store already closed, ignoring duplicate close()");
            return;
        }
        LOG.info("Closing store at: {}", path);
        try {
            if (commandThread.isAlive()) {
                if (!commands.offer(new Shutdown(), SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                    LOG.warn("Command queue still full after {} ms", SHUTDOWN_GRACE_MS);
                }
                commandThread.join(SHUTDOWN_GRACE_MS);
                if (commandThread.isAlive()) {
                    LOG.warn("Command loop did not stop within {} ms, interrupting", SHUTDOWN_GRACE_MS);
                    commandThread.interrupt();
                    commandThread.join();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            commandThread.interrupt();
        } finally {
            heartbeats.shutdownNow();
            partition.close();
        }
        LOG.info("Store closed");
    }

    // ========================================================================
    // Command loop
    // ========================================================================

    private void runCommandLoop() {
        LOG.info("Command loop started for {}", path);
        try {
            while (true) {
                Command command = commands.take();
                if (command instanceof Shutdown) {
                    break;
                }
                dispatch(command);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Command loop interrupted");
        } catch (CorruptFrameException e) {
            LOG.error("Partition at {} is corrupt, stopping store: {}", path, e.getMessage(), e);
            failure = e;
        } finally {
            running = false;
            rejectPending();
            for (FrameChannel subscriber : subscribers) {
                subscriber.complete();
            }
            subscribers.clear();
            LOG.info("Command loop stopped for {}", path);
        }
    }

    private void dispatch(Command command) throws InterruptedException {
        try {
            if (command instanceof Append) {
                handleAppend((Append) command);
            } else if (command instanceof Read) {
                handleRead((Read) command);
            } else if (command instanceof CollectExpired) {
                handleCollectExpired((CollectExpired) command);
            } else {
                throw new IllegalArgumentException("Unknown command: " + command);
            }
        } catch (CorruptFrameException e) {
            reject(command, e);
            throw e;
        } catch (RuntimeException e) {
            LOG.error("{} failed: {}", command.getClass().getSimpleName(), e.getMessage(), e);
            reject(command, e);
        }
    }

    private void handleAppend(Append append) throws InterruptedException {
        Frame frame = append.draft().toFrame(ids.next());
        if (frame.ttl().isPersistent()) {
            partition.insert(frame.id(), codec.encode(frame));
        }
        append.reply().complete(frame);
        LOG.debug("Appended {}: topic={}, ttl={}", frame.id(), frame.topic(), frame.ttl().token());

        fanOut(frame);

        if (frame.ttl() instanceof Ttl.Head) {
            retainHead(frame.topic(), ((Ttl.Head) frame.ttl()).count());
        }
    }

    private void fanOut(Frame frame) throws InterruptedException {
        Iterator<FrameChannel> it = subscribers.iterator();
        while (it.hasNext()) {
            if (!it.next().send(frame)) {
                it.remove();
                LOG.debug("Subscriber gone, deregistered ({} remaining)", subscribers.size());
            }
        }
    }

    private void handleRead(Read read) throws InterruptedException {
        FrameChannel channel = read.channel();
        ReadOptions options = read.options();
        LOG.debug("Read: {}", options);

        if (!options.tail() && !replay(channel, options)) {
            LOG.debug("Reader went away during replay");
            return;
        }

        FollowOption follow = options.follow();
        if (!follow.isFollowing()) {
            channel.complete();
            return;
        }

        if (!options.tail() && options.compactionStrategy().isEmpty()
                && !channel.send(Frame.threshold(ids.next()))) {
            return;
        }
        subscribers.add(channel);

        if (follow instanceof FollowOption.WithHeartbeat) {
            startHeartbeat(channel, ((FollowOption.WithHeartbeat) follow).interval());
        }
    }

    /**
     * Sends persisted history to the reader.
     *
     * @return false if the reader closed the channel
     */
    private boolean replay(FrameChannel channel, ReadOptions options) throws InterruptedException {
        KeyBound lower = options.lastId().map(KeyBound::excluded).orElse(KeyBound.unbounded());
        Optional<CompactionStrategy> strategy = options.compactionStrategy();
        Map<String, Frame> compacted = new LinkedHashMap<>();
        long now = clock.getAsLong();
        int replayed = 0;

        Iterator<Map.Entry<FrameId, byte[]>> records = partition.range(lower, KeyBound.unbounded());
        while (records.hasNext()) {
            Frame frame = codec.decode(records.next().getValue());
            if (isExpired(frame, now)) {
                continue;
            }
            if (strategy.isPresent()) {
                strategy.get().keyFor(frame).ifPresent(key -> compacted.put(key, frame));
            } else {
                if (!channel.send(frame)) {
                    return false;
                }
                replayed++;
            }
        }

        for (Frame frame : compacted.values()) {
            if (!channel.send(frame)) {
                return false;
            }
            replayed++;
        }
        LOG.trace("Replayed {} frames", replayed);
        return true;
    }

    /**
     * Pulses are sent from the heartbeat thread, never through the command loop.
     * A pulse is skipped when the reader's buffer is full.
     */
    private void startHeartbeat(FrameChannel channel, Duration interval) {
        long millis = Math.max(1, interval.toMillis());
        AtomicReference<ScheduledFuture<?>> handle = new AtomicReference<>();
        Runnable pulse = () -> {
            if (channel.isDone()) {
                ScheduledFuture<?> future = handle.get();
                if (future != null) {
                    future.cancel(false);
                }
                return;
            }
            if (!channel.offer(Frame.pulse(ids.next()))) {
                LOG.trace("Pulse skipped, reader is behind");
            }
        };
        handle.set(heartbeats.scheduleWithFixedDelay(pulse, millis, millis, TimeUnit.MILLISECONDS));
    }

    /**
     * Keeps only the newest {@code count} persisted frames of {@code topic}.
     */
    private void retainHead(String topic, int count) {
        List<FrameId> surplus = new ArrayList<>();
        int seen = 0;
        Iterator<Map.Entry<FrameId, byte[]>> records =
                partition.rangeDescending(KeyBound.unbounded(), KeyBound.unbounded());
        while (records.hasNext()) {
            Frame frame = codec.decode(records.next().getValue());
            if (frame.topic().equals(topic) && ++seen > count) {
                surplus.add(frame.id());
            }
        }
        for (FrameId id : surplus) {
            partition.remove(id);
        }
        if (!surplus.isEmpty()) {
            LOG.debug("Head retention removed {} frames of topic {}", surplus.size(), topic);
        }
    }

    private void handleCollectExpired(CollectExpired command) {
        long now = clock.getAsLong();
        List<FrameId> expired = new ArrayList<>();
        Iterator<Map.Entry<FrameId, byte[]>> records = partition.range(KeyBound.unbounded(), KeyBound.unbounded());
        while (records.hasNext()) {
            Frame frame = codec.decode(records.next().getValue());
            if (isExpired(frame, now)) {
                expired.add(frame.id());
            }
        }
        for (FrameId id : expired) {
            partition.remove(id);
        }
        LOG.info("Collected {} expired frames", expired.size());
        command.reply().complete(expired.size());
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private static boolean isExpired(Frame frame, long now) {
        return frame.ttl() instanceof Ttl.Time
                && ((Ttl.Time) frame.ttl()).isExpired(frame.id().timestamp(), now);
    }

    private void submit(Command command) {
        ensureRunning();
        try {
            commands.put(command);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while submitting command", e);
        }
        // the loop may have drained the queue for the last time before our put landed
        if (!running && commands.remove(command)) {
            reject(command, closedException());
        }
    }

    private void rejectPending() {
        List<Command> pending = new ArrayList<>();
        commands.drainTo(pending);
        for (Command command : pending) {
            reject(command, closedException());
        }
    }

    private static void reject(Command command, RuntimeException cause) {
        if (command instanceof Append) {
            ((Append) command).reply().completeExceptionally(cause);
        } else if (command instanceof Read) {
            ((Read) command).channel().complete();
        } else if (command instanceof CollectExpired) {
            ((CollectExpired) command).reply().completeExceptionally(cause);
        }
    }

    private static <T> T await(CompletableFuture<T> reply) {
        try {
            return reply.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for the store", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new StorageException("Store command failed", cause);
        }
    }

    private IllegalStateException closedException() {
        return new IllegalStateException("store is closed", failure);
    }

    private void ensureRunning() {
        if (!isRunning()) {
            throw closedException();
        }
    }

    private void ensureOpen() {
        if (closeRequested.get()) {
            throw closedException();
        }
    }
}
