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
package dev.mars.framelog.storage;

import dev.mars.framelog.frame.FrameId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.AbstractMap;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import java.util.zip.CRC32C;

/**
 * File-based implementation of {@link OrderedPartition}.
 * <p>
 * Every mutation is appended to a single CRC-protected record log; an
 * in-memory sorted index maps each live key to the position of its value in
 * that log. The index is rebuilt by replaying the log on {@link #open(Path)}.
 * <p>
 * <b>Files:</b>
 * <pre>
 * partition/
 *  ├─ partition.lock           // exclusive process lock
 *  ├─ partition.log            // append-only: PUT and REMOVE records
 *  └─ partition.log.compact    // compaction output, present only while compacting
 * </pre>
 * <p>
 * <b>Record format:</b>
 * <pre>
 * MAGIC(4) VERSION(2) TYPE(1) KEY(16) VALUE_LEN(4) VALUE(var) CRC32C(4)
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * Writes are serialized on this instance. Reads use positional file access and
 * the concurrent index, so they proceed alongside a writer; they only wait
 * while a compaction swaps the log file.
 * <p>
 * <b>Recovery:</b>
 * A torn or corrupt tail (partial header, partial value, CRC mismatch) ends
 * replay and is truncated away, so a crash mid-write loses at most the record
 * being written. A write that fails in-process is rolled back the same way
 * before the error is reported.
 * <p>
 * <b>Compaction:</b>
 * Replaced values and REMOVE records are dead weight. Once they reach 1 MiB
 * and half the log, the live records
 * are rewritten to a fresh file that atomically replaces the log.
 */
public final class FilePartition implements OrderedPartition {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FilePartition.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Magic number: 'FRML' in ASCII */
    private static final int MAGIC = 0x46524D4C;

    /** Record format version */
    private static final short VERSION = 1;

    /** Record type: insert or replace a key */
    private static final byte TYPE_PUT = 1;

    /** Record type: remove a key */
    private static final byte TYPE_REMOVE = 2;

    /** Header size: MAGIC(4) + VERSION(2) + TYPE(1) + KEY(16) + VALUE_LEN(4) */
    private static final int HEADER_SIZE = 4 + 2 + 1 + FrameId.BYTES + 4;

    /** CRC size */
    private static final int CRC_SIZE = 4;

    /** Lock file name */
    private static final String LOCK_FILE = "partition.lock";

    /** Log file name */
    static final String LOG_FILE = "partition.log";

    /** Compaction output, renamed over the log once complete */
    static final String COMPACT_FILE = LOG_FILE + ".compact";

    /** Dead bytes below which compaction is never triggered automatically */
    static final long COMPACTION_MIN_DEAD_BYTES = 1024 * 1024;

    // ========================================================================
    // State
    // ========================================================================

    /** Position of a live value inside the log file. */
    private record Slot(long offset, int length) {
    }

    private final ConcurrentSkipListMap<FrameId, Slot> index = new ConcurrentSkipListMap<>();
    /** Readers hold the read lock; compaction holds the write lock while it swaps files. */
    private final ReadWriteLock swapLock = new ReentrantReadWriteLock();
    private final UnaryOperator<FileChannel> channelDecorator;
    private final boolean syncEnabled;
    private final int maxValueSize;
    private final long minFreeSpace;

    private Path dir;
    private FileChannel logChannel;
    /** End of the last complete record; the next write starts here. */
    private long logEnd;
    /** Bytes of superseded PUTs and of REMOVE records still in the log. */
    private long deadBytes;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a new FilePartition with the specified configuration.
     *
     * @param config supplies sync policy, size limit and free-space threshold
     */
    public FilePartition(StoreConfig config) {
        this(config, UnaryOperator.identity());
    }

    /**
     * @param channelDecorator applied to every log channel this partition opens
     */
    FilePartition(StoreConfig config, UnaryOperator<FileChannel> channelDecorator) {
        this.channelDecorator = channelDecorator;
        this.syncEnabled = config.syncEnabled();
        this.maxValueSize = config.maxFrameSizeBytes();
        this.minFreeSpace = config.minFreeSpaceBytes();

        LOG.debug("FilePartition initialized: syncEnabled={}, maxValueSize={} MB, minFreeSpace={} MB",
                syncEnabled, maxValueSize / 1024 / 1024, minFreeSpace / 1024 / 1024);

        if (!syncEnabled) {
            LOG.warn("FilePartition created with fsync DISABLED. Do NOT use in production!");
        }
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    @Override
    public synchronized void open(Path dir) {
        if (logChannel != null) {
            LOG.debug("Partition already open at {}, ignoring duplicate open()", this.dir);
            return;
        }
        try {
            LOG.info("Opening partition at: {}", dir);
            this.dir = dir;
            Files.createDirectories(dir);

            acquireExclusiveLock();
            checkDiskSpace();

            if (Files.deleteIfExists(dir.resolve(COMPACT_FILE))) {
                LOG.warn("Removed leftover compaction file from an interrupted compaction");
            }

            Path logPath = dir.resolve(LOG_FILE);
            this.logChannel = channelDecorator.apply(FileChannel.open(logPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE));

            replay();

            logEnd = logChannel.size();
            logChannel.position(logEnd);
            LOG.info("Partition opened: path={}, size={} bytes, {} live entries, {} dead bytes",
                    logPath, logEnd, index.size(), deadBytes);

        } catch (IOException e) {
            LOG.error("Failed to open partition at {}: {}", dir, e.getMessage(), e);
            abandonOpen();
            throw new StorageException("Failed to open partition at " + dir, e);
        } catch (RuntimeException e) {
            abandonOpen();
            throw e;
        }
        maybeCompact();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            LOG.debug("Partition already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing partition at: {}", dir);
        try {
            if (logChannel != null && logChannel.isOpen()) {
                logChannel.force(true);
            }
        } catch (IOException e) {
            LOG.warn("Error syncing partition on close: {}", e.getMessage());
        }
        closeQuietly();
    }

    private void abandonOpen() {
        closeQuietly();
        logChannel = null;
        index.clear();
        deadBytes = 0;
    }

    private void closeQuietly() {
        try {
            if (logChannel != null) {
                logChannel.close();
                LOG.debug("Log channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Error closing log channel: {}", e.getMessage());
        }
        releaseExclusiveLock();
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Override
    public Optional<byte[]> get(FrameId key) {
        ensureOpen();
        return readLive(key);
    }

    @Override
    public Iterator<Map.Entry<FrameId, byte[]>> range(KeyBound lower, KeyBound upper) {
        ensureOpen();
        return entries(view(lower, upper));
    }

    @Override
    public Iterator<Map.Entry<FrameId, byte[]>> rangeDescending(KeyBound lower, KeyBound upper) {
        ensureOpen();
        return entries(view(lower, upper).descendingMap());
    }

    @Override
    public int size() {
        return index.size();
    }

    private NavigableMap<FrameId, Slot> view(KeyBound lower, KeyBound upper) {
        if (lower.isUnbounded() && upper.isUnbounded()) {
            return index;
        }
        if (lower.isUnbounded()) {
            return index.headMap(upper.key(), upper.isInclusive());
        }
        if (upper.isUnbounded()) {
            return index.tailMap(lower.key(), lower.isInclusive());
        }
        int cmp = lower.key().compareTo(upper.key());
        if (cmp > 0 || (cmp == 0 && !(lower.isInclusive() && upper.isInclusive()))) {
            return Collections.emptyNavigableMap();
        }
        return index.subMap(lower.key(), lower.isInclusive(), upper.key(), upper.isInclusive());
    }

    /**
     * Walks keys rather than slots: a slot is only meaningful against the log
     * file it was read with, so each value is looked up again under the swap
     * lock. Keys removed after the scan passed them are skipped.
     */
    private Iterator<Map.Entry<FrameId, byte[]>> entries(NavigableMap<FrameId, Slot> view) {
        Iterator<FrameId> keys = view.keySet().iterator();
        return new Iterator<>() {
            private Map.Entry<FrameId, byte[]> pending;

            @Override
            public boolean hasNext() {
                while (pending == null && keys.hasNext()) {
                    FrameId key = keys.next();
                    Optional<byte[]> value = readLive(key);
                    if (value.isPresent()) {
                        pending = new AbstractMap.SimpleImmutableEntry<>(key, value.get());
                    }
                }
                return pending != null;
            }

            @Override
            public Map.Entry<FrameId, byte[]> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Map.Entry<FrameId, byte[]> entry = pending;
                pending = null;
                return entry;
            }
        };
    }

    private Optional<byte[]> readLive(FrameId key) {
        swapLock.readLock().lock();
        try {
            Slot slot = index.get(key);
            return slot == null ? Optional.empty() : Optional.of(readValue(slot));
        } finally {
            swapLock.readLock().unlock();
        }
    }

    private byte[] readValue(Slot slot) {
        ByteBuffer buf = ByteBuffer.allocate(slot.length());
        try {
            while (buf.hasRemaining()) {
                int n = logChannel.read(buf, slot.offset() + buf.position());
                if (n < 0) {
                    throw new StorageException("Unexpected end of partition log at offset " + slot.offset());
                }
            }
        } catch (IOException e) {
            LOG.error("Failed to read value at offset {}: {}", slot.offset(), e.getMessage(), e);
            throw new StorageException("Failed to read partition value", e);
        }
        return buf.array();
    }

    // ========================================================================
    // Writes
    // ========================================================================

    @Override
    public synchronized void insert(FrameId key, byte[] value) {
        ensureOpen();
        if (value.length > maxValueSize) {
            LOG.error("Value too large: {} bytes (max: {})", value.length, maxValueSize);
            throw new StorageException("Value too large: " + value.length +
                    " bytes (max: " + maxValueSize + ")");
        }
        try {
            long position = writeRecord(TYPE_PUT, key, value);
            Slot previous = index.put(key, new Slot(position + HEADER_SIZE, value.length));
            if (previous != null) {
                deadBytes += recordSize(previous.length());
            }
            LOG.trace("PUT {} ({} bytes) at position {}", key, value.length, position);
        } catch (IOException e) {
            LOG.error("Failed to insert {}: {}", key, e.getMessage(), e);
            throw new StorageException("Failed to insert " + key, e);
        }
        maybeCompact();
    }

    @Override
    public synchronized boolean remove(FrameId key) {
        ensureOpen();
        if (!index.containsKey(key)) {
            return false;
        }
        try {
            writeRecord(TYPE_REMOVE, key, new byte[0]);
            Slot previous = index.remove(key);
            deadBytes += recordSize(previous.length()) + recordSize(0);
            LOG.trace("REMOVE {}", key);
        } catch (IOException e) {
            LOG.error("Failed to remove {}: {}", key, e.getMessage(), e);
            throw new StorageException("Failed to remove " + key, e);
        }
        maybeCompact();
        return true;
    }

    @Override
    public synchronized void sync() {
        ensureOpen();
        try {
            long startNanos = System.nanoTime();
            logChannel.force(true);
            LOG.debug("Partition synced to disk in {} us", (System.nanoTime() - startNanos) / 1000);
        } catch (IOException e) {
            LOG.error("Failed to sync partition: {}", e.getMessage(), e);
            throw new StorageException("Failed to sync partition", e);
        }
    }

    @Override
    public synchronized void compact() {
        ensureOpen();
        long startTime = System.currentTimeMillis();
        long sizeBefore = logEnd;
        Path logPath = dir.resolve(LOG_FILE);
        Path compactPath = dir.resolve(COMPACT_FILE);

        FileChannel compacted = null;
        Map<FrameId, Slot> relocated = new HashMap<>();
        long end = 0;
        try {
            compacted = channelDecorator.apply(FileChannel.open(compactPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE));
            for (Map.Entry<FrameId, Slot> entry : index.entrySet()) {
                byte[] value = readValue(entry.getValue());
                ByteBuffer buf = encodeRecord(TYPE_PUT, entry.getKey(), value);
                while (buf.hasRemaining()) {
                    compacted.write(buf);
                }
                relocated.put(entry.getKey(), new Slot(end + HEADER_SIZE, value.length));
                end += recordSize(value.length);
            }
            compacted.force(true);
        } catch (IOException | RuntimeException e) {
            discardCompaction(compacted, compactPath);
            LOG.error("Compaction failed, keeping the current log: {}", e.getMessage(), e);
            throw new StorageException("Failed to compact partition at " + dir, e);
        }

        FileChannel previous;
        swapLock.writeLock().lock();
        try {
            Files.move(compactPath, logPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            previous = logChannel;
            logChannel = compacted;
            logEnd = end;
            index.putAll(relocated);
            deadBytes = 0;
        } catch (IOException e) {
            discardCompaction(compacted, compactPath);
            LOG.error("Could not replace log with compacted file: {}", e.getMessage(), e);
            throw new StorageException("Failed to compact partition at " + dir, e);
        } finally {
            swapLock.writeLock().unlock();
        }

        if (syncEnabled) {
            syncDirectory();
        }
        try {
            previous.close();
        } catch (IOException e) {
            LOG.warn("Error closing replaced log channel: {}", e.getMessage());
        }
        LOG.info("Partition compacted: {} -> {} bytes, {} live entries, {} ms",
                sizeBefore, end, index.size(), System.currentTimeMillis() - startTime);
    }

    /**
     * Compacts once dead records reach the floor and make up half the log.
     * A failed compaction leaves the log as it was, so the write that
     * triggered it still stands.
     */
    private void maybeCompact() {
        if (deadBytes < COMPACTION_MIN_DEAD_BYTES || deadBytes * 2 < logEnd) {
            return;
        }
        LOG.debug("Compacting: {} of {} bytes are dead", deadBytes, logEnd);
        try {
            compact();
        } catch (StorageException e) {
            LOG.error("Automatic compaction failed, will retry on a later write: {}", e.getMessage());
        }
    }

    private void discardCompaction(FileChannel compacted, Path compactPath) {
        try {
            if (compacted != null) {
                compacted.close();
            }
            Files.deleteIfExists(compactPath);
        } catch (IOException e) {
            LOG.warn("Could not remove compaction file {}: {}", compactPath, e.getMessage());
        }
    }

    /**
     * Makes the rename durable. Skipped on Windows, where directories cannot be
     * opened as channels.
     */
    private void syncDirectory() {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Writes a single record at the end of the log. If the write or its fsync
     * fails, the log is truncated back to where the record started so no
     * partial record sits in front of later writes.
     *
     * @return the position the record starts at
     */
    private long writeRecord(byte type, FrameId key, byte[] value) throws IOException {
        int recordSize = recordSize(value.length);

        // Pre-flight disk space check for large writes
        if (recordSize > 1024 * 1024) {
            LOG.debug("Large write detected ({} bytes), checking disk space", recordSize);
            checkDiskSpace();
        }

        ByteBuffer buf = encodeRecord(type, key, value);
        long position = logEnd;
        try {
            while (buf.hasRemaining()) {
                logChannel.write(buf);
            }
            if (syncEnabled) {
                logChannel.force(false);
            }
        } catch (IOException e) {
            rollBack(position, e);
            throw e;
        }
        logEnd = position + recordSize;
        return position;
    }

    private void rollBack(long position, IOException cause) {
        try {
            logChannel.truncate(position);
            logChannel.position(position);
            LOG.warn("Rolled back incomplete record at position {}", position);
        } catch (IOException e) {
            cause.addSuppressed(e);
            // later records would land behind the partial one and be lost on replay
            LOG.error("Could not roll back incomplete record at position {}, closing partition: {}",
                    position, e.getMessage(), e);
            closed = true;
            closeQuietly();
        }
    }

    private static ByteBuffer encodeRecord(byte type, FrameId key, byte[] value) {
        ByteBuffer buf = ByteBuffer.allocate(recordSize(value.length));
        buf.putInt(MAGIC);
        buf.putShort(VERSION);
        buf.put(type);
        buf.putLong(key.msb());
        buf.putLong(key.lsb());
        buf.putInt(value.length);
        buf.put(value);

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, HEADER_SIZE + value.length);
        buf.putInt((int) crc.getValue());
        buf.flip();
        return buf;
    }

    private static int recordSize(int valueLength) {
        return HEADER_SIZE + valueLength + CRC_SIZE;
    }

    // ========================================================================
    // Replay
    // ========================================================================

    /**
     * Rebuilds the index from the log and truncates any torn tail.
     */
    private void replay() throws IOException {
        long startTime = System.currentTimeMillis();
        long fileSize = logChannel.size();
        long pos = 0;
        int puts = 0;
        int removes = 0;
        ByteBuffer headerBuf = ByteBuffer.allocate(HEADER_SIZE);

        while (true) {
            headerBuf.clear();
            int headerRead = readFully(headerBuf, pos);
            if (headerRead < HEADER_SIZE) {
                if (headerRead > 0) {
                    LOG.debug("Incomplete header at pos {}: read {} bytes, expected {}",
                            pos, headerRead, HEADER_SIZE);
                }
                break;
            }
            headerBuf.flip();

            int magic = headerBuf.getInt();
            short version = headerBuf.getShort();
            byte type = headerBuf.get();
            FrameId key = new FrameId(headerBuf.getLong(), headerBuf.getLong());
            int valueLen = headerBuf.getInt();

            if (magic != MAGIC || version != VERSION) {
                LOG.warn("Invalid header at pos {}: magic=0x{}, version={}",
                        pos, Integer.toHexString(magic), version);
                break;
            }
            // bounded by the file rather than maxValueSize, so lowering the limit keeps existing data
            if (valueLen < 0 || valueLen > fileSize - pos - HEADER_SIZE - CRC_SIZE) {
                LOG.warn("Invalid value length at pos {}: {}", pos, valueLen);
                break;
            }

            ByteBuffer body = ByteBuffer.allocate(valueLen + CRC_SIZE);
            if (readFully(body, pos + HEADER_SIZE) < valueLen + CRC_SIZE) {
                LOG.debug("Incomplete record body at pos {}", pos);
                break;
            }
            body.flip();

            CRC32C crc = new CRC32C();
            headerBuf.rewind();
            crc.update(headerBuf);
            crc.update(body.array(), 0, valueLen);
            int expectedCrc = body.getInt(valueLen);
            if ((int) crc.getValue() != expectedCrc) {
                LOG.warn("CRC mismatch at pos {}: expected={}, computed={}",
                        pos, expectedCrc, (int) crc.getValue());
                break;
            }

            if (type == TYPE_PUT) {
                Slot previous = index.put(key, new Slot(pos + HEADER_SIZE, valueLen));
                if (previous != null) {
                    deadBytes += recordSize(previous.length());
                }
                puts++;
            } else if (type == TYPE_REMOVE) {
                Slot previous = index.remove(key);
                if (previous != null) {
                    deadBytes += recordSize(previous.length());
                }
                deadBytes += recordSize(0);
                removes++;
            } else {
                LOG.warn("Unknown record type at pos {}: {}", pos, type);
                break;
            }

            pos += recordSize(valueLen);
        }

        if (pos < fileSize) {
            LOG.warn("Truncating torn tail: {} bytes removed (file was {} bytes, valid data {} bytes)",
                    fileSize - pos, fileSize, pos);
            logChannel.truncate(pos);
            logChannel.force(true);
        }

        LOG.info("Partition replay complete: {} puts, {} removes, {} live entries, {} ms",
                puts, removes, index.size(), System.currentTimeMillis() - startTime);
    }

    private int readFully(ByteBuffer buf, long position) throws IOException {
        int total = 0;
        while (buf.hasRemaining()) {
            int n = logChannel.read(buf, position + total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void ensureOpen() {
        if (closed || logChannel == null) {
            throw new IllegalStateException("Partition is not open");
        }
    }

    /**
     * Acquires an exclusive lock on the partition directory to prevent multiple processes.
     *
     * @throws StorageException if the lock is held elsewhere
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = dir.resolve(LOCK_FILE);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException(
                        "Cannot acquire exclusive lock on partition directory: " + dir +
                        ". Another process may be using this storage.");
            }
            LOG.debug("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException(
                    "Cannot acquire exclusive lock: lock already held in this JVM", e);
        }
    }

    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws StorageException if disk space is below minimum threshold
     */
    private void checkDiskSpace() throws IOException {
        FileStore store = Files.getFileStore(dir);
        long usableSpace = store.getUsableSpace();
        if (usableSpace < minFreeSpace) {
            long usableSpaceMb = usableSpace / 1024 / 1024;
            long minFreeSpaceMb = minFreeSpace / 1024 / 1024;
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, minFreeSpaceMb);
            throw new StorageException(
                    "Insufficient disk space: " + usableSpaceMb + " MB available, " +
                    "need at least " + minFreeSpaceMb + " MB.");
        }
    }
}
