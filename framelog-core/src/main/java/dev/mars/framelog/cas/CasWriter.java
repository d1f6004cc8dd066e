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
package dev.mars.framelog.cas;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;

/**
 * Streaming writer into the {@link ContentStore}.
 * <p>
 * Bytes go to a private temp file while the digest is updated incrementally.
 * {@link #commit()} syncs the file and atomically renames it to its
 * content address; {@link #close()} without a commit deletes the temp file,
 * so an abandoned write leaves nothing visible.
 * <pre>{@code
 * try (CasWriter writer = store.casWriter()) {
 *     writer.write(chunk1);
 *     writer.write(chunk2);
 *     Integrity hash = writer.commit();
 * }
 * }</pre>
 * Not thread-safe: one writer per producing thread.
 */
public final class CasWriter implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(CasWriter.class);

    private final ContentStore store;
    private final Path tmpPath;
    private final FileChannel channel;
    private final MessageDigest digest;
    private final boolean syncEnabled;

    private long size;
    private Integrity committed;
    private boolean closed;

    CasWriter(ContentStore store, Path tmpPath, boolean syncEnabled) throws IOException {
        this.store = store;
        this.tmpPath = tmpPath;
        this.syncEnabled = syncEnabled;
        this.digest = Integrity.newDigest();
        this.channel = FileChannel.open(tmpPath, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    public void write(byte[] bytes) throws IOException {
        write(bytes, 0, bytes.length);
    }

    public void write(byte[] bytes, int offset, int length) throws IOException {
        ensureWritable();
        ByteBuffer buf = ByteBuffer.wrap(bytes, offset, length);
        while (buf.hasRemaining()) {
            channel.write(buf);
        }
        digest.update(bytes, offset, length);
        size += length;
    }

    /** Bytes written so far. */
    public long size() {
        return size;
    }

    /**
     * Makes the written bytes durable under their digest.
     *
     * @return the digest the content is now stored under
     */
    public Integrity commit() throws IOException {
        ensureWritable();
        if (syncEnabled) {
            channel.force(true);
        }
        channel.close();
        closed = true;

        Integrity hash = Integrity.sha256(digest.digest());
        Path target = store.pathFor(hash);
        Files.createDirectories(target.getParent());
        try {
            Files.move(tmpPath, target, StandardCopyOption.ATOMIC_MOVE);
            if (syncEnabled) {
                syncDirectory(target.getParent());
            }
            LOG.debug("Committed {} bytes as {}", size, hash);
        } catch (FileAlreadyExistsException e) {
            Files.deleteIfExists(tmpPath);
            LOG.debug("Content {} already stored, discarded duplicate write", hash);
        }
        committed = hash;
        return hash;
    }

    /**
     * Discards the write unless it was committed.
     */
    @Override
    public void close() throws IOException {
        if (committed != null) {
            return;
        }
        if (!closed) {
            closed = true;
            channel.close();
        }
        if (Files.deleteIfExists(tmpPath)) {
            LOG.debug("Discarded uncommitted write of {} bytes", size);
        }
    }

    private void ensureWritable() {
        if (closed) {
            throw new IllegalStateException(committed != null ? "Writer already committed" : "Writer is closed");
        }
    }

    /**
     * Fsyncs a directory so the rename survives a crash.
     * <p>
     * Skipped on Windows, where directories cannot be opened as channels.
     */
    private static void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
        } catch (IOException e) {
            // Some systems don't support directory fsync - log but continue
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }
}
