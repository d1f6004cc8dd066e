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

import dev.mars.framelog.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Content-addressed blob store.
 * <p>
 * Payloads are stored under the SHA-256 digest of their bytes. Writes stream
 * into a temp file while the digest is computed and only become visible when
 * {@link CasWriter#commit()} renames the finished file into place, so readers
 * never observe partial content.
 * <p>
 * <b>Files:</b>
 * <pre>
 * cas/
 *  ├─ tmp/                          // in-progress writes
 *  └─ content/sha256/ab/cd/abcd...  // committed content, by hex digest
 * </pre>
 * <p>
 * <b>Thread Safety:</b> any number of writers and readers may work
 * concurrently; committing identical content twice is harmless.
 */
public final class ContentStore {

    private static final Logger LOG = LoggerFactory.getLogger(ContentStore.class);

    private static final String CONTENT_DIR = "content";
    private static final String TMP_DIR = "tmp";

    private final Path root;
    private final Path contentDir;
    private final Path tmpDir;
    private final boolean syncEnabled;

    public ContentStore(Path root, boolean syncEnabled) {
        this.root = root;
        this.contentDir = root.resolve(CONTENT_DIR).resolve(Integrity.SHA256);
        this.tmpDir = root.resolve(TMP_DIR);
        this.syncEnabled = syncEnabled;
    }

    /**
     * Creates the directory layout and discards writes abandoned by a previous run.
     */
    public void open() {
        try {
            Files.createDirectories(contentDir);
            Files.createDirectories(tmpDir);
            int stale = 0;
            try (var leftovers = Files.newDirectoryStream(tmpDir)) {
                for (Path leftover : leftovers) {
                    Files.deleteIfExists(leftover);
                    stale++;
                }
            }
            if (stale > 0) {
                LOG.warn("Discarded {} uncommitted content writes in {}", stale, tmpDir);
            }
            LOG.info("Content store opened at: {}", root);
        } catch (IOException e) {
            LOG.error("Failed to open content store at {}: {}", root, e.getMessage(), e);
            throw new StorageException("Failed to open content store at " + root, e);
        }
    }

    /**
     * Opens a streaming writer. The caller must either {@link CasWriter#commit()}
     * or {@link CasWriter#close()} it.
     */
    public CasWriter writer() throws IOException {
        return new CasWriter(this, Files.createTempFile(tmpDir, "write-", ".tmp"), syncEnabled);
    }

    /**
     * Opens committed content for reading.
     *
     * @return the stream, or empty if no content is stored under {@code hash}
     */
    public Optional<InputStream> reader(Integrity hash) throws IOException {
        try {
            return Optional.of(Files.newInputStream(pathFor(hash)));
        } catch (NoSuchFileException e) {
            LOG.debug("Content not found: {}", hash);
            return Optional.empty();
        }
    }

    /**
     * Stores a complete buffer.
     *
     * @return the digest it is stored under
     */
    public Integrity insert(byte[] content) throws IOException {
        try (CasWriter writer = writer()) {
            writer.write(content);
            return writer.commit();
        }
    }

    public Integrity insert(String content) throws IOException {
        return insert(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Reads complete content, verifying it against its digest.
     *
     * @return the bytes, or empty if no content is stored under {@code hash}
     * @throws StorageException if the stored bytes do not match {@code hash}
     */
    public Optional<byte[]> read(Integrity hash) throws IOException {
        Optional<InputStream> in = reader(hash);
        if (in.isEmpty()) {
            return Optional.empty();
        }
        byte[] content;
        try (InputStream stream = in.get()) {
            content = stream.readAllBytes();
        }
        Integrity actual = Integrity.of(content);
        if (!actual.equals(hash)) {
            LOG.error("Content integrity mismatch: expected={}, actual={}", hash, actual);
            throw new StorageException("Content integrity mismatch for " + hash + ": found " + actual);
        }
        return Optional.of(content);
    }

    public boolean contains(Integrity hash) {
        return Files.exists(pathFor(hash));
    }

    Path pathFor(Integrity hash) {
        String hex = hash.hex();
        return contentDir.resolve(hex.substring(0, 2)).resolve(hex.substring(2, 4)).resolve(hex);
    }
}
