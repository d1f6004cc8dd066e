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

import java.io.Closeable;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Durable, sorted key-value store backing the frame log.
 * <p>
 * Keys are {@link FrameId}s, values are opaque encoded frames. Range scans
 * return entries in key order, which is append order.
 * <p>
 * The store writes through a single thread, so implementations only need to
 * make reads safe against one concurrent writer.
 * <p>
 * <b>Critical Contract:</b> an entry becomes visible to {@link #get} and range
 * scans only after its record has been written, and {@link #close()} makes
 * everything written so far durable.
 *
 * @see FilePartition
 */
public interface OrderedPartition extends Closeable {

    /**
     * Opens the partition, replaying existing state. Must be called once before use.
     *
     * @param dir directory holding the partition files
     */
    void open(Path dir);

    /**
     * Point lookup.
     *
     * @return the value, or empty if the key is absent
     */
    Optional<byte[]> get(FrameId key);

    /**
     * Inserts or replaces the value for {@code key}.
     */
    void insert(FrameId key, byte[] value);

    /**
     * Removes {@code key}.
     *
     * @return true if the key was present
     */
    boolean remove(FrameId key);

    /**
     * Ascending scan between two bounds. The iterator is weakly consistent: it
     * never fails because of concurrent writes.
     */
    Iterator<Map.Entry<FrameId, byte[]>> range(KeyBound lower, KeyBound upper);

    /**
     * Descending scan between two bounds.
     */
    Iterator<Map.Entry<FrameId, byte[]>> rangeDescending(KeyBound lower, KeyBound upper);

    /** Number of live entries. */
    int size();

    /**
     * Forces everything written so far to physical disk.
     */
    void sync();

    /**
     * Rewrites storage so it holds only live entries, reclaiming the space of
     * replaced and removed values. Contents and order are unchanged. On failure
     * the partition is left as it was.
     */
    void compact();

    /**
     * Syncs and releases all resources. After close, no other methods should be called.
     */
    @Override
    void close();
}
