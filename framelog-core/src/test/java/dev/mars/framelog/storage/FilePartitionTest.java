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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FilePartition}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Point reads, inserts and removes</li>
 *   <li>Ordered range scans in both directions</li>
 *   <li>Recovery after restart, including torn tails</li>
 *   <li>Rollback of writes that fail in-process</li>
 *   <li>Log compaction</li>
 *   <li>Exclusive locking and size limits</li>
 * </ul>
 */
class FilePartitionTest {

    @TempDir
    Path tempDir;

    private StoreConfig config;
    private FilePartition partition;

    private final FrameId k1 = FrameId.of(1_000, 0, 1, 0);
    private final FrameId k2 = FrameId.of(1_000, 0, 2, 0);
    private final FrameId k3 = FrameId.of(2_000, 0, 0, 0);
    private final FrameId k4 = FrameId.of(3_000, 0, 0, 0);

    @BeforeEach
    void setUp() {
        config = StoreConfig.builder()
                .dataDir(tempDir)
                .syncEnabled(true)
                .minFreeSpaceMb(0)
                .maxFrameSizeMb(1)
                .build();
        partition = new FilePartition(config);
        partition.open(tempDir);
    }

    @AfterEach
    void tearDown() {
        if (partition != null) {
            partition.close();
        }
    }

    // ========================================================================
    // Point Operations
    // ========================================================================

    @Test
    void testGet_Missing_ReturnsEmpty() {
        assertTrue(partition.get(k1).isEmpty());
        assertEquals(0, partition.size());
    }

    @Test
    void testInsertAndGet() {
        partition.insert(k1, bytes("one"));

        assertEquals("one", string(partition.get(k1).orElseThrow()));
        assertEquals(1, partition.size());
    }

    @Test
    void testInsert_ReplacesExistingValue() {
        partition.insert(k1, bytes("one"));
        partition.insert(k1, bytes("uno"));

        assertEquals("uno", string(partition.get(k1).orElseThrow()));
        assertEquals(1, partition.size());
    }

    @Test
    void testRemove() {
        partition.insert(k1, bytes("one"));

        assertTrue(partition.remove(k1));
        assertFalse(partition.remove(k1));
        assertTrue(partition.get(k1).isEmpty());
    }

    @Test
    void testInsert_ValueTooLarge_Throws() {
        byte[] tooLarge = new byte[1024 * 1024 + 1];

        assertThrows(StorageException.class, () -> partition.insert(k1, tooLarge));
        assertEquals(0, partition.size());
    }

    @Test
    void testSync_WithoutSyncOnWrite_KeepsEntriesDurable() {
        StoreConfig lazy = StoreConfig.builder()
                .dataDir(tempDir)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .build();
        partition.close();
        partition = new FilePartition(lazy);
        partition.open(tempDir);

        partition.insert(k1, bytes("one"));
        partition.sync();
        partition.close();

        partition = new FilePartition(config);
        partition.open(tempDir);
        assertEquals("one", string(partition.get(k1).orElseThrow()));
    }

    @Test
    void testOperations_AfterClose_Throw() {
        partition.close();

        assertThrows(IllegalStateException.class, () -> partition.get(k1));
        assertThrows(IllegalStateException.class, () -> partition.insert(k1, bytes("x")));
        partition = null;
    }

    // ========================================================================
    // Range Scans
    // ========================================================================

    @Test
    void testRange_Unbounded_ReturnsKeyOrder() {
        insertAll();

        assertEquals(List.of(k1, k2, k3, k4), keys(partition.range(KeyBound.unbounded(), KeyBound.unbounded())));
    }

    @Test
    void testRange_ExclusiveLowerBound() {
        insertAll();

        assertEquals(List.of(k3, k4), keys(partition.range(KeyBound.excluded(k2), KeyBound.unbounded())));
        assertEquals(List.of(k2, k3, k4), keys(partition.range(KeyBound.included(k2), KeyBound.unbounded())));
    }

    @Test
    void testRange_BothBounds() {
        insertAll();

        assertEquals(List.of(k2, k3), keys(partition.range(KeyBound.included(k2), KeyBound.included(k3))));
        assertEquals(List.of(), keys(partition.range(KeyBound.excluded(k2), KeyBound.excluded(k3))));
        assertEquals(List.of(k2), keys(partition.range(KeyBound.included(k2), KeyBound.included(k2))));
        assertEquals(List.of(), keys(partition.range(KeyBound.included(k2), KeyBound.excluded(k2))));
        assertEquals(List.of(), keys(partition.range(KeyBound.included(k4), KeyBound.included(k1))));
    }

    @Test
    void testRangeDescending() {
        insertAll();

        assertEquals(List.of(k4, k3, k2, k1),
                keys(partition.rangeDescending(KeyBound.unbounded(), KeyBound.unbounded())));
        assertEquals(List.of(k2, k1),
                keys(partition.rangeDescending(KeyBound.unbounded(), KeyBound.excluded(k3))));
    }

    @Test
    void testRange_ReturnsValues() {
        insertAll();

        Iterator<Map.Entry<FrameId, byte[]>> it = partition.range(KeyBound.included(k3), KeyBound.unbounded());
        assertEquals("three", string(it.next().getValue()));
        assertEquals("four", string(it.next().getValue()));
        assertFalse(it.hasNext());
    }

    // ========================================================================
    // Recovery Tests
    // ========================================================================

    @Test
    void testEntries_SurviveRestart() {
        insertAll();
        partition.remove(k2);
        partition.close();

        partition = new FilePartition(config);
        partition.open(tempDir);

        assertEquals(List.of(k1, k3, k4), keys(partition.range(KeyBound.unbounded(), KeyBound.unbounded())));
        assertEquals("four", string(partition.get(k4).orElseThrow()));
    }

    @Test
    void testTornTail_IsTruncated() throws Exception {
        partition.insert(k1, bytes("one"));
        partition.insert(k2, bytes("two"));
        partition.close();

        Path log = tempDir.resolve(FilePartition.LOG_FILE);
        long validSize = Files.size(log);
        try (FileChannel ch = FileChannel.open(log, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ch.write(ByteBuffer.wrap(new byte[]{0x46, 0x52, 0x4D, 0x4C, 0, 1, 1}));
        }

        partition = new FilePartition(config);
        partition.open(tempDir);

        assertEquals(2, partition.size());
        assertEquals(validSize, Files.size(log));

        // appends after recovery land on a clean boundary
        partition.insert(k3, bytes("three"));
        partition.close();
        partition = new FilePartition(config);
        partition.open(tempDir);
        assertEquals(3, partition.size());
    }

    @Test
    void testCorruptLastRecord_IsDropped() throws Exception {
        partition.insert(k1, bytes("one"));
        partition.insert(k2, bytes("two"));
        partition.close();

        Path log = tempDir.resolve(FilePartition.LOG_FILE);
        long size = Files.size(log);
        try (FileChannel ch = FileChannel.open(log, StandardOpenOption.WRITE)) {
            // last byte of the final record's value
            ch.write(ByteBuffer.wrap(new byte[]{'X'}), size - 5);
        }

        partition = new FilePartition(config);
        partition.open(tempDir);

        assertEquals(List.of(k1), keys(partition.range(KeyBound.unbounded(), KeyBound.unbounded())));
    }

    @Test
    void testReplay_LoweredSizeLimit_KeepsLargeValues() {
        StoreConfig generous = StoreConfig.builder()
                .dataDir(tempDir)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .maxFrameSizeMb(2)
                .build();
        partition.close();
        partition = new FilePartition(generous);
        partition.open(tempDir);
        byte[] large = new byte[1536 * 1024];
        partition.insert(k1, large);
        partition.insert(k2, bytes("two"));
        partition.close();

        partition = new FilePartition(config);
        partition.open(tempDir);

        assertEquals(List.of(k1, k2), keys(partition.range(KeyBound.unbounded(), KeyBound.unbounded())));
        assertEquals(large.length, partition.get(k1).orElseThrow().length);
    }

    // ========================================================================
    // Failed Writes
    // ========================================================================

    @Test
    void testFailedWrite_IsRolledBack() {
        partition.insert(k1, bytes("one"));
        FaultInjectingChannel faults = reopenWithFaults();

        faults.failNextWriteAfter(10);
        assertThrows(StorageException.class, () -> partition.insert(k2, bytes("two")));
        assertTrue(partition.get(k2).isEmpty());

        partition.insert(k3, bytes("three"));
        partition.close();

        partition = new FilePartition(config);
        partition.open(tempDir);
        assertEquals(List.of(k1, k3), keys(partition.range(KeyBound.unbounded(), KeyBound.unbounded())));
        assertEquals("three", string(partition.get(k3).orElseThrow()));
    }

    @Test
    void testFailedSync_IsRolledBack() {
        partition.insert(k1, bytes("one"));
        FaultInjectingChannel faults = reopenWithFaults();

        faults.failNextForce();
        assertThrows(StorageException.class, () -> partition.insert(k2, bytes("two")));

        partition.insert(k3, bytes("three"));
        partition.close();

        partition = new FilePartition(config);
        partition.open(tempDir);
        assertEquals(List.of(k1, k3), keys(partition.range(KeyBound.unbounded(), KeyBound.unbounded())));
    }

    @Test
    void testFailedRemove_KeepsEntry() {
        partition.insert(k1, bytes("one"));
        FaultInjectingChannel faults = reopenWithFaults();

        faults.failNextWriteAfter(4);
        assertThrows(StorageException.class, () -> partition.remove(k1));
        assertEquals("one", string(partition.get(k1).orElseThrow()));

        partition.insert(k2, bytes("two"));
        partition.close();

        partition = new FilePartition(config);
        partition.open(tempDir);
        assertEquals(List.of(k1, k2), keys(partition.range(KeyBound.unbounded(), KeyBound.unbounded())));
    }

    // ========================================================================
    // Compaction
    // ========================================================================

    @Test
    void testCompact_KeepsOnlyLiveRecords() throws Exception {
        insertAll();
        partition.insert(k1, bytes("uno"));
        partition.remove(k2);
        Path log = tempDir.resolve(FilePartition.LOG_FILE);
        long before = Files.size(log);

        partition.compact();

        // header(27) + crc(4) per record: "uno", "three", "four"
        assertEquals(31 * 3 + 3 + 5 + 4, Files.size(log));
        assertTrue(Files.size(log) < before);
        assertFalse(Files.exists(tempDir.resolve(FilePartition.COMPACT_FILE)));
        assertEquals(List.of(k1, k3, k4), keys(partition.range(KeyBound.unbounded(), KeyBound.unbounded())));
        assertEquals("uno", string(partition.get(k1).orElseThrow()));

        partition.insert(k2, bytes("dos"));
        partition.close();
        partition = new FilePartition(config);
        partition.open(tempDir);

        assertEquals(List.of(k1, k2, k3, k4), keys(partition.range(KeyBound.unbounded(), KeyBound.unbounded())));
        assertEquals("dos", string(partition.get(k2).orElseThrow()));
        assertEquals("four", string(partition.get(k4).orElseThrow()));
    }

    @Test
    void testCompact_DuringScan_ReturnsCurrentValues() {
        insertAll();
        Iterator<Map.Entry<FrameId, byte[]>> it = partition.range(KeyBound.unbounded(), KeyBound.unbounded());
        assertEquals("one", string(it.next().getValue()));

        partition.remove(k2);
        partition.compact();

        assertEquals(k3, it.next().getKey());
        assertEquals("four", string(it.next().getValue()));
        assertFalse(it.hasNext());
    }

    @Test
    void testRepeatedReplacement_CompactsAutomatically() throws Exception {
        StoreConfig lazy = StoreConfig.builder()
                .dataDir(tempDir)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .build();
        partition.close();
        partition = new FilePartition(lazy);
        partition.open(tempDir);

        byte[] value = new byte[500];
        for (int i = 0; i < 3000; i++) {
            value[0] = (byte) i;
            value[1] = (byte) (i >> 8);
            partition.insert(k1, value);
        }

        // 3000 records of 531 bytes would be about 1.5 MB without compaction
        long size = Files.size(tempDir.resolve(FilePartition.LOG_FILE));
        assertTrue(size <= FilePartition.COMPACTION_MIN_DEAD_BYTES + 1024, "log size " + size);

        partition.close();
        partition = new FilePartition(lazy);
        partition.open(tempDir);
        assertEquals(1, partition.size());
        assertArrayEquals(value, partition.get(k1).orElseThrow());
    }

    @Test
    void testLeftoverCompactionFile_IsRemovedOnOpen() throws Exception {
        partition.insert(k1, bytes("one"));
        partition.close();
        Files.write(tempDir.resolve(FilePartition.COMPACT_FILE), bytes("partial"));

        partition = new FilePartition(config);
        partition.open(tempDir);

        assertFalse(Files.exists(tempDir.resolve(FilePartition.COMPACT_FILE)));
        assertEquals("one", string(partition.get(k1).orElseThrow()));
    }

    // ========================================================================
    // Locking
    // ========================================================================

    @Test
    void testSecondOpen_SameDirectory_Fails() {
        FilePartition other = new FilePartition(config);

        assertThrows(StorageException.class, () -> other.open(tempDir));
    }

    @Test
    void testLock_ReleasedOnClose() {
        partition.close();

        partition = new FilePartition(config);
        assertDoesNotThrow(() -> partition.open(tempDir));
    }

    @Test
    void testOpen_Twice_IsIgnored() {
        partition.insert(k1, bytes("one"));

        partition.open(tempDir);

        assertEquals(1, partition.size());
    }

    @Test
    void testOpen_InsufficientDiskSpace_Fails() {
        StoreConfig greedy = StoreConfig.builder()
                .dataDir(tempDir)
                .minFreeSpaceMb(Integer.MAX_VALUE)
                .build();
        FilePartition starved = new FilePartition(greedy);

        assertThrows(StorageException.class, () -> starved.open(tempDir.resolve("other")));
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private void insertAll() {
        partition.insert(k3, bytes("three"));
        partition.insert(k1, bytes("one"));
        partition.insert(k4, bytes("four"));
        partition.insert(k2, bytes("two"));
    }

    private FaultInjectingChannel reopenWithFaults() {
        partition.close();
        List<FaultInjectingChannel> opened = new ArrayList<>();
        partition = new FilePartition(config, channel -> {
            FaultInjectingChannel faulty = new FaultInjectingChannel(channel);
            opened.add(faulty);
            return faulty;
        });
        partition.open(tempDir);
        return opened.get(0);
    }

    private static List<FrameId> keys(Iterator<Map.Entry<FrameId, byte[]>> it) {
        List<FrameId> keys = new ArrayList<>();
        it.forEachRemaining(e -> keys.add(e.getKey()));
        return keys;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String string(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }
}
