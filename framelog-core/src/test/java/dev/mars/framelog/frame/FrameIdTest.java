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
package dev.mars.framelog.frame;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FrameId} and {@link FrameIdGenerator}.
 */
class FrameIdTest {

    @Nested
    @DisplayName("Text and byte forms")
    class Encoding {

        @Test
        @DisplayName("Known identifier parses and formats back unchanged")
        void parseAndFormat() {
            FrameId id = FrameId.parse("03BIDZVKNOTGJPVUEW3K23G45");
            assertEquals("03BIDZVKNOTGJPVUEW3K23G45", id.toString());
        }

        @Test
        @DisplayName("Lower-case text is accepted")
        void lowerCase() {
            assertEquals(FrameId.parse("03BIDZVKNOTGJPVUEW3K23G45"),
                    FrameId.parse("03bidzvknotgjpvuew3k23g45"));
        }

        @Test
        @DisplayName("Wrong length, bad characters and overflow are rejected")
        void invalidText() {
            assertThrows(IllegalArgumentException.class, () -> FrameId.parse("123"));
            assertThrows(IllegalArgumentException.class, () -> FrameId.parse(null));
            assertThrows(IllegalArgumentException.class, () -> FrameId.parse("03BIDZVKNOTGJPVUEW3K23G4-"));
            assertThrows(IllegalArgumentException.class, () -> FrameId.parse("ZZZZZZZZZZZZZZZZZZZZZZZZZ"));
        }

        @Test
        @DisplayName("Fields survive assembly")
        void fields() {
            FrameId id = FrameId.of(1_700_000_000_000L, 0xABCDEF, 0x123456, 0xCAFEBABE);

            assertEquals(1_700_000_000_000L, id.timestamp());
            assertEquals(0xABCDEF, id.counterHi());
            assertEquals(0x123456, id.counterLo());
            assertEquals(0xCAFEBABE, id.entropy());
        }

        @Test
        @DisplayName("Byte form round-trips and text is always 25 characters")
        void bytes() {
            FrameId small = FrameId.of(1, 0, 0, 0);
            assertEquals(small, FrameId.fromBytes(small.toBytes()));
            assertEquals(FrameId.TEXT_LENGTH, small.toString().length());
            assertEquals(small, FrameId.parse(small.toString()));
            assertThrows(IllegalArgumentException.class, () -> FrameId.fromBytes(new byte[3]));
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Comparison, text order and time order agree")
        void ordersAgree() {
            FrameId earlier = FrameId.of(1_000, 5, 5, -1);
            FrameId later = FrameId.of(1_001, 0, 0, 0);

            assertTrue(earlier.compareTo(later) < 0);
            assertTrue(earlier.toString().compareTo(later.toString()) < 0);
        }

        @Test
        @DisplayName("High bit set in the lower half still sorts unsigned")
        void unsignedComparison() {
            FrameId low = FrameId.of(1_000, 0x7F, 0, 0);
            FrameId high = FrameId.of(1_000, 0x80, 0, 0);

            assertTrue(low.compareTo(high) < 0);
        }
    }

    @Nested
    @DisplayName("Generator")
    class Generator {

        @Test
        @DisplayName("Identifiers minted in the same millisecond are strictly increasing")
        void monotonicWithinMillisecond() {
            FrameIdGenerator generator = new FrameIdGenerator(() -> 42_000L, new Random(7));

            FrameId previous = generator.next();
            for (int i = 0; i < 10_000; i++) {
                FrameId next = generator.next();
                assertTrue(previous.compareTo(next) < 0, "ids must increase");
                previous = next;
            }
        }

        @Test
        @DisplayName("Small clock rollback keeps the previous timestamp")
        void smallRollback() {
            AtomicLong clock = new AtomicLong(100_000L);
            FrameIdGenerator generator = new FrameIdGenerator(clock::get, new Random(1));

            FrameId before = generator.next();
            clock.set(99_000L);
            FrameId after = generator.next();

            assertTrue(before.compareTo(after) < 0);
            assertEquals(100_000L, after.timestamp());
        }

        @Test
        @DisplayName("Large clock rollback resets to the new time")
        void largeRollback() {
            AtomicLong clock = new AtomicLong(100_000L);
            FrameIdGenerator generator = new FrameIdGenerator(clock::get, new Random(1));

            generator.next();
            clock.set(100_000L - FrameIdGenerator.ROLLBACK_ALLOWANCE_MS - 1);

            assertEquals(clock.get(), generator.next().timestamp());
        }

        @Test
        @DisplayName("Identifiers minted after advancePast sort after the given identifier")
        void advancePast() {
            FrameIdGenerator generator = new FrameIdGenerator(() -> 5_000L, new Random(3));
            FrameId persisted = FrameId.of(5_000L, 0xFFFFFF, 0xFFFFF0, 0);

            generator.advancePast(persisted);

            assertTrue(persisted.compareTo(generator.next()) < 0);
        }

        @Test
        @DisplayName("Concurrent callers never receive duplicates")
        void concurrentUnique() throws Exception {
            FrameIdGenerator generator = new FrameIdGenerator();
            List<FrameId> ids = java.util.Collections.synchronizedList(new ArrayList<>());
            List<Thread> threads = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                Thread thread = new Thread(() -> {
                    for (int i = 0; i < 1_000; i++) {
                        ids.add(generator.next());
                    }
                });
                threads.add(thread);
                thread.start();
            }
            for (Thread thread : threads) {
                thread.join();
            }

            assertEquals(4_000, ids.stream().distinct().count());
        }
    }
}
