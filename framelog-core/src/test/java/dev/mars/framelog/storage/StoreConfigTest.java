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

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StoreConfig resolution: builder values, system properties and defaults.
 */
class StoreConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("framelog.dataDir");
        System.clearProperty("framelog.syncEnabled");
        System.clearProperty("framelog.minFreeSpaceMb");
        System.clearProperty("framelog.maxFrameSizeMb");
        System.clearProperty("framelog.commandQueueCapacity");
        System.clearProperty("framelog.readBufferCapacity");
    }

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property dataDir is respected")
        void testDataDirSystemProperty() {
            Path customDir = tempDir.resolve("custom-data");
            System.setProperty("framelog.dataDir", customDir.toString());

            assertEquals(customDir, StoreConfig.builder().build().dataDir());
        }

        @Test
        @DisplayName("System property syncEnabled=false is respected")
        void testSyncEnabledSystemProperty() {
            System.setProperty("framelog.syncEnabled", "false");

            assertFalse(StoreConfig.builder().build().syncEnabled());
        }

        @Test
        @DisplayName("Numeric system properties are respected")
        void testNumericSystemProperties() {
            System.setProperty("framelog.minFreeSpaceMb", "5");
            System.setProperty("framelog.maxFrameSizeMb", "2");
            System.setProperty("framelog.commandQueueCapacity", "8");
            System.setProperty("framelog.readBufferCapacity", "3");

            StoreConfig config = StoreConfig.builder().build();

            assertEquals(5, config.minFreeSpaceMb());
            assertEquals(2, config.maxFrameSizeMb());
            assertEquals(8, config.commandQueueCapacity());
            assertEquals(3, config.readBufferCapacity());
            assertEquals(2 * 1024 * 1024, config.maxFrameSizeBytes());
            assertEquals(5L * 1024 * 1024, config.minFreeSpaceBytes());
        }

        @Test
        @DisplayName("Non-numeric value falls back to the default")
        void testNonNumericFallsBack() {
            System.setProperty("framelog.readBufferCapacity", "lots");

            assertEquals(100, StoreConfig.builder().build().readBufferCapacity());
        }
    }

    @Nested
    @DisplayName("Builder Precedence")
    class BuilderTests {

        @Test
        @DisplayName("Builder values win over system properties")
        void testBuilderOverridesSystemProperty() {
            System.setProperty("framelog.dataDir", tempDir.resolve("from-property").toString());
            System.setProperty("framelog.commandQueueCapacity", "8");

            StoreConfig config = StoreConfig.builder()
                    .dataDir(tempDir.resolve("from-builder"))
                    .commandQueueCapacity(4)
                    .build();

            assertEquals(tempDir.resolve("from-builder"), config.dataDir());
            assertEquals(4, config.commandQueueCapacity());
        }

        @Test
        @DisplayName("String dataDir is converted to a path")
        void testStringDataDir() {
            StoreConfig config = StoreConfig.builder().dataDir(tempDir.toString()).build();

            assertEquals(tempDir, config.dataDir());
        }

        @Test
        @DisplayName("Zero capacities are rejected")
        void testZeroCapacityRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> StoreConfig.builder().commandQueueCapacity(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> StoreConfig.builder().readBufferCapacity(0).build());
        }

        @Test
        @DisplayName("Frame size limit must stay within an int byte count")
        void testMaxFrameSizeBounds() {
            assertThrows(IllegalArgumentException.class,
                    () -> StoreConfig.builder().maxFrameSizeMb(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> StoreConfig.builder().maxFrameSizeMb(-1).build());
            assertThrows(IllegalArgumentException.class,
                    () -> StoreConfig.builder().maxFrameSizeMb(2048).build());

            StoreConfig largest = StoreConfig.builder().maxFrameSizeMb(2047).build();
            assertEquals(2047 * 1024 * 1024, largest.maxFrameSizeBytes());
            assertTrue(largest.maxFrameSizeBytes() > 0);
        }

        @Test
        @DisplayName("Negative free-space floor is rejected, zero disables the check")
        void testMinFreeSpaceBounds() {
            assertThrows(IllegalArgumentException.class,
                    () -> StoreConfig.builder().minFreeSpaceMb(-1).build());

            assertEquals(0L, StoreConfig.builder().minFreeSpaceMb(0).build().minFreeSpaceBytes());
        }

        @Test
        @DisplayName("Out-of-range system property is rejected")
        void testMaxFrameSizeSystemPropertyRejected() {
            System.setProperty("framelog.maxFrameSizeMb", "4096");

            assertThrows(IllegalArgumentException.class, () -> StoreConfig.builder().build());
        }

        @Test
        @DisplayName("toString names the data directory")
        void testToString() {
            StoreConfig config = StoreConfig.builder().dataDir(tempDir).build();

            assertTrue(config.toString().contains(tempDir.toString()));
        }
    }
}
