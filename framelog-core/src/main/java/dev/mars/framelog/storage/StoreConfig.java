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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for a frame store.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dframelog.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code FRAMELOG_DATA_DIR})</li>
 *   <li>Properties file ({@code framelog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>framelog.dataDir</td><td>FRAMELOG_DATA_DIR</td><td>~/.framelog/data</td></tr>
 *   <tr><td>syncEnabled</td><td>framelog.syncEnabled</td><td>FRAMELOG_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>framelog.minFreeSpaceMb</td><td>FRAMELOG_MIN_FREE_SPACE_MB</td><td>64</td></tr>
 *   <tr><td>maxFrameSizeMb</td><td>framelog.maxFrameSizeMb</td><td>FRAMELOG_MAX_FRAME_SIZE_MB</td><td>16</td></tr>
 *   <tr><td>commandQueueCapacity</td><td>framelog.commandQueueCapacity</td><td>FRAMELOG_COMMAND_QUEUE_CAPACITY</td><td>32</td></tr>
 *   <tr><td>readBufferCapacity</td><td>framelog.readBufferCapacity</td><td>FRAMELOG_READ_BUFFER_CAPACITY</td><td>100</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # framelog.properties
 * framelog.dataDir=/var/lib/framelog
 * framelog.syncEnabled=true
 * framelog.commandQueueCapacity=32
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * StoreConfig config = StoreConfig.builder()
 *     .dataDir(Path.of("/var/lib/framelog"))
 *     .syncEnabled(false)
 *     .build();
 *
 * Store store = Store.spawn(config);
 * </pre>
 */
public final class StoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StoreConfig.class);

    private static final String PROPERTIES_FILE = "framelog.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "framelog.dataDir";
    private static final String PROP_SYNC_ENABLED = "framelog.syncEnabled";
    private static final String PROP_MIN_FREE_SPACE_MB = "framelog.minFreeSpaceMb";
    private static final String PROP_MAX_FRAME_SIZE_MB = "framelog.maxFrameSizeMb";
    private static final String PROP_COMMAND_QUEUE_CAPACITY = "framelog.commandQueueCapacity";
    private static final String PROP_READ_BUFFER_CAPACITY = "framelog.readBufferCapacity";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "FRAMELOG_DATA_DIR";
    private static final String ENV_SYNC_ENABLED = "FRAMELOG_SYNC_ENABLED";
    private static final String ENV_MIN_FREE_SPACE_MB = "FRAMELOG_MIN_FREE_SPACE_MB";
    private static final String ENV_MAX_FRAME_SIZE_MB = "FRAMELOG_MAX_FRAME_SIZE_MB";
    private static final String ENV_COMMAND_QUEUE_CAPACITY = "FRAMELOG_COMMAND_QUEUE_CAPACITY";
    private static final String ENV_READ_BUFFER_CAPACITY = "FRAMELOG_READ_BUFFER_CAPACITY";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".framelog", "data");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 64;
    private static final int DEFAULT_MAX_FRAME_SIZE_MB = 16;
    private static final int DEFAULT_COMMAND_QUEUE_CAPACITY = 32;
    private static final int DEFAULT_READ_BUFFER_CAPACITY = 100;

    /** Largest frame size limit whose byte count still fits in an {@code int}. */
    static final int MAX_FRAME_SIZE_MB_LIMIT = 2047;

    private final Path dataDir;
    private final boolean syncEnabled;
    private final int minFreeSpaceMb;
    private final int maxFrameSizeMb;
    private final int commandQueueCapacity;
    private final int readBufferCapacity;

    private StoreConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.syncEnabled = builder.syncEnabled;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.maxFrameSizeMb = builder.maxFrameSizeMb;
        this.commandQueueCapacity = builder.commandQueueCapacity;
        this.readBufferCapacity = builder.readBufferCapacity;
    }

    /** Root directory; the partition and the content store live in subdirectories. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether every partition write and content commit is fsynced. */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Minimum free disk space in MB required before writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum encoded frame size in MB. */
    public int maxFrameSizeMb() {
        return maxFrameSizeMb;
    }

    /** Capacity of the store's command queue; senders block when it is full. */
    public int commandQueueCapacity() {
        return commandQueueCapacity;
    }

    /** Capacity of each read channel; the store blocks when a reader falls this far behind. */
    public int readBufferCapacity() {
        return readBufferCapacity;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Maximum encoded frame size in bytes. */
    public int maxFrameSizeBytes() {
        return maxFrameSizeMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "StoreConfig{" +
                "dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxFrameSizeMb=" + maxFrameSizeMb +
                ", commandQueueCapacity=" + commandQueueCapacity +
                ", readBufferCapacity=" + readBufferCapacity +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code StoreConfig.builder().build()}.
     */
    public static StoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link StoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private Boolean syncEnabled;
        private Integer minFreeSpaceMb;
        private Integer maxFrameSizeMb;
        private Integer commandQueueCapacity;
        private Integer readBufferCapacity;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 64). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /** Sets maximum encoded frame size in MB (default: 16). */
        public Builder maxFrameSizeMb(int maxFrameSizeMb) {
            this.maxFrameSizeMb = maxFrameSizeMb;
            return this;
        }

        /** Sets the command queue capacity (default: 32). */
        public Builder commandQueueCapacity(int commandQueueCapacity) {
            this.commandQueueCapacity = commandQueueCapacity;
            return this;
        }

        /** Sets the per-reader channel capacity (default: 100). */
        public Builder readBufferCapacity(int readBufferCapacity) {
            this.readBufferCapacity = readBufferCapacity;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a capacity resolves to less than 1,
         *                                  {@code maxFrameSizeMb} falls outside 1..2047,
         *                                  or {@code minFreeSpaceMb} is negative
         */
        public StoreConfig build() {
            if (dataDir == null) {
                dataDir = resolvePath(PROP_DATA_DIR, ENV_DATA_DIR, DEFAULT_DATA_DIR);
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxFrameSizeMb == null) {
                maxFrameSizeMb = resolveInt(PROP_MAX_FRAME_SIZE_MB, ENV_MAX_FRAME_SIZE_MB, DEFAULT_MAX_FRAME_SIZE_MB);
            }
            if (commandQueueCapacity == null) {
                commandQueueCapacity = resolveInt(PROP_COMMAND_QUEUE_CAPACITY, ENV_COMMAND_QUEUE_CAPACITY,
                        DEFAULT_COMMAND_QUEUE_CAPACITY);
            }
            if (readBufferCapacity == null) {
                readBufferCapacity = resolveInt(PROP_READ_BUFFER_CAPACITY, ENV_READ_BUFFER_CAPACITY,
                        DEFAULT_READ_BUFFER_CAPACITY);
            }
            if (commandQueueCapacity < 1 || readBufferCapacity < 1) {
                throw new IllegalArgumentException("Queue capacities must be at least 1: commandQueueCapacity="
                        + commandQueueCapacity + ", readBufferCapacity=" + readBufferCapacity);
            }
            if (maxFrameSizeMb < 1 || maxFrameSizeMb > MAX_FRAME_SIZE_MB_LIMIT) {
                throw new IllegalArgumentException("maxFrameSizeMb must be between 1 and "
                        + MAX_FRAME_SIZE_MB_LIMIT + ": " + maxFrameSizeMb);
            }
            // zero disables the free-space check
            if (minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("minFreeSpaceMb must not be negative: " + minFreeSpaceMb);
            }

            return new StoreConfig(this);
        }

        /** Looks a raw value up by system property, then environment, then properties file. */
        private String lookup(String sysProp, String envVar) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }
            return null;
        }

        private Path resolvePath(String sysProp, String envVar, Path defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Path.of(value) : defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric value for {}: '{}', using default {}", sysProp, value, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = StoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
