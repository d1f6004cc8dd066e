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
package dev.mars.framelog.demo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.framelog.frame.Frame;
import dev.mars.framelog.frame.FrameDraft;
import dev.mars.framelog.frame.Ttl;
import dev.mars.framelog.pool.WorkerPool;
import dev.mars.framelog.storage.StoreConfig;
import dev.mars.framelog.store.CompactionStrategy;
import dev.mars.framelog.store.FollowOption;
import dev.mars.framelog.store.FrameChannel;
import dev.mars.framelog.store.ReadOptions;
import dev.mars.framelog.store.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Demo entry point for the frame log.
 * <p>
 * This demonstrates basic store operations:
 * <ul>
 *   <li>Opening (spawning) a store</li>
 *   <li>Appending frames with content and metadata</li>
 *   <li>Replay on restart, full and compacted</li>
 *   <li>Following live frames with heartbeats</li>
 *   <li>Concurrent appends through a {@link WorkerPool}</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link StoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Dframelog.dataDir=/path -Dframelog.syncEnabled=true ...}</li>
 *   <li>Environment variables: {@code FRAMELOG_DATA_DIR, FRAMELOG_SYNC_ENABLED, ...}</li>
 *   <li>Properties file: {@code framelog.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR and list its runtime classpath
 * mvn package -pl framelog-demo -am
 * mvn dependency:build-classpath -pl framelog-demo -Dmdep.outputFile=cp.txt
 *
 * # Run with default configuration
 * java -cp "framelog-demo/target/framelog-demo-1.0-SNAPSHOT.jar:$(cat framelog-demo/cp.txt)" dev.mars.framelog.demo.FrameLogDemo
 *
 * # Run with CLI data directory override
 * java -cp ... dev.mars.framelog.demo.FrameLogDemo /path/to/data
 *
 * # Run with system properties
 * java -Dframelog.dataDir=/path/to/data -Dframelog.syncEnabled=false -cp ... dev.mars.framelog.demo.FrameLogDemo
 * </pre>
 *
 * @see StoreConfig
 */
public class FrameLogDemo {

    private static final Logger LOG = LoggerFactory.getLogger(FrameLogDemo.class);

    private static final int WRITERS = 3;
    private static final int FRAMES_PER_WRITER = 4;

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|           Frame Log Demo              |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        // Build configuration with CLI override if provided
        StoreConfig config = args.length > 0 && !args[0].isBlank()
                ? StoreConfig.builder().dataDir(args[0]).build()
                : StoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        ObjectMapper mapper = new ObjectMapper();

        try (Store store = Store.spawn(config)) {
            System.out.println("[OK] Store opened at: " + store.path().toAbsolutePath());

            // Replay what previous runs left behind
            List<Frame> existing = store.read(ReadOptions.defaults()).drain();
            System.out.println("[OK] Replayed " + existing.size() + " existing frames");
            if (!existing.isEmpty()) {
                System.out.println("\n  Latest frame per topic:");
                List<Frame> latest = store.read(ReadOptions.builder()
                        .compactionStrategy(CompactionStrategy.byTopic())
                        .build()).drain();
                for (Frame frame : latest) {
                    System.out.printf("    %s %-10s %s%n", frame.id(), frame.topic(),
                            frame.meta().map(Object::toString).orElse(""));
                }
            }

            // Append a note with content
            ObjectNode meta = mapper.createObjectNode()
                    .put("author", System.getProperty("user.name", "demo"))
                    .put("run", existing.size());
            Frame note = store.appendWithContent("notes", "Hello from run " + existing.size(), meta);
            Optional<byte[]> content = store.casRead(note.hash().orElseThrow());
            System.out.println("\n[OK] Appended " + note.id() + " with content: "
                    + content.map(bytes -> new String(bytes, StandardCharsets.UTF_8)).orElse("(missing)"));

            // Follow live frames while writers append concurrently
            ReadOptions follow = ReadOptions.builder()
                    .follow(FollowOption.withHeartbeat(Duration.ofMillis(200)))
                    .tail(true)
                    .build();
            try (FrameChannel live = store.read(follow);
                 WorkerPool pool = new WorkerPool(WRITERS)) {
                for (int w = 0; w < WRITERS; w++) {
                    String writer = "writer-" + w;
                    MDC.put("writer", writer);
                    pool.execute(() -> {
                        for (int i = 0; i < FRAMES_PER_WRITER; i++) {
                            Frame frame = store.append(FrameDraft.of("metrics")
                                    .withMeta(mapper.createObjectNode().put("writer", writer).put("seq", i))
                                    .withTtl(Ttl.head(10)));
                            LOG.info("Appended {}", frame.id());
                        }
                    });
                    MDC.remove("writer");
                }
                pool.waitForCompletion();
                System.out.println("\n[OK] " + WRITERS + " writers appended "
                        + WRITERS * FRAMES_PER_WRITER + " frames");

                System.out.println("\n  Live frames as seen by a follower:");
                int received = 0;
                int pulses = 0;
                while (received < WRITERS * FRAMES_PER_WRITER) {
                    Optional<Frame> next = live.poll(1, TimeUnit.SECONDS);
                    if (next.isEmpty()) {
                        break;
                    }
                    Frame frame = next.get();
                    if (Frame.PULSE_TOPIC.equals(frame.topic())) {
                        pulses++;
                        System.out.println("    (pulse " + frame.id() + ")");
                    } else {
                        received++;
                        System.out.printf("    %s %s%n", frame.id(), frame.meta().orElseThrow());
                    }
                }
                System.out.println("[OK] Follower received " + received + " frames and " + pulses + " pulses");
            }

            // Ephemeral frames are delivered but never stored
            Frame blip = store.append(FrameDraft.of("presence").withTtl(Ttl.EPHEMERAL));
            System.out.println("\n[OK] Ephemeral frame " + blip.id() + " stored: " + store.get(blip.id()).isPresent());

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Frame log demo complete!             |");
            System.out.println("|  Run again to see frames replayed.    |");
            System.out.println("+---------------------------------------+");
        }
    }
}
