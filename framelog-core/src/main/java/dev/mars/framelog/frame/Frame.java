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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.framelog.cas.Integrity;

import java.util.Objects;
import java.util.Optional;

/**
 * One immutable entry of the log.
 * <p>
 * Frames are created by the store when a {@link FrameDraft} is appended. The
 * {@code hash}, if present, names a payload already committed to the content
 * store; {@code meta} is carried through untouched.
 *
 * @param id    unique, time-ordered identifier assigned at append time
 * @param topic caller-defined classification
 * @param hash  digest of the payload in the content store, if any
 * @param meta  arbitrary metadata, if any
 * @param ttl   retention policy
 */
public record Frame(
        FrameId id,
        String topic,
        Optional<Integrity> hash,
        Optional<JsonNode> meta,
        Ttl ttl
) {

    /** Topic of the marker separating replayed history from live frames. */
    public static final String THRESHOLD_TOPIC = "xs.threshold";

    /** Topic of heartbeat frames on following subscriptions. */
    public static final String PULSE_TOPIC = "xs.pulse";

    public Frame {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(topic, "topic");
        hash = hash == null ? Optional.empty() : hash;
        meta = meta == null ? Optional.empty() : meta;
        ttl = ttl == null ? Ttl.FOREVER : ttl;
    }

    static Frame synthetic(FrameId id, String topic) {
        return new Frame(id, topic, Optional.empty(), Optional.empty(), Ttl.EPHEMERAL);
    }

    public static Frame threshold(FrameId id) {
        return synthetic(id, THRESHOLD_TOPIC);
    }

    public static Frame pulse(FrameId id) {
        return synthetic(id, PULSE_TOPIC);
    }

    /** Whether this is a store-generated marker rather than an appended frame. */
    public boolean isSynthetic() {
        return THRESHOLD_TOPIC.equals(topic) || PULSE_TOPIC.equals(topic);
    }
}
