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
 * A frame as submitted by a caller: everything except the identifier, which
 * only the store assigns.
 *
 * @param topic caller-defined classification
 * @param hash  digest of an already committed payload, if any
 * @param meta  arbitrary metadata, if any
 * @param ttl   retention policy
 */
public record FrameDraft(
        String topic,
        Optional<Integrity> hash,
        Optional<JsonNode> meta,
        Ttl ttl
) {

    public FrameDraft {
        Objects.requireNonNull(topic, "topic");
        hash = hash == null ? Optional.empty() : hash;
        meta = meta == null ? Optional.empty() : meta;
        ttl = ttl == null ? Ttl.FOREVER : ttl;
    }

    public static FrameDraft of(String topic) {
        return new FrameDraft(topic, Optional.empty(), Optional.empty(), Ttl.FOREVER);
    }

    public FrameDraft withHash(Integrity hash) {
        return new FrameDraft(topic, Optional.ofNullable(hash), meta, ttl);
    }

    public FrameDraft withMeta(JsonNode meta) {
        return new FrameDraft(topic, hash, Optional.ofNullable(meta), ttl);
    }

    public FrameDraft withTtl(Ttl ttl) {
        return new FrameDraft(topic, hash, meta, ttl);
    }

    /** Finalises this draft under the given identifier. */
    public Frame toFrame(FrameId id) {
        return new Frame(id, topic, hash, meta, ttl);
    }
}
