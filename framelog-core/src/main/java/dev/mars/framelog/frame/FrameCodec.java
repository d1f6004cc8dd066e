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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.framelog.cas.Integrity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * JSON encoding of frames as stored in the partition.
 * <p>
 * <b>Format:</b>
 * <pre>
 * {"id":"03BIDZVKNOTGJPVUEW3K23G45","topic":"stream","hash":"sha256-...","meta":{...},"ttl":"forever"}
 * </pre>
 * {@code hash} and {@code meta} are omitted when absent; a missing {@code ttl}
 * decodes as {@code forever}.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class FrameCodec {

    private final ObjectMapper mapper;

    public FrameCodec() {
        this(new ObjectMapper());
    }

    public FrameCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toJson(Frame frame) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", frame.id().toString());
        node.put("topic", frame.topic());
        frame.hash().ifPresent(hash -> node.put("hash", hash.toString()));
        frame.meta().ifPresent(meta -> node.set("meta", meta));
        node.put("ttl", frame.ttl().token());
        return node;
    }

    public byte[] encode(Frame frame) {
        try {
            return mapper.writeValueAsBytes(toJson(frame));
        } catch (JsonProcessingException e) {
            // tree nodes always serialize
            throw new IllegalStateException("Failed to encode frame " + frame.id(), e);
        }
    }

    /**
     * Decodes a stored frame.
     *
     * @throws CorruptFrameException if the bytes are not a valid frame
     */
    public Frame decode(byte[] bytes) {
        try {
            JsonNode node = mapper.readTree(bytes);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("not a JSON object");
            }
            FrameId id = FrameId.parse(required(node, "id"));
            String topic = required(node, "topic");
            Optional<Integrity> hash = Optional.ofNullable(node.get("hash"))
                    .filter(h -> !h.isNull())
                    .map(h -> Integrity.parse(h.asText()));
            Optional<JsonNode> meta = Optional.ofNullable(node.get("meta"))
                    .filter(m -> !m.isNull());
            JsonNode ttl = node.get("ttl");
            return new Frame(id, topic, hash, meta,
                    ttl == null || ttl.isNull() ? Ttl.FOREVER : Ttl.parse(ttl.asText()));
        } catch (IOException | IllegalArgumentException e) {
            throw new CorruptFrameException("Failed to decode frame: "
                    + new String(bytes, StandardCharsets.UTF_8), e);
        }
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return value.asText();
    }
}
