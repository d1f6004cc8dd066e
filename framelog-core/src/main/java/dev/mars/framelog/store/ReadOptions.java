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
package dev.mars.framelog.store;

import dev.mars.framelog.frame.FrameId;
import dev.mars.framelog.frame.InvalidRequestException;
import dev.mars.framelog.frame.QueryParams;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes a read: where replay starts, whether it happens at all, whether
 * the read follows live appends, and whether replay is compacted.
 * <pre>
 * ReadOptions options = ReadOptions.builder()
 *     .follow(FollowOption.withHeartbeat(Duration.ofSeconds(5)))
 *     .lastId(checkpoint)
 *     .build();
 * </pre>
 */
public final class ReadOptions {

    private static final ReadOptions DEFAULTS = builder().build();

    private final FollowOption follow;
    private final boolean tail;
    private final Optional<FrameId> lastId;
    private final Optional<CompactionStrategy> compactionStrategy;

    private ReadOptions(Builder builder) {
        this.follow = builder.follow;
        this.tail = builder.tail;
        this.lastId = Optional.ofNullable(builder.lastId);
        this.compactionStrategy = Optional.ofNullable(builder.compactionStrategy);
    }

    /** Replay everything, do not follow. */
    public static ReadOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Decodes a query string: {@code follow}, {@code tail} and {@code last-id};
     * unknown keys are ignored.
     *
     * @param query the raw query, may be null
     * @throws InvalidRequestException if a recognised value cannot be decoded
     */
    public static ReadOptions fromQuery(String query) {
        Map<String, String> params;
        try {
            params = QueryParams.parse(query);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Malformed query: " + e.getMessage(), e);
        }
        Builder builder = builder();
        if (params.containsKey("follow")) {
            builder.follow(FollowOption.parse(params.get("follow")));
        }
        if (params.containsKey("tail")) {
            builder.tail(parseTail(params.get("tail")));
        }
        if (params.containsKey("last-id")) {
            String lastId = params.get("last-id");
            try {
                builder.lastId(FrameId.parse(lastId));
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("Invalid last-id: '" + lastId + "'", e);
            }
        }
        return builder.build();
    }

    private static boolean parseTail(String value) {
        switch (value) {
            case "false":
            case "no":
            case "0":
                return false;
            default:
                return true;
        }
    }

    public FollowOption follow() {
        return follow;
    }

    /** Skip replay entirely and start with live frames. */
    public boolean tail() {
        return tail;
    }

    /** Replay starts after this identifier (exclusive). */
    public Optional<FrameId> lastId() {
        return lastId;
    }

    public Optional<CompactionStrategy> compactionStrategy() {
        return compactionStrategy;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.follow = follow;
        builder.tail = tail;
        builder.lastId = lastId.orElse(null);
        builder.compactionStrategy = compactionStrategy.orElse(null);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReadOptions)) {
            return false;
        }
        ReadOptions other = (ReadOptions) o;
        return tail == other.tail
                && follow.equals(other.follow)
                && lastId.equals(other.lastId)
                && compactionStrategy.equals(other.compactionStrategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(follow, tail, lastId, compactionStrategy);
    }

    @Override
    public String toString() {
        return "ReadOptions{" +
                "follow=" + follow +
                ", tail=" + tail +
                ", lastId=" + lastId.map(FrameId::toString).orElse("(none)") +
                ", compacted=" + compactionStrategy.isPresent() +
                '}';
    }

    /**
     * Builder for {@link ReadOptions}. Defaults: not following, not tail,
     * no resume point, no compaction.
     */
    public static final class Builder {
        private FollowOption follow = FollowOption.OFF;
        private boolean tail;
        private FrameId lastId;
        private CompactionStrategy compactionStrategy;

        private Builder() {
        }

        public Builder follow(FollowOption follow) {
            this.follow = Objects.requireNonNull(follow, "follow");
            return this;
        }

        public Builder tail(boolean tail) {
            this.tail = tail;
            return this;
        }

        public Builder lastId(FrameId lastId) {
            this.lastId = lastId;
            return this;
        }

        public Builder compactionStrategy(CompactionStrategy compactionStrategy) {
            this.compactionStrategy = compactionStrategy;
            return this;
        }

        public ReadOptions build() {
            return new ReadOptions(this);
        }
    }
}
