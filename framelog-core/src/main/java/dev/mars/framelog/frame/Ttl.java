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

import java.time.Duration;
import java.util.Objects;

/**
 * Retention policy attached to a frame when it is appended.
 * <p>
 * <ul>
 *   <li>{@link Forever} - kept until explicitly removed</li>
 *   <li>{@link Ephemeral} - never written to the partition, only seen by live subscribers</li>
 *   <li>{@link Time} - expires once its duration has passed since the frame's timestamp</li>
 *   <li>{@link Head} - only the newest {@code n} frames of the topic are kept</li>
 * </ul>
 * Token form: {@code forever}, {@code ephemeral}, {@code time:<millis>}, {@code head:<n>}.
 */
public sealed interface Ttl permits Ttl.Forever, Ttl.Ephemeral, Ttl.Time, Ttl.Head {

    Ttl FOREVER = new Forever();
    Ttl EPHEMERAL = new Ephemeral();

    /** Token form of this policy. */
    String token();

    /** Whether frames with this policy are written to the partition. */
    default boolean isPersistent() {
        return !(this instanceof Ephemeral);
    }

    static Ttl time(Duration duration) {
        return new Time(duration);
    }

    static Ttl head(int count) {
        return new Head(count);
    }

    /**
     * Parses a token.
     *
     * @throws InvalidRequestException if the token is not recognised
     */
    static Ttl parse(String token) {
        if (token == null) {
            throw new InvalidRequestException("TTL must not be null");
        }
        switch (token) {
            case "forever":
                return FOREVER;
            case "ephemeral":
                return EPHEMERAL;
            default:
                break;
        }
        try {
            if (token.startsWith("time:")) {
                long millis = Long.parseLong(token.substring("time:".length()));
                return new Time(Duration.ofMillis(millis));
            }
            if (token.startsWith("head:")) {
                return new Head(Integer.parseInt(token.substring("head:".length())));
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid TTL: '" + token + "'", e);
        }
        throw new InvalidRequestException("Invalid TTL: '" + token
                + "' (expected forever, ephemeral, time:<millis> or head:<n>)");
    }

    /**
     * Reads the {@code ttl} parameter of a query string.
     *
     * @return the parsed policy, or {@link #FOREVER} if the parameter is absent
     * @throws InvalidRequestException if the value is not a valid token
     */
    static Ttl fromQuery(String query) {
        String token;
        try {
            token = QueryParams.parse(query).get("ttl");
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Malformed query: " + e.getMessage(), e);
        }
        return token == null ? FOREVER : parse(token);
    }

    record Forever() implements Ttl {
        @Override
        public String token() {
            return "forever";
        }
    }

    record Ephemeral() implements Ttl {
        @Override
        public String token() {
            return "ephemeral";
        }
    }

    /**
     * @param duration time after the frame's timestamp at which it expires,
     *                 kept to millisecond precision
     */
    record Time(Duration duration) implements Ttl {

        /** Largest duration whose millisecond count fits in a {@code long}. */
        static final Duration MAX_DURATION = Duration.ofMillis(Long.MAX_VALUE);

        public Time {
            Objects.requireNonNull(duration, "duration");
            if (duration.isNegative()) {
                throw new IllegalArgumentException("TTL duration must not be negative: " + duration);
            }
            if (duration.compareTo(MAX_DURATION) > 0) {
                throw new IllegalArgumentException("TTL duration too large: " + duration);
            }
            if (duration.getNano() % 1_000_000 != 0) {
                throw new IllegalArgumentException("TTL duration must be whole milliseconds: " + duration);
            }
        }

        @Override
        public String token() {
            return "time:" + duration.toMillis();
        }

        /** Whether a frame minted at {@code timestamp} has expired at {@code now}. */
        public boolean isExpired(long timestamp, long now) {
            long age = now - timestamp;
            return age > 0 && age > duration.toMillis();
        }
    }

    /**
     * @param count number of newest frames of the topic to keep, at least 1
     */
    record Head(int count) implements Ttl {
        public Head {
            if (count < 1) {
                throw new IllegalArgumentException("TTL head count must be at least 1: " + count);
            }
        }

        @Override
        public String token() {
            return "head:" + count;
        }
    }
}
