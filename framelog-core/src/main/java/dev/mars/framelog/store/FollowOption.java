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

import dev.mars.framelog.frame.InvalidRequestException;

import java.time.Duration;
import java.util.Objects;

/**
 * Whether a read keeps delivering frames after replay.
 */
public sealed interface FollowOption permits FollowOption.Off, FollowOption.On, FollowOption.WithHeartbeat {

    FollowOption OFF = new Off();
    FollowOption ON = new On();

    static FollowOption withHeartbeat(Duration interval) {
        return new WithHeartbeat(interval);
    }

    default boolean isFollowing() {
        return !(this instanceof Off);
    }

    /**
     * Decodes the {@code follow} query value: empty, {@code yes} or {@code true}
     * follow; a number of milliseconds follows with heartbeats; {@code no} or
     * {@code false} do not follow.
     *
     * @throws InvalidRequestException for any other value
     */
    static FollowOption parse(String value) {
        if (value == null) {
            return OFF;
        }
        if (value.isEmpty() || value.equals("yes") || value.equals("true")) {
            return ON;
        }
        if (value.equals("no") || value.equals("false")) {
            return OFF;
        }
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return withHeartbeat(Duration.ofMillis(Long.parseLong(value)));
            } catch (NumberFormatException e) {
                throw new InvalidRequestException("Heartbeat interval out of range: " + value, e);
            }
        }
        throw new InvalidRequestException("Invalid value for follow option: '" + value + "'");
    }

    /** Replay only. */
    record Off() implements FollowOption {
    }

    /** Replay, then live frames. */
    record On() implements FollowOption {
    }

    /**
     * Replay, then live frames interleaved with a pulse every {@code interval}.
     */
    record WithHeartbeat(Duration interval) implements FollowOption {
        public WithHeartbeat {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative()) {
                throw new IllegalArgumentException("Heartbeat interval must not be negative: " + interval);
            }
        }
    }
}
