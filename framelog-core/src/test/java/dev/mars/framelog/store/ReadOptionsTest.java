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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for decoding {@link ReadOptions} and {@link FollowOption} from query strings.
 */
class ReadOptionsTest {

    private static final FrameId ID = FrameId.parse("03BIDZVKNOTGJPVUEW3K23G45");

    static Stream<Arguments> queries() {
        return Stream.of(
                Arguments.of(null, ReadOptions.defaults()),
                Arguments.of("foo=bar", ReadOptions.defaults()),
                Arguments.of("follow", ReadOptions.builder().follow(FollowOption.ON).build()),
                Arguments.of("follow=1", ReadOptions.builder()
                        .follow(FollowOption.withHeartbeat(Duration.ofMillis(1))).build()),
                Arguments.of("follow=yes", ReadOptions.builder().follow(FollowOption.ON).build()),
                Arguments.of("follow=true", ReadOptions.builder().follow(FollowOption.ON).build()),
                Arguments.of("follow=no", ReadOptions.defaults()),
                Arguments.of("last-id=03BIDZVKNOTGJPVUEW3K23G45", ReadOptions.builder().lastId(ID).build()),
                Arguments.of("follow&last-id=03BIDZVKNOTGJPVUEW3K23G45",
                        ReadOptions.builder().follow(FollowOption.ON).lastId(ID).build()),
                Arguments.of("tail", ReadOptions.builder().tail(true).build()),
                Arguments.of("tail=false", ReadOptions.defaults()));
    }

    @ParameterizedTest(name = "[{index}] {0}")
    @MethodSource("queries")
    void testFromQuery(String query, ReadOptions expected) {
        assertEquals(expected, ReadOptions.fromQuery(query));
    }

    @ParameterizedTest
    @ValueSource(strings = {"last-id=123", "follow=sometimes", "follow=-5"})
    void testFromQuery_InvalidValue_Throws(String query) {
        assertThrows(InvalidRequestException.class, () -> ReadOptions.fromQuery(query));
    }

    @Test
    @DisplayName("Heartbeat interval too large for a long is rejected")
    void testFollow_Overflow() {
        assertThrows(InvalidRequestException.class, () -> FollowOption.parse("99999999999999999999999"));
    }

    @Test
    @DisplayName("toBuilder copies every option")
    void testToBuilder() {
        CompactionStrategy strategy = CompactionStrategy.byTopic();
        ReadOptions options = ReadOptions.builder()
                .follow(FollowOption.ON)
                .tail(true)
                .lastId(ID)
                .compactionStrategy(strategy)
                .build();

        assertEquals(options, options.toBuilder().build());
        assertNotEquals(options, options.toBuilder().tail(false).build());
    }

    @Test
    @DisplayName("Only the off option does not follow")
    void testIsFollowing() {
        assertFalse(FollowOption.OFF.isFollowing());
        assertTrue(FollowOption.ON.isFollowing());
        assertTrue(FollowOption.withHeartbeat(Duration.ofMillis(5)).isFollowing());
    }
}
