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

import dev.mars.framelog.frame.FrameId;

import java.util.Objects;

/**
 * One end of a key range: unbounded, inclusive or exclusive.
 *
 * @param kind the bound semantics
 * @param key  the bounding key (null when unbounded)
 */
public record KeyBound(Kind kind, FrameId key) {

    public enum Kind {
        UNBOUNDED,
        INCLUDED,
        EXCLUDED
    }

    private static final KeyBound UNBOUNDED = new KeyBound(Kind.UNBOUNDED, null);

    public KeyBound {
        Objects.requireNonNull(kind, "kind");
        if (kind != Kind.UNBOUNDED) {
            Objects.requireNonNull(key, "key");
        }
    }

    public static KeyBound unbounded() {
        return UNBOUNDED;
    }

    public static KeyBound included(FrameId key) {
        return new KeyBound(Kind.INCLUDED, key);
    }

    public static KeyBound excluded(FrameId key) {
        return new KeyBound(Kind.EXCLUDED, key);
    }

    public boolean isUnbounded() {
        return kind == Kind.UNBOUNDED;
    }

    public boolean isInclusive() {
        return kind == Kind.INCLUDED;
    }
}
