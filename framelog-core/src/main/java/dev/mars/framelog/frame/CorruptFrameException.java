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

/**
 * Thrown when a persisted record cannot be decoded into a {@link Frame}.
 * <p>
 * The log is considered damaged at that point; callers must not carry on past it.
 */
public class CorruptFrameException extends IllegalStateException {

    public CorruptFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
