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
/**
 * The frame store: a single-threaded command loop that appends, replays and
 * fans frames out to readers.
 * <p>
 * <ul>
 *   <li>{@link dev.mars.framelog.store.Store} - Entry point; spawn, append, read, close</li>
 *   <li>{@link dev.mars.framelog.store.ReadOptions} - How a read replays and follows</li>
 *   <li>{@link dev.mars.framelog.store.FrameChannel} - Bounded per-reader delivery</li>
 * </ul>
 */
package dev.mars.framelog.store;
