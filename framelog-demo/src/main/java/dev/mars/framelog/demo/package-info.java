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
 * Demo applications for the frame log.
 * <p>
 * This package contains an example application demonstrating how to embed
 * a {@link dev.mars.framelog.store.Store}: appending with content, replaying,
 * following live frames and writing concurrently through a worker pool.
 *
 * @see dev.mars.framelog.demo.FrameLogDemo
 */
package dev.mars.framelog.demo;
