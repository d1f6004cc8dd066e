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
 * Storage layer - ordered, crash-safe frame records.
 * <p>
 * This package provides the persistence layer beneath the store:
 * <ul>
 *   <li>{@link dev.mars.framelog.storage.OrderedPartition} - The ordered key-value interface</li>
 *   <li>{@link dev.mars.framelog.storage.FilePartition} - CRC-protected record log implementation</li>
 *   <li>{@link dev.mars.framelog.storage.StoreConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Append-only:</b> Removals are records too, replayed on open</li>
 *   <li><b>Crash safety:</b> A torn tail is detected by CRC and truncated</li>
 *   <li><b>Single process:</b> An exclusive file lock guards each partition</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * partition/
 *  ├─ partition.lock   // exclusive process lock
 *  └─ partition.log    // PUT and REMOVE records
 * </pre>
 *
 * @see dev.mars.framelog.storage.OrderedPartition
 */
package dev.mars.framelog.storage;
