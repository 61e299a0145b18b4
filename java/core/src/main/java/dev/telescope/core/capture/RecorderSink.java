/*
 * Copyright 2025 Google LLC
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
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package dev.telescope.core.capture;

/**
 * RecorderSink receives finished capture entries. Implementations own storage
 * and must tolerate concurrent calls; the pipeline neither retries nor buffers
 * on their behalf.
 */
public interface RecorderSink {

  /**
   * Records an entry for a plain HTTP request.
   *
   * @param entry
   *            the entry
   */
  void recordRequest(CaptureEntry entry);

  /**
   * Records an entry for an RPC, JSON-RPC or gRPC call.
   *
   * @param entry
   *            the entry
   */
  void recordService(CaptureEntry entry);
}
