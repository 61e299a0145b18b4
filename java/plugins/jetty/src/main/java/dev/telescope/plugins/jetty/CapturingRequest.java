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

package dev.telescope.plugins.jetty;

import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.server.Request;

/**
 * Request wrapper that records the body chunks the application reads.
 */
class CapturingRequest extends Request.Wrapper {

  private final BodyRecorder body;

  CapturingRequest(Request wrapped, BodyRecorder body) {
    super(wrapped);
    this.body = body;
  }

  @Override
  public Content.Chunk read() {
    Content.Chunk chunk = super.read();
    if (chunk != null && !Content.Chunk.isFailure(chunk)) {
      body.record(chunk.getByteBuffer());
    }
    return chunk;
  }
}
