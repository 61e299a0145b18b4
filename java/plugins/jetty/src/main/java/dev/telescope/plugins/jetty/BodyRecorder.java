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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;

/**
 * Copies body bytes as they stream past, up to a fixed number of bytes. Once a
 * body outgrows the limit the recorder stops copying and reports an overflow.
 */
final class BodyRecorder {

  private final int maxBytes;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private boolean overflow;

  BodyRecorder(int maxBytes) {
    this.maxBytes = maxBytes;
  }

  /**
   * Records the remaining bytes of a buffer without moving its position.
   */
  synchronized void record(ByteBuffer bytes) {
    if (bytes == null || !bytes.hasRemaining() || overflow) {
      return;
    }
    ByteBuffer view = bytes.slice();
    if (buffer.size() + view.remaining() > maxBytes) {
      overflow = true;
      buffer.reset();
      return;
    }
    byte[] chunk = new byte[view.remaining()];
    view.get(chunk);
    buffer.write(chunk, 0, chunk.length);
  }

  synchronized boolean isOverflow() {
    return overflow;
  }

  synchronized String text(Charset charset) {
    return buffer.toString(charset);
  }
}
