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

import java.nio.ByteBuffer;

import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;

/**
 * Response wrapper that records the body bytes the application writes.
 */
class CapturingResponse extends Response.Wrapper {

  private final BodyRecorder body;

  CapturingResponse(Request request, Response wrapped, BodyRecorder body) {
    super(request, wrapped);
    this.body = body;
  }

  @Override
  public void write(boolean last, ByteBuffer byteBuffer, Callback callback) {
    body.record(byteBuffer);
    super.write(last, byteBuffer, callback);
  }
}
