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

import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BatchIdResolver establishes the batch id of a request. An inbound
 * {@code batch-id} header wins; otherwise the id carried by the RPC side
 * channel is used; otherwise a new id is generated.
 */
public final class BatchIdResolver {

  private static final Logger logger = LoggerFactory.getLogger(BatchIdResolver.class);

  private final Supplier<String> generator;

  /**
   * Creates a resolver that generates random UUIDs.
   */
  public BatchIdResolver() {
    this(() -> UUID.randomUUID().toString());
  }

  /**
   * Creates a resolver with a custom id generator.
   *
   * @param generator
   *            supplies new batch ids
   */
  public BatchIdResolver(Supplier<String> generator) {
    this.generator = generator;
  }

  /**
   * Resolves the batch id.
   *
   * @param inboundHeader
   *            the value of the inbound batch-id header, may be null
   * @param rpcContext
   *            the RPC side channel, may be null
   * @return the batch id, never empty
   */
  public String resolve(String inboundHeader, RpcContext rpcContext) {
    if (inboundHeader != null && !inboundHeader.isEmpty()) {
      return inboundHeader;
    }
    String carried = fromCarrier(rpcContext);
    if (carried != null) {
      return carried;
    }
    return generator.get();
  }

  private static String fromCarrier(RpcContext rpcContext) {
    if (rpcContext == null) {
      return null;
    }
    Object carrier;
    try {
      carrier = rpcContext.get(RpcContext.CARRIER_KEY);
    } catch (RuntimeException e) {
      logger.debug("RPC context lookup failed, generating a batch id", e);
      return null;
    }
    if (!(carrier instanceof Map)) {
      return null;
    }
    Object batchId = ((Map<?, ?>) carrier).get(RpcContext.BATCH_ID_KEY);
    return batchId instanceof String && !((String) batchId).isEmpty() ? (String) batchId : null;
  }
}
