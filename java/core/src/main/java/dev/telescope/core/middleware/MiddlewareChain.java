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

package dev.telescope.core.middleware;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

import dev.telescope.core.CaptureContext;

/**
 * MiddlewareChain manages a list of middleware and provides execution of the
 * complete chain. It implements the chain of responsibility pattern where each
 * middleware can process or modify the request/response.
 *
 * <p>
 * Once a capture context exists, the chain records the name of every
 * middleware it enters on that context, which is how capture entries learn the
 * middleware a request went through.
 *
 * @param <I>
 *            The request type
 * @param <O>
 *            The response type
 */
public class MiddlewareChain<I, O> {

  private final List<Middleware<I, O>> middlewareList;

  /**
   * Creates a new MiddlewareChain.
   */
  public MiddlewareChain() {
    this.middlewareList = new ArrayList<>();
  }

  /**
   * Creates a new MiddlewareChain with the given middleware.
   *
   * @param middlewareList
   *            the initial list of middleware
   */
  public MiddlewareChain(List<Middleware<I, O>> middlewareList) {
    this.middlewareList = new ArrayList<>(middlewareList);
  }

  /**
   * Adds a middleware to the chain.
   *
   * @param middleware
   *            the middleware to add
   * @return this chain for fluent chaining
   */
  public MiddlewareChain<I, O> use(Middleware<I, O> middleware) {
    if (middleware != null) {
      middlewareList.add(middleware);
    }
    return this;
  }

  /**
   * Inserts a middleware at the beginning of the chain.
   *
   * @param middleware
   *            the middleware to insert
   * @return this chain for fluent chaining
   */
  public MiddlewareChain<I, O> useFirst(Middleware<I, O> middleware) {
    if (middleware != null) {
      middlewareList.add(0, middleware);
    }
    return this;
  }

  /**
   * Returns an unmodifiable view of the middleware list.
   *
   * @return the middleware list
   */
  public List<Middleware<I, O>> getMiddlewareList() {
    return Collections.unmodifiableList(middlewareList);
  }

  /**
   * Returns the number of middleware in the chain.
   *
   * @return the middleware count
   */
  public int size() {
    return middlewareList.size();
  }

  /**
   * Executes the middleware chain with no capture context; a
   * {@link CaptureMiddleware} in the chain supplies one.
   *
   * @param request
   *            the request
   * @param handler
   *            the handler to execute after all middleware
   * @return the response
   */
  public O execute(I request, BiFunction<CaptureContext, I, O> handler) {
    return execute(request, null, handler);
  }

  /**
   * Executes the middleware chain with the given request, context, and
   * handler.
   *
   * @param request
   *            the request
   * @param context
   *            the capture context, may be null
   * @param handler
   *            the handler to execute after all middleware
   * @return the response
   */
  public O execute(I request, CaptureContext context, BiFunction<CaptureContext, I, O> handler) {
    return dispatch(0, request, context, handler);
  }

  private O dispatch(int index, I request, CaptureContext context, BiFunction<CaptureContext, I, O> handler) {
    if (index >= middlewareList.size()) {
      // End of middleware chain, execute the handler
      return handler.apply(context, request);
    }

    Middleware<I, O> currentMiddleware = middlewareList.get(index);
    if (context != null) {
      context.addMiddleware(currentMiddleware.name());
    }

    MiddlewareNext<I, O> next = (modifiedRequest, modifiedContext) -> dispatch(index + 1,
        modifiedRequest != null ? modifiedRequest : request,
        modifiedContext != null ? modifiedContext : context, handler);

    return currentMiddleware.handle(request, context, next);
  }

  /**
   * Creates a new MiddlewareChain with the specified middleware.
   *
   * @param middleware
   *            the middleware to include
   * @param <I>
   *            request type
   * @param <O>
   *            response type
   * @return a new MiddlewareChain
   */
  @SafeVarargs
  public static <I, O> MiddlewareChain<I, O> of(Middleware<I, O>... middleware) {
    MiddlewareChain<I, O> chain = new MiddlewareChain<>();
    for (Middleware<I, O> m : middleware) {
      chain.use(m);
    }
    return chain;
  }
}
