// Copyright (c) 2025 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// This software, the RabbitMQ Reliable AMQP Java client library, is dual-licensed under the
// Mozilla Public License 2.0 ("MPL"), and the Apache License version 2 ("ASL").
// For the MPL, please see LICENSE-MPL-RabbitMQ. For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.reliable;

import java.util.concurrent.Executor;

/**
 * Factory for the asynchronous primitive behind {@link CompletionHandle}s.
 *
 * <p>Publishers and consumers only use this contract, so the asynchronous primitive can be
 * changed without touching the confirm bookkeeping or the delivery dispatching.
 *
 * @see EnvironmentBuilder#effect(Effect)
 */
public interface Effect {

  /**
   * {@link Effect} backed by {@link java.util.concurrent.CompletableFuture}.
   *
   * <p>Continuations run on the thread that resolves the handle.
   *
   * @return the effect
   */
  static Effect completableFuture() {
    return createCompletableFutureEffect(null);
  }

  /**
   * {@link Effect} backed by {@link java.util.concurrent.CompletableFuture} that runs
   * continuations on the given executor.
   *
   * <p>Use this to keep application code off the connection I/O and dispatch threads.
   *
   * @param executor executor for continuations
   * @return the effect
   */
  static Effect completableFuture(Executor executor) {
    if (executor == null) {
      throw new IllegalArgumentException("executor cannot be null");
    }
    return createCompletableFutureEffect(executor);
  }

  /**
   * Create an unresolved promise.
   *
   * @param <T> the type of the value
   * @return a new promise
   */
  <T> Promise<T> promise();

  /**
   * Create a handle already resolved with a value.
   *
   * @param value the value
   * @param <T> the type of the value
   * @return a resolved handle
   */
  <T> CompletionHandle<T> succeed(T value);

  /**
   * Create a handle already resolved with a failure.
   *
   * @param cause the failure
   * @param <T> the type of the value
   * @return a failed handle
   */
  <T> CompletionHandle<T> fail(Throwable cause);

  private static Effect createCompletableFutureEffect(Executor executor) {
    try {
      return (Effect)
          Class.forName("com.rabbitmq.reliable.impl.CompletableFutureEffect")
              .getConstructor(Executor.class)
              .newInstance(executor);
    } catch (Exception e) {
      throw new ReliableException("Error while creating completable future effect", e);
    }
  }
}
