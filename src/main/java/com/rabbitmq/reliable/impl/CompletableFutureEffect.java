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
package com.rabbitmq.reliable.impl;

import com.rabbitmq.reliable.CompletionHandle;
import com.rabbitmq.reliable.Effect;
import com.rabbitmq.reliable.Promise;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link Effect} backed by {@link CompletableFuture}.
 *
 * <p>Continuations run on the resolving thread if no executor is set, on the executor otherwise.
 */
public class CompletableFutureEffect implements Effect {

  private final Executor executor;

  public CompletableFutureEffect(Executor executor) {
    this.executor = executor;
  }

  @Override
  public <T> Promise<T> promise() {
    return new CompletableFuturePromise<>(new CompletableFuture<>(), this.executor);
  }

  @Override
  public <T> CompletionHandle<T> succeed(T value) {
    return new CompletableFuturePromise<>(CompletableFuture.completedFuture(value), this.executor);
  }

  @Override
  public <T> CompletionHandle<T> fail(Throwable cause) {
    CompletableFuture<T> future = new CompletableFuture<>();
    future.completeExceptionally(cause);
    return new CompletableFuturePromise<>(future, this.executor);
  }

  @Override
  public String toString() {
    return "CompletableFutureEffect{" + "executor=" + executor + '}';
  }
}
