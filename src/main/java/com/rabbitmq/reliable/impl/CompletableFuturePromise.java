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
import com.rabbitmq.reliable.Promise;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Function;

final class CompletableFuturePromise<T> implements Promise<T> {

  private final CompletableFuture<T> future;
  private final Executor executor;

  CompletableFuturePromise(CompletableFuture<T> future, Executor executor) {
    this.future = future;
    this.executor = executor;
  }

  @Override
  public boolean succeed(T value) {
    return this.future.complete(value);
  }

  @Override
  public boolean fail(Throwable cause) {
    if (cause == null) {
      throw new IllegalArgumentException("failure cause cannot be null");
    }
    return this.future.completeExceptionally(cause);
  }

  @Override
  public <R> CompletionHandle<R> map(Function<? super T, ? extends R> mapper) {
    CompletableFuture<R> next = new CompletableFuture<>();
    whenComplete(
        (value, failure) -> {
          if (failure == null) {
            try {
              next.complete(mapper.apply(value));
            } catch (Throwable e) {
              next.completeExceptionally(e);
            }
          } else {
            next.completeExceptionally(failure);
          }
        });
    return new CompletableFuturePromise<>(next, this.executor);
  }

  @Override
  public <R> CompletionHandle<R> flatMap(
      Function<? super T, ? extends CompletionHandle<R>> mapper) {
    CompletableFuture<R> next = new CompletableFuture<>();
    whenComplete(
        (value, failure) -> {
          if (failure == null) {
            try {
              CompletionHandle<R> chained = mapper.apply(value);
              if (chained == null) {
                next.completeExceptionally(
                    new NullPointerException("flatMap function returned a null handle"));
              } else {
                chained.whenComplete(
                    (chainedValue, chainedFailure) -> {
                      if (chainedFailure == null) {
                        next.complete(chainedValue);
                      } else {
                        next.completeExceptionally(chainedFailure);
                      }
                    });
              }
            } catch (Throwable e) {
              next.completeExceptionally(e);
            }
          } else {
            next.completeExceptionally(failure);
          }
        });
    return new CompletableFuturePromise<>(next, this.executor);
  }

  @Override
  public CompletionHandle<T> whenComplete(BiConsumer<? super T, ? super Throwable> callback) {
    BiConsumer<T, Throwable> unwrappingCallback =
        (value, failure) -> callback.accept(value, unwrap(failure));
    if (this.executor == null) {
      this.future.whenComplete(unwrappingCallback);
    } else {
      this.future.whenCompleteAsync(unwrappingCallback, this.executor);
    }
    return this;
  }

  @Override
  public boolean isDone() {
    return this.future.isDone();
  }

  @Override
  public CompletableFuture<T> toCompletableFuture() {
    CompletableFuture<T> copy = new CompletableFuture<>();
    this.future.whenComplete(
        (value, failure) -> {
          if (failure == null) {
            copy.complete(value);
          } else {
            copy.completeExceptionally(unwrap(failure));
          }
        });
    return copy;
  }

  private static Throwable unwrap(Throwable failure) {
    if (failure instanceof CompletionException && failure.getCause() != null) {
      return failure.getCause();
    } else {
      return failure;
    }
  }

  @Override
  public String toString() {
    return "CompletableFuturePromise{" + future + '}';
  }
}
