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

import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Asynchronous result resolved exactly once, either with a value or with a failure.
 *
 * <p>Callers never block on a handle: they register continuations with {@link #map(Function)},
 * {@link #flatMap(Function)}, or {@link #whenComplete(BiConsumer)}. Handles are created by an
 * {@link Effect}.
 *
 * @param <T> the type of the value
 * @see Effect
 * @see Promise
 * @see Publisher#publish(PublishCommand)
 */
public interface CompletionHandle<T> {

  /**
   * Transform the value once this handle succeeds.
   *
   * <p>A failure of this handle, or an exception thrown by the mapper, fails the returned
   * handle.
   *
   * @param mapper the transformation
   * @param <R> the type of the new value
   * @return a new handle
   */
  <R> CompletionHandle<R> map(Function<? super T, ? extends R> mapper);

  /**
   * Chain another asynchronous computation once this handle succeeds.
   *
   * @param mapper the function returning the next handle
   * @param <R> the type of the new value
   * @return a new handle resolved with the outcome of the chained handle
   */
  <R> CompletionHandle<R> flatMap(Function<? super T, ? extends CompletionHandle<R>> mapper);

  /**
   * Register a callback for the resolution of this handle.
   *
   * <p>The callback receives the value and a <code>null</code> failure on success, a <code>null
   * </code> value and the failure otherwise. It is called immediately if the handle is already
   * resolved.
   *
   * @param callback the callback
   * @return this handle
   */
  CompletionHandle<T> whenComplete(BiConsumer<? super T, ? super Throwable> callback);

  /**
   * Whether the handle is resolved, successfully or not.
   *
   * @return true if resolved
   */
  boolean isDone();

  /**
   * A {@link CompletableFuture} view of this handle.
   *
   * <p>Useful for tests or to integrate with APIs based on {@link
   * java.util.concurrent.CompletionStage}.
   *
   * @return a future completed when this handle is resolved
   */
  CompletableFuture<T> toCompletableFuture();
}
