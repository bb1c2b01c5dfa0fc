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

/**
 * The resolvable side of a {@link CompletionHandle}.
 *
 * <p>Only the first call to {@link #succeed(Object)} or {@link #fail(Throwable)} has an effect.
 *
 * @param <T> the type of the value
 * @see Effect#promise()
 */
public interface Promise<T> extends CompletionHandle<T> {

  /**
   * Resolve with a value.
   *
   * @param value the value
   * @return true if this call resolved the promise, false if it was already resolved
   */
  boolean succeed(T value);

  /**
   * Resolve with a failure.
   *
   * @param cause the failure
   * @return true if this call resolved the promise, false if it was already resolved
   */
  boolean fail(Throwable cause);
}
