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
 * API to publish messages with publisher confirms.
 *
 * <p>Instances are created and configured with a {@link PublisherBuilder}.
 *
 * <p>Implementations are expected to be thread-safe.
 *
 * @see PublisherBuilder
 * @see Environment#publisherBuilder()
 */
public interface Publisher extends AutoCloseable {

  /**
   * Publish a message.
   *
   * <p>The method does not wait for the broker confirmation. The returned handle succeeds when
   * the broker confirms the message and fails with a {@link PublishException} if the broker
   * rejects it, if the message cannot be sent, or if the channel closes before the
   * confirmation.
   *
   * @param command the message to publish
   * @return the handle resolved with the outcome of the publication
   */
  CompletionHandle<Void> publish(PublishCommand command);

  /**
   * Close the publisher.
   *
   * <p>Outstanding publications fail with {@link Constants#CODE_PUBLISHER_CLOSED}.
   */
  @Override
  void close();
}
