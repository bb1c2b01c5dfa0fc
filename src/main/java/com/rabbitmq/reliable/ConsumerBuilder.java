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

import com.rabbitmq.client.Channel;

/** API to configure and create a {@link Consumer}. */
public interface ConsumerBuilder {

  /**
   * The queue to consume from.
   *
   * @param queue
   * @return this builder instance
   */
  ConsumerBuilder queue(String queue);

  /**
   * The callback for inbound messages.
   *
   * @param handler
   * @return this builder instance
   */
  ConsumerBuilder handler(DeliveryHandler handler);

  /**
   * The action to use when the handler fails, synchronously or asynchronously.
   *
   * <p>Default is {@link AcknowledgmentAction#REJECT_DISCARD}.
   *
   * @param failureAction
   * @return this builder instance
   */
  ConsumerBuilder failureAction(AcknowledgmentAction failureAction);

  /**
   * The maximum number of unacknowledged deliveries the broker dispatches to the consumer.
   *
   * <p>Default is 0 (no limit).
   *
   * @param prefetchCount
   * @return this builder instance
   */
  ConsumerBuilder prefetchCount(int prefetchCount);

  /**
   * The consumer tag of the subscription.
   *
   * <p>Default is generated from the queue name.
   *
   * @param consumerTag
   * @return this builder instance
   */
  ConsumerBuilder consumerTag(String consumerTag);

  /**
   * The channel to consume on.
   *
   * <p>The application keeps ownership of the channel: the consumer does not close it. The
   * prefetch count applies to the channel.
   *
   * <p>The environment opens a dedicated channel if none is set.
   *
   * @param channel
   * @return this builder instance
   */
  ConsumerBuilder channel(Channel channel);

  /**
   * Create the configured {@link Consumer}
   *
   * @return the configured consumer
   */
  Consumer build();
}
