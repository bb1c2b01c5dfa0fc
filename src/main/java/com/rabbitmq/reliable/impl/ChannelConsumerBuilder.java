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

import com.rabbitmq.client.Channel;
import com.rabbitmq.reliable.AcknowledgmentAction;
import com.rabbitmq.reliable.Consumer;
import com.rabbitmq.reliable.ConsumerBuilder;
import com.rabbitmq.reliable.DeliveryHandler;
import java.util.concurrent.atomic.AtomicReference;

class ChannelConsumerBuilder implements ConsumerBuilder {

  static final int DEFAULT_PREFETCH_COUNT =
      Integer.parseInt(System.getProperty("rabbitmq.reliable.consumer.prefetch", "0"));

  static final AcknowledgmentAction DEFAULT_FAILURE_ACTION =
      AcknowledgmentAction.valueOf(
          System.getProperty("rabbitmq.reliable.consumer.failure.action", "REJECT_DISCARD"));

  private final AmqpEnvironment environment;

  private String queue;
  private DeliveryHandler handler;
  private AcknowledgmentAction failureAction = DEFAULT_FAILURE_ACTION;
  private int prefetchCount = DEFAULT_PREFETCH_COUNT;
  private String consumerTag;
  private Channel channel;

  ChannelConsumerBuilder(AmqpEnvironment environment) {
    this.environment = environment;
  }

  @Override
  public ConsumerBuilder queue(String queue) {
    this.queue = queue;
    return this;
  }

  @Override
  public ConsumerBuilder handler(DeliveryHandler handler) {
    this.handler = handler;
    return this;
  }

  @Override
  public ConsumerBuilder failureAction(AcknowledgmentAction failureAction) {
    if (failureAction == null) {
      throw new IllegalArgumentException("the failure action cannot be null");
    }
    this.failureAction = failureAction;
    return this;
  }

  @Override
  public ConsumerBuilder prefetchCount(int prefetchCount) {
    if (prefetchCount < 0) {
      throw new IllegalArgumentException("the prefetch count cannot be negative");
    }
    this.prefetchCount = prefetchCount;
    return this;
  }

  @Override
  public ConsumerBuilder consumerTag(String consumerTag) {
    this.consumerTag = consumerTag;
    return this;
  }

  @Override
  public ConsumerBuilder channel(Channel channel) {
    this.channel = channel;
    return this;
  }

  @Override
  public Consumer build() {
    if (this.queue == null || this.queue.isEmpty()) {
      throw new IllegalArgumentException("A queue must be specified");
    }
    if (this.handler == null) {
      throw new IllegalArgumentException("A delivery handler must be set");
    }
    String tag =
        this.consumerTag == null || this.consumerTag.isEmpty()
            ? Utils.generateConsumerTag(this.queue)
            : this.consumerTag;
    boolean ownsChannel = this.channel == null;
    Channel consumerChannel = ownsChannel ? this.environment.openChannel() : this.channel;
    AtomicReference<Runnable> closingCallback = new AtomicReference<>(() -> {});
    ChannelConsumer consumer =
        new ChannelConsumer(
            this.queue,
            tag,
            this.handler,
            this.failureAction,
            this.prefetchCount,
            consumerChannel,
            ownsChannel,
            this.environment.effect(),
            this.environment.metricsCollector(),
            () -> closingCallback.get().run());
    closingCallback.set(this.environment.registerConsumer(consumer));
    return consumer;
  }
}
