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
import com.rabbitmq.reliable.Publisher;
import com.rabbitmq.reliable.PublisherBuilder;
import java.util.concurrent.atomic.AtomicReference;

class ChannelPublisherBuilder implements PublisherBuilder {

  private final AmqpEnvironment environment;

  private Channel channel;

  ChannelPublisherBuilder(AmqpEnvironment environment) {
    this.environment = environment;
  }

  @Override
  public PublisherBuilder channel(Channel channel) {
    this.channel = channel;
    return this;
  }

  @Override
  public Publisher build() {
    boolean ownsChannel = this.channel == null;
    Channel publisherChannel = ownsChannel ? this.environment.openChannel() : this.channel;
    AtomicReference<Runnable> closingCallback = new AtomicReference<>(() -> {});
    ChannelPublisher publisher;
    try {
      publisher =
          new ChannelPublisher(
              publisherChannel,
              this.environment.channelLock(publisherChannel),
              ownsChannel,
              this.environment.effect(),
              this.environment.metricsCollector(),
              () -> closingCallback.get().run());
    } catch (RuntimeException e) {
      if (ownsChannel) {
        Utils.closeChannel(publisherChannel, this.environment.metricsCollector());
      }
      throw e;
    }
    closingCallback.set(this.environment.registerPublisher(publisher));
    return publisher;
  }
}
