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
import com.rabbitmq.client.Connection;
import com.rabbitmq.reliable.ConsumerBuilder;
import com.rabbitmq.reliable.Effect;
import com.rabbitmq.reliable.Environment;
import com.rabbitmq.reliable.PublisherBuilder;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.WeakHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class AmqpEnvironment implements Environment {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpEnvironment.class);

  private final Connection connection;
  private final Effect effect;
  private final MetricsCollector metricsCollector;
  private final List<ChannelPublisher> publishers = new CopyOnWriteArrayList<>();
  private final List<ChannelConsumer> consumers = new CopyOnWriteArrayList<>();
  // publishers sharing a channel must share its sequence number lock
  private final Map<Channel, Lock> channelLocks =
      Collections.synchronizedMap(new WeakHashMap<>());
  private final AtomicBoolean closed = new AtomicBoolean(false);

  AmqpEnvironment(Connection connection, Effect effect, MetricsCollector metricsCollector) {
    this.connection = connection;
    this.effect = effect;
    this.metricsCollector = metricsCollector;
  }

  @Override
  public Effect effect() {
    return this.effect;
  }

  @Override
  public PublisherBuilder publisherBuilder() {
    checkNotClosed();
    return new ChannelPublisherBuilder(this);
  }

  @Override
  public ConsumerBuilder consumerBuilder() {
    checkNotClosed();
    return new ChannelConsumerBuilder(this);
  }

  Channel openChannel() {
    checkNotClosed();
    return Utils.openChannel(this.connection, this.metricsCollector);
  }

  Lock channelLock(Channel channel) {
    return this.channelLocks.computeIfAbsent(channel, c -> new ReentrantLock());
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  Runnable registerPublisher(ChannelPublisher publisher) {
    this.publishers.add(publisher);
    return () -> this.publishers.remove(publisher);
  }

  Runnable registerConsumer(ChannelConsumer consumer) {
    this.consumers.add(consumer);
    return () -> this.consumers.remove(consumer);
  }

  // for testing
  int publisherCount() {
    return this.publishers.size();
  }

  // for testing
  int consumerCount() {
    return this.consumers.size();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      for (ChannelConsumer consumer : consumers) {
        try {
          consumer.close();
        } catch (Exception e) {
          LOGGER.warn("Error while closing consumer, moving on to the next one", e);
        }
      }

      for (ChannelPublisher publisher : publishers) {
        try {
          publisher.close();
        } catch (Exception e) {
          LOGGER.warn("Error while closing publisher, moving on to the next one", e);
        }
      }
      LOGGER.debug("Environment closed");
    }
  }

  private void checkNotClosed() {
    if (this.closed.get()) {
      throw new IllegalStateException("This environment instance has been closed");
    }
  }

  @Override
  public String toString() {
    return "{ "
        + "\"publishers\" : "
        + publishers.size()
        + ", \"consumers\" : "
        + consumers.size()
        + ", \"effect\" : \""
        + effect
        + "\""
        + "}";
  }
}
