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
import com.rabbitmq.reliable.Constants;
import com.rabbitmq.reliable.Consumer;
import com.rabbitmq.reliable.DeliveryHandler;
import com.rabbitmq.reliable.Effect;
import com.rabbitmq.reliable.ReliableException;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ChannelConsumer implements Consumer {

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelConsumer.class);

  private final long id;
  private final String queue;
  private final String consumerTag;
  private final Channel channel;
  private final boolean ownsChannel;
  private final MetricsCollector metricsCollector;
  private final Runnable closingCallback;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile boolean cancelledByBroker = false;

  ChannelConsumer(
      String queue,
      String consumerTag,
      DeliveryHandler handler,
      AcknowledgmentAction failureAction,
      int prefetchCount,
      Channel channel,
      boolean ownsChannel,
      Effect effect,
      MetricsCollector metricsCollector,
      Runnable closingCallback) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.queue = queue;
    this.consumerTag = consumerTag;
    this.channel = channel;
    this.ownsChannel = ownsChannel;
    this.metricsCollector = metricsCollector;
    this.closingCallback = closingCallback;
    LOGGER.info(
        "Starting consumer {} on {} with consumer tag {} and a prefetch count of {}",
        this.id,
        queue,
        consumerTag,
        prefetchCount);
    DeliveryDispatcher dispatcher =
        new DeliveryDispatcher(
            channel,
            queue,
            handler,
            failureAction,
            effect,
            metricsCollector,
            () -> this.cancelledByBroker = true);
    try {
      this.channel.basicQos(prefetchCount);
      this.channel.basicConsume(queue, false, consumerTag, dispatcher);
    } catch (IOException | RuntimeException e) {
      LOGGER.error(
          "Failure when starting consumer on {} because {}",
          queue,
          Utils.exceptionMessage(e),
          e);
      if (this.ownsChannel) {
        Utils.closeChannel(this.channel, metricsCollector);
      }
      throw new ReliableException(
          "Error while starting consumer on " + queue, Constants.CODE_SUBSCRIPTION_FAILED, e);
    }
    LOGGER.info("Consumer {} on {} has been created", this.id, queue);
  }

  @Override
  public String consumerTag() {
    return this.consumerTag;
  }

  @Override
  public String queue() {
    return this.queue;
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing consumer {} on {}", this.id, this.queue);
      if (this.cancelledByBroker) {
        LOGGER.debug("Subscription {} already cancelled by the broker", this.consumerTag);
      } else if (this.channel.isOpen()) {
        try {
          this.channel.basicCancel(this.consumerTag);
        } catch (IOException | RuntimeException e) {
          LOGGER.info(
              "Error while cancelling subscription {} on {}: {}",
              this.consumerTag,
              this.queue,
              Utils.exceptionMessage(e));
        }
      }
      if (this.ownsChannel) {
        Utils.closeChannel(this.channel, this.metricsCollector);
      }
      this.closingCallback.run();
      LOGGER.debug("Closed consumer {} successfully", this.id);
    }
  }

  boolean isOpen() {
    return !this.closed.get();
  }

  @Override
  public String toString() {
    return "{ "
        + "\"id\" : "
        + id
        + ","
        + "\"queue\" : \""
        + queue
        + "\","
        + "\"consumer_tag\" : \""
        + consumerTag
        + "\""
        + "}";
  }
}
