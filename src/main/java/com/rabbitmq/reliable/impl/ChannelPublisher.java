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

import static com.rabbitmq.reliable.impl.Utils.formatConstant;
import static com.rabbitmq.reliable.impl.Utils.lock;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.reliable.CompletionHandle;
import com.rabbitmq.reliable.Constants;
import com.rabbitmq.reliable.Effect;
import com.rabbitmq.reliable.Promise;
import com.rabbitmq.reliable.PublishCommand;
import com.rabbitmq.reliable.PublishException;
import com.rabbitmq.reliable.Publisher;
import com.rabbitmq.reliable.ReliableException;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ChannelPublisher implements Publisher {

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelPublisher.class);

  private final long id;
  private final Channel channel;
  private final boolean ownsChannel;
  private final Effect effect;
  private final MetricsCollector metricsCollector;
  private final Lock channelLock;
  private final ConfirmTracker confirmTracker;
  private final ConfirmListener confirmListener;
  private final ShutdownListener shutdownListener;
  private final Runnable closingCallback;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  ChannelPublisher(
      Channel channel,
      Lock channelLock,
      boolean ownsChannel,
      Effect effect,
      MetricsCollector metricsCollector,
      Runnable closingCallback) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.channel = channel;
    this.channelLock = channelLock;
    this.ownsChannel = ownsChannel;
    this.effect = effect;
    this.metricsCollector = metricsCollector;
    this.closingCallback = closingCallback;
    this.confirmTracker = new ConfirmTracker(this.channelLock);
    LOGGER.info("Creating publisher {} on channel {}", this.id, channel.getChannelNumber());
    try {
      this.channel.confirmSelect();
    } catch (IOException | RuntimeException e) {
      LOGGER.error(
          "Error while enabling publisher confirms for publisher {}: {}",
          this.id,
          Utils.exceptionMessage(e),
          e);
      throw new ReliableException(
          "Error while enabling publisher confirms", Constants.CODE_CONFIRM_SELECT_FAILED, e);
    }
    this.confirmListener =
        new ConfirmListener() {
          @Override
          public void handleAck(long deliveryTag, boolean multiple) {
            LOGGER.debug(
                "Publish acknowledged with sequence number {}, multiple = {}",
                deliveryTag,
                multiple);
            int count = confirmTracker.resolveAccepted(deliveryTag, multiple);
            if (count > 0) {
              metricsCollector.publishConfirm(count);
            }
          }

          @Override
          public void handleNack(long deliveryTag, boolean multiple) {
            LOGGER.error(
                "Publish negatively acknowledged with sequence number {}, multiple = {}",
                deliveryTag,
                multiple);
            int count = confirmTracker.resolveRejected(deliveryTag, multiple);
            if (count > 0) {
              metricsCollector.publishError(count);
            }
          }
        };
    this.shutdownListener = this::channelShutdown;
    this.channel.addConfirmListener(this.confirmListener);
    this.channel.addShutdownListener(this.shutdownListener);
    LOGGER.info("Publisher {} has been created successfully", this.id);
  }

  @Override
  public CompletionHandle<Void> publish(PublishCommand command) {
    if (command == null) {
      throw new IllegalArgumentException("publish command cannot be null");
    }
    Promise<Void> promise = this.effect.promise();
    PublishException failure;
    this.channelLock.lock();
    try {
      if (this.closed.get()) {
        failure =
            new PublishException(
                Constants.MESSAGE_PUBLISHER_CLOSED, Constants.CODE_PUBLISHER_CLOSED, -1);
      } else {
        failure = doPublish(command, promise);
      }
    } finally {
      this.channelLock.unlock();
    }
    // resolution outside of the lock, continuations can be arbitrary application code
    if (failure != null) {
      promise.fail(failure);
    }
    return promise;
  }

  private PublishException doPublish(PublishCommand command, Promise<Void> promise) {
    long sequenceNumber = this.channel.getNextPublishSeqNo();
    LOGGER.debug(
        "Publishing with sequence number {} to {} with {}",
        sequenceNumber,
        command.description(),
        command.properties());
    if (!this.confirmTracker.register(sequenceNumber, promise)) {
      return new PublishException(
          Constants.MESSAGE_DUPLICATE_SEQUENCE_NUMBER,
          Constants.CODE_DUPLICATE_SEQUENCE_NUMBER,
          sequenceNumber);
    }
    this.metricsCollector.publish(1);
    try {
      this.channel.basicPublish(
          command.exchange(), command.routingKey(), command.properties(), command.body());
      return null;
    } catch (IOException | RuntimeException e) {
      LOGGER.error(
          "Failed to publish message with sequence number {} to {}",
          sequenceNumber,
          command.description(),
          e);
      this.confirmTracker.remove(sequenceNumber);
      this.metricsCollector.publishError(1);
      return new PublishException(
          Constants.MESSAGE_PUBLISH_TRANSPORT_FAILURE,
          Constants.CODE_PUBLISH_TRANSPORT_FAILURE,
          sequenceNumber,
          e);
    }
  }

  private void channelShutdown(ShutdownSignalException cause) {
    int count =
        this.confirmTracker.failAll(
            Constants.MESSAGE_CHANNEL_CLOSED, Constants.CODE_CHANNEL_CLOSED, cause);
    if (count > 0) {
      LOGGER.info(
          "Channel of publisher {} closed with {} outstanding publication(s), failed them",
          this.id,
          count);
      this.metricsCollector.publishError(count);
    } else {
      LOGGER.debug("Channel of publisher {} closed", this.id);
    }
  }

  @Override
  public void close() {
    // publications registered before the flag flips are failed below, later ones see the flag
    boolean closing = lock(this.channelLock, () -> this.closed.compareAndSet(false, true));
    if (closing) {
      LOGGER.debug("Closing publisher {}", this.id);
      this.channel.removeConfirmListener(this.confirmListener);
      this.channel.removeShutdownListener(this.shutdownListener);
      int count =
          this.confirmTracker.failAll(
              Constants.MESSAGE_PUBLISHER_CLOSED, Constants.CODE_PUBLISHER_CLOSED, null);
      if (count > 0) {
        LOGGER.debug(
            "Failed {} outstanding publication(s) of publisher {} with code {}",
            count,
            this.id,
            formatConstant(Constants.CODE_PUBLISHER_CLOSED));
        this.metricsCollector.publishError(count);
      }
      if (this.ownsChannel) {
        Utils.closeChannel(this.channel, this.metricsCollector);
      }
      this.closingCallback.run();
      LOGGER.debug("Closed publisher {} successfully", this.id);
    }
  }

  boolean isOpen() {
    return !this.closed.get();
  }

  // for testing
  int unconfirmedCount() {
    return this.confirmTracker.size();
  }

  @Override
  public String toString() {
    return "{ " + "\"id\" : " + id + "," + "\"channel\" : " + channel.getChannelNumber() + "}";
  }
}
