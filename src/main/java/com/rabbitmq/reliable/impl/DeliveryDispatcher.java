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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.reliable.AcknowledgmentAction;
import com.rabbitmq.reliable.CompletionHandle;
import com.rabbitmq.reliable.Delivery;
import com.rabbitmq.reliable.DeliveryHandler;
import com.rabbitmq.reliable.Effect;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls the application handler for each delivery and acknowledges the delivery once the
 * handler outcome is known.
 *
 * <p>The dispatch thread never waits for the handler. Handler failures are converted into the
 * failure action and never reach the dispatch thread.
 */
class DeliveryDispatcher extends DefaultConsumer {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryDispatcher.class);

  private final String queue;
  private final DeliveryHandler handler;
  private final AcknowledgmentAction failureAction;
  private final Effect effect;
  private final MetricsCollector metricsCollector;
  private final Runnable cancellationCallback;

  DeliveryDispatcher(
      Channel channel,
      String queue,
      DeliveryHandler handler,
      AcknowledgmentAction failureAction,
      Effect effect,
      MetricsCollector metricsCollector,
      Runnable cancellationCallback) {
    super(channel);
    this.queue = queue;
    this.handler = handler;
    this.failureAction = failureAction;
    this.effect = effect;
    this.metricsCollector = metricsCollector;
    this.cancellationCallback = cancellationCallback;
  }

  @Override
  public void handleDelivery(
      String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
    Delivery delivery =
        new Delivery(
            body,
            consumerTag,
            envelope.getDeliveryTag(),
            envelope.isRedeliver(),
            envelope.getExchange(),
            envelope.getRoutingKey(),
            properties);
    LOGGER.debug("Received {} on {}", delivery, this.queue);
    this.metricsCollector.consume(1);
    AtomicBoolean acknowledged = new AtomicBoolean(false);
    safeHandle(delivery)
        .whenComplete(
            (action, failure) -> {
              AcknowledgmentAction outcome;
              if (failure == null && action != null) {
                outcome = action;
              } else {
                Throwable cause =
                    failure == null
                        ? new NullPointerException("handler resolved with a null action")
                        : failure;
                LOGGER.error(
                    "Unhandled exception processing delivery {} on {}",
                    delivery.deliveryTag(),
                    this.queue,
                    cause);
                this.metricsCollector.handlerFailure();
                outcome = this.failureAction;
              }
              // the handle drops exceptions thrown by its callbacks
              try {
                acknowledge(delivery, outcome, acknowledged);
              } catch (RuntimeException e) {
                LOGGER.error(
                    "Unexpected error while responding with {} to delivery {} on {}",
                    outcome,
                    delivery.deliveryTag(),
                    this.queue,
                    e);
              }
            });
  }

  private CompletionHandle<AcknowledgmentAction> safeHandle(Delivery delivery) {
    try {
      CompletionHandle<AcknowledgmentAction> outcome = this.handler.handle(delivery);
      if (outcome == null) {
        return this.effect.fail(new NullPointerException("handler returned a null handle"));
      } else {
        return outcome;
      }
    } catch (VirtualMachineError | LinkageError e) {
      throw e;
    } catch (Throwable e) {
      return this.effect.fail(e);
    }
  }

  private void acknowledge(
      Delivery delivery, AcknowledgmentAction action, AtomicBoolean acknowledged) {
    if (!acknowledged.compareAndSet(false, true)) {
      LOGGER.warn(
          "Delivery {} on {} has already been acknowledged, ignoring {}",
          delivery.deliveryTag(),
          this.queue,
          action);
      return;
    }
    LOGGER.debug("Responding with {} to {} on {}", action, delivery, this.queue);
    long deliveryTag = delivery.deliveryTag();
    try {
      switch (action) {
        case ACCEPT:
          getChannel().basicAck(deliveryTag, false);
          break;
        case REJECT_DISCARD:
          getChannel().basicNack(deliveryTag, false, false);
          break;
        case REJECT_REQUEUE:
          getChannel().basicNack(deliveryTag, false, true);
          break;
        default:
          throw new IllegalStateException("Unknown acknowledgment action: " + action);
      }
      this.metricsCollector.acknowledge(action);
    } catch (IOException | ShutdownSignalException e) {
      LOGGER.warn(
          "Error while responding with {} to delivery {} on {}: {}",
          action,
          deliveryTag,
          this.queue,
          Utils.exceptionMessage(e));
    }
  }

  @Override
  public void handleConsumeOk(String consumerTag) {
    super.handleConsumeOk(consumerTag);
    LOGGER.debug("Subscription {} on {} is active", consumerTag, this.queue);
  }

  @Override
  public void handleCancel(String consumerTag) {
    LOGGER.warn("Subscription {} on {} has been cancelled by the broker", consumerTag, this.queue);
    this.cancellationCallback.run();
  }

  @Override
  public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
    if (sig.isInitiatedByApplication()) {
      LOGGER.debug("Channel of subscription {} on {} closed", consumerTag, this.queue);
    } else {
      LOGGER.info(
          "Channel of subscription {} on {} closed: {}",
          consumerTag,
          this.queue,
          sig.getMessage());
    }
  }
}
