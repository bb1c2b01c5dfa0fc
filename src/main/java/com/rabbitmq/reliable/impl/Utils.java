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
import com.rabbitmq.reliable.Constants;
import com.rabbitmq.reliable.ReliableException;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class Utils {

  private static final Logger LOGGER = LoggerFactory.getLogger(Utils.class);
  private static final Map<Short, String> CONSTANT_LABELS;

  static {
    Map<Short, String> labels = new HashMap<>();
    Arrays.stream(Constants.class.getDeclaredFields())
        .filter(f -> f.getName().startsWith("CODE_"))
        .forEach(
            field -> {
              try {
                labels.put(field.getShort(null), field.getName().replace("CODE_", ""));
              } catch (IllegalAccessException e) {
                LOGGER.info("Error while trying to access field Constants." + field.getName());
              }
            });
    CONSTANT_LABELS = Collections.unmodifiableMap(labels);
  }

  private Utils() {}

  static String formatConstant(short value) {
    return value + " (" + CONSTANT_LABELS.getOrDefault(value, "UNKNOWN") + ")";
  }

  static String generateConsumerTag(String queue) {
    return "ctag-" + queue + "-" + UUID.randomUUID();
  }

  static String exceptionMessage(Exception e) {
    if (e == null) {
      return "unknown";
    } else if (e.getMessage() == null) {
      return e.getClass().getSimpleName();
    } else {
      return e.getMessage() + " (" + e.getClass().getSimpleName() + ")";
    }
  }

  static Channel openChannel(Connection connection, MetricsCollector metricsCollector) {
    LOGGER.info("Starting channel");
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Failure when starting channel because {}", exceptionMessage(e), e);
      throw new ReliableException(
          "Error while opening channel", Constants.CODE_CHANNEL_OPENING_FAILED, e);
    }
    if (channel == null) {
      LOGGER.error("Failure when starting channel, no channel number available");
      throw new ReliableException(
          "No channel number available on connection", Constants.CODE_CHANNEL_OPENING_FAILED);
    }
    metricsCollector.openChannel();
    LOGGER.info("Channel {} has been started successfully", channel.getChannelNumber());
    return channel;
  }

  static void closeChannel(Channel channel, MetricsCollector metricsCollector) {
    try {
      if (channel.isOpen()) {
        channel.close();
      }
    } catch (IOException | TimeoutException | RuntimeException e) {
      LOGGER.info(
          "Error while closing channel {}: {}", channel.getChannelNumber(), exceptionMessage(e));
    } finally {
      metricsCollector.closeChannel();
    }
  }

  static void lock(Lock lock, Runnable action) {
    lock(
        lock,
        () -> {
          action.run();
          return null;
        });
  }

  static <T> T lock(Lock lock, Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
