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

import com.rabbitmq.client.Connection;
import com.rabbitmq.reliable.metrics.MetricsCollector;

/**
 * API to configure and create an {@link Environment}.
 *
 * @see Environment
 */
public interface EnvironmentBuilder {

  /**
   * The AMQP connection to open channels on.
   *
   * <p>The connection must be open. The application owns it, the environment does not close it.
   *
   * @param connection
   * @return this builder instance
   */
  EnvironmentBuilder connection(Connection connection);

  /**
   * The asynchronous primitive for publication outcomes and handler results.
   *
   * <p>Default is {@link Effect#completableFuture()}.
   *
   * @param effect
   * @return this builder instance
   */
  EnvironmentBuilder effect(Effect effect);

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector
   * @return this builder instance
   */
  EnvironmentBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Create the {@link Environment} instance.
   *
   * @return the configured environment
   */
  Environment build();
}
