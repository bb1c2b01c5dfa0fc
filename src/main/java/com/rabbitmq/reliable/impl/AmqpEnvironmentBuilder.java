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

import com.rabbitmq.client.Connection;
import com.rabbitmq.reliable.Effect;
import com.rabbitmq.reliable.Environment;
import com.rabbitmq.reliable.EnvironmentBuilder;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import com.rabbitmq.reliable.metrics.NoOpMetricsCollector;

public class AmqpEnvironmentBuilder implements EnvironmentBuilder {

  private Connection connection;
  private Effect effect;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.SINGLETON;

  public AmqpEnvironmentBuilder() {}

  @Override
  public EnvironmentBuilder connection(Connection connection) {
    this.connection = connection;
    return this;
  }

  @Override
  public EnvironmentBuilder effect(Effect effect) {
    this.effect = effect;
    return this;
  }

  @Override
  public EnvironmentBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  @Override
  public Environment build() {
    if (this.connection == null) {
      throw new IllegalArgumentException("A connection must be set");
    }
    Effect environmentEffect = this.effect == null ? Effect.completableFuture() : this.effect;
    MetricsCollector environmentMetricsCollector =
        this.metricsCollector == null ? NoOpMetricsCollector.SINGLETON : this.metricsCollector;
    return new AmqpEnvironment(this.connection, environmentEffect, environmentMetricsCollector);
  }
}
