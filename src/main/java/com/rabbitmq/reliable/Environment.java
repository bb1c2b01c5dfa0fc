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

/**
 * The {@link Environment} is the main entry point to the library.
 *
 * <p>It wraps an AMQP connection and creates {@link Publisher}s and {@link Consumer}s on it.
 *
 * <p>Applications are supposed to use a single instance of {@link Environment} per connection.
 *
 * @see EnvironmentBuilder
 */
public interface Environment extends AutoCloseable {

  /**
   * Create a builder to configure and create an {@link Environment}
   *
   * @return this builder instance
   */
  static EnvironmentBuilder builder() {
    try {
      return (EnvironmentBuilder)
          Class.forName("com.rabbitmq.reliable.impl.AmqpEnvironmentBuilder")
              .getConstructor()
              .newInstance();
    } catch (Exception e) {
      throw new ReliableException("Error while creating environment builder", e);
    }
  }

  /**
   * The effect publishers and consumers of this environment use.
   *
   * @return the effect
   */
  Effect effect();

  /**
   * Create a {@link PublisherBuilder} to configure and create a {@link Publisher}.
   *
   * @return the publisher builder
   */
  PublisherBuilder publisherBuilder();

  /**
   * Create a {@link ConsumerBuilder} to configure and create a {@link Consumer}
   *
   * @return the consumer builder
   */
  ConsumerBuilder consumerBuilder();

  /**
   * Close the environment and its publishers and consumers.
   *
   * <p>The connection is not closed, the application owns it.
   */
  @Override
  void close();
}
