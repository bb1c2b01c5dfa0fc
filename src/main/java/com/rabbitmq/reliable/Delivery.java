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

import com.rabbitmq.client.AMQP;

/**
 * A message received from the broker.
 *
 * <p>A delivery is acknowledged exactly once, according to the {@link AcknowledgmentAction}
 * its {@link DeliveryHandler} returns.
 */
public final class Delivery {

  private final byte[] body;
  private final String consumerTag;
  private final long deliveryTag;
  private final boolean redelivered;
  private final String exchange;
  private final String routingKey;
  private final AMQP.BasicProperties properties;

  public Delivery(
      byte[] body,
      String consumerTag,
      long deliveryTag,
      boolean redelivered,
      String exchange,
      String routingKey,
      AMQP.BasicProperties properties) {
    this.body = body == null ? new byte[0] : body.clone();
    this.consumerTag = consumerTag;
    this.deliveryTag = deliveryTag;
    this.redelivered = redelivered;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.properties = properties;
  }

  /**
   * A copy of the message body.
   *
   * @return the body
   */
  public byte[] body() {
    return body.clone();
  }

  public String consumerTag() {
    return consumerTag;
  }

  /**
   * The delivery tag, unique in the channel the message has been delivered on.
   *
   * @return the delivery tag
   */
  public long deliveryTag() {
    return deliveryTag;
  }

  /**
   * Whether the broker has already delivered this message (and it has not been accepted).
   *
   * @return true if the message is a redelivery
   */
  public boolean redelivered() {
    return redelivered;
  }

  public String exchange() {
    return exchange;
  }

  public String routingKey() {
    return routingKey;
  }

  public AMQP.BasicProperties properties() {
    return properties;
  }

  @Override
  public String toString() {
    return "Delivery{"
        + "consumerTag='"
        + consumerTag
        + '\''
        + ", deliveryTag="
        + deliveryTag
        + ", redelivered="
        + redelivered
        + ", exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + ", body size="
        + body.length
        + '}';
  }
}
