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
import java.util.Arrays;
import java.util.Objects;

/**
 * A message to publish: exchange, routing key, properties, and body.
 *
 * <p>Instances are immutable.
 *
 * @see Publisher#publish(PublishCommand)
 */
public final class PublishCommand {

  private static final AMQP.BasicProperties EMPTY_PROPERTIES =
      new AMQP.BasicProperties.Builder().build();

  private final String exchange;
  private final String routingKey;
  private final AMQP.BasicProperties properties;
  private final byte[] body;

  public PublishCommand(
      String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body) {
    if (exchange == null) {
      throw new IllegalArgumentException("exchange cannot be null, use empty string for default");
    }
    if (routingKey == null) {
      throw new IllegalArgumentException("routing key cannot be null");
    }
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.properties = properties == null ? EMPTY_PROPERTIES : properties;
    this.body = body == null ? new byte[0] : body.clone();
  }

  public static Builder builder() {
    return new Builder();
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

  /**
   * A copy of the message body.
   *
   * @return the body
   */
  public byte[] body() {
    return body.clone();
  }

  /**
   * Human-readable destination of the message.
   *
   * @return exchange and routing key
   */
  public String description() {
    return "'" + exchange + "':'" + routingKey + "'";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PublishCommand that = (PublishCommand) o;
    return exchange.equals(that.exchange)
        && routingKey.equals(that.routingKey)
        && properties.equals(that.properties)
        && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(exchange, routingKey, properties);
    result = 31 * result + Arrays.hashCode(body);
    return result;
  }

  @Override
  public String toString() {
    return "PublishCommand{"
        + "exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + ", properties="
        + properties
        + ", body size="
        + body.length
        + '}';
  }

  /** Builder for {@link PublishCommand}. */
  public static final class Builder {

    private String exchange = "";
    private String routingKey;
    private AMQP.BasicProperties properties;
    private byte[] body;

    private Builder() {}

    /**
     * The exchange to publish to.
     *
     * <p>Default is the default exchange (empty string).
     *
     * @param exchange
     * @return this builder instance
     */
    public Builder exchange(String exchange) {
      this.exchange = exchange;
      return this;
    }

    public Builder routingKey(String routingKey) {
      this.routingKey = routingKey;
      return this;
    }

    public Builder properties(AMQP.BasicProperties properties) {
      this.properties = properties;
      return this;
    }

    public Builder body(byte[] body) {
      this.body = body;
      return this;
    }

    public PublishCommand build() {
      return new PublishCommand(exchange, routingKey, properties, body);
    }
  }
}
