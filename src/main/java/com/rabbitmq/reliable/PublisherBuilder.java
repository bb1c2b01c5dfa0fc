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

import com.rabbitmq.client.Channel;

/** API to create and configure a {@link Publisher}. */
public interface PublisherBuilder {

  /**
   * The channel to publish on.
   *
   * <p>The channel is put in confirm mode. The application keeps ownership of the channel: the
   * publisher does not close it. There should be only one publisher per channel.
   *
   * <p>The environment opens a dedicated channel if none is set.
   *
   * @param channel
   * @return this builder instance
   */
  PublisherBuilder channel(Channel channel);

  /**
   * Create the {@link Publisher} instance.
   *
   * @return the configured publisher
   */
  Publisher build();
}
