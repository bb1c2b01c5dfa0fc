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
 * Outcome of the processing of a {@link Delivery}.
 *
 * <p>The consumer issues exactly one acknowledgment call on the channel for each delivery,
 * depending on the action returned by the {@link DeliveryHandler}.
 *
 * @see DeliveryHandler
 * @see ConsumerBuilder#failureAction(AcknowledgmentAction)
 */
public enum AcknowledgmentAction {
  /** Positive acknowledgment, the broker removes the message from the queue. */
  ACCEPT,
  /**
   * Negative acknowledgment without requeueing, the broker dead-letters or drops the message.
   */
  REJECT_DISCARD,
  /** Negative acknowledgment with requeueing, the broker redelivers the message. */
  REJECT_REQUEUE
}
