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
 * Callback API for inbound messages.
 *
 * <p>The handler returns the outcome of the processing asynchronously, so a slow handler does
 * not block the thread that dispatches deliveries. A handler that throws or returns a failed
 * handle gets the failure action of its consumer.
 *
 * @see ConsumerBuilder#handler(DeliveryHandler)
 * @see ConsumerBuilder#failureAction(AcknowledgmentAction)
 */
@FunctionalInterface
public interface DeliveryHandler {

  /**
   * Callback for an inbound message.
   *
   * @param delivery the message
   * @return the handle resolved with the action to acknowledge the message with
   */
  CompletionHandle<AcknowledgmentAction> handle(Delivery delivery);
}
