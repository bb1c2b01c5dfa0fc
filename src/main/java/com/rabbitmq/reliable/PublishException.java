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
 * Failure of a publication, set on the {@link CompletionHandle} returned by {@link
 * Publisher#publish(PublishCommand)}.
 *
 * <p>The code tells why the publication failed: transport failure, broker reject, channel
 * closed before the confirmation, etc. Failed publications are never retried by the library.
 *
 * @see Constants#CODE_PUBLISH_TRANSPORT_FAILURE
 * @see Constants#CODE_PUBLISH_REJECTED
 * @see Constants#CODE_CHANNEL_CLOSED
 * @see Constants#CODE_PUBLISHER_CLOSED
 */
public class PublishException extends ReliableException {

  private static final long serialVersionUID = -2296372620484577410L;

  private final long sequenceNumber;

  public PublishException(String message, short code, long sequenceNumber) {
    super(message, code);
    this.sequenceNumber = sequenceNumber;
  }

  public PublishException(String message, short code, long sequenceNumber, Throwable cause) {
    super(message, code, cause);
    this.sequenceNumber = sequenceNumber;
  }

  /**
   * The sequence number of the publication, -1 if the publication did not get one.
   *
   * @return the publish sequence number
   */
  public long getSequenceNumber() {
    return sequenceNumber;
  }
}
