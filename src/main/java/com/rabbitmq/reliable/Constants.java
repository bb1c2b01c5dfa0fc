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

/** Various constants (error codes, default values, etc). */
public final class Constants {

  public static final short CODE_UNKNOWN = -1;

  public static final short CODE_PUBLISH_TRANSPORT_FAILURE = 1;
  public static final short CODE_PUBLISH_REJECTED = 2;
  public static final short CODE_CHANNEL_CLOSED = 3;
  public static final short CODE_PUBLISHER_CLOSED = 4;
  public static final short CODE_DUPLICATE_SEQUENCE_NUMBER = 5;

  public static final short CODE_CHANNEL_OPENING_FAILED = 10;
  public static final short CODE_CONFIRM_SELECT_FAILED = 11;
  public static final short CODE_SUBSCRIPTION_FAILED = 12;

  public static final String MESSAGE_PUBLISH_TRANSPORT_FAILURE = "transport send failure";
  public static final String MESSAGE_PUBLISH_REJECTED = "broker rejected publication";
  public static final String MESSAGE_CHANNEL_CLOSED = "channel closed before confirmation";
  public static final String MESSAGE_PUBLISHER_CLOSED = "publisher closed";
  public static final String MESSAGE_DUPLICATE_SEQUENCE_NUMBER = "duplicate sequence number";

  private Constants() {}
}
