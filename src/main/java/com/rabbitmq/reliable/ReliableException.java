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
 * Generic client exception.
 *
 * @see Constants
 */
public class ReliableException extends RuntimeException {

  private static final long serialVersionUID = 4181939458713285602L;

  private final short code;

  public ReliableException(String message) {
    super(message);
    this.code = Constants.CODE_UNKNOWN;
  }

  public ReliableException(String message, short code) {
    super(message);
    this.code = code;
  }

  public ReliableException(Throwable cause) {
    super(null, cause);
    this.code = Constants.CODE_UNKNOWN;
  }

  public ReliableException(String message, Throwable cause) {
    super(message, cause);
    this.code = Constants.CODE_UNKNOWN;
  }

  public ReliableException(String message, short code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public short getCode() {
    return code;
  }
}
