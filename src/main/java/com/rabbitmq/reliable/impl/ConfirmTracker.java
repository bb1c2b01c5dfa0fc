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

import static com.rabbitmq.reliable.impl.Utils.lock;

import com.rabbitmq.reliable.Constants;
import com.rabbitmq.reliable.Promise;
import com.rabbitmq.reliable.PublishException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outstanding publications of a channel, keyed by publish sequence number.
 *
 * <p>The map is mutated only under the channel lock, which the publisher also holds while it
 * gets the next sequence number, registers the publication, and sends the message. Promises
 * are resolved outside of the lock.
 */
final class ConfirmTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfirmTracker.class);

  private final Lock lock;
  private final NavigableMap<Long, Promise<Void>> unconfirmed = new TreeMap<>();

  ConfirmTracker(Lock lock) {
    this.lock = lock;
  }

  /**
   * Register a publication.
   *
   * @return false if the sequence number is already registered, the registration is then
   *     ignored
   */
  boolean register(long sequenceNumber, Promise<Void> promise) {
    return lock(
        this.lock,
        () -> {
          if (this.unconfirmed.containsKey(sequenceNumber)) {
            LOGGER.error(
                "Publish sequence number {} is already registered, ignoring registration",
                sequenceNumber);
            return false;
          } else {
            this.unconfirmed.put(sequenceNumber, promise);
            return true;
          }
        });
  }

  /**
   * Remove a publication without resolving it.
   *
   * @return the promise of the publication, null if there is none
   */
  Promise<Void> remove(long sequenceNumber) {
    return lock(this.lock, () -> this.unconfirmed.remove(sequenceNumber));
  }

  /**
   * Resolve with success the publication with the given sequence number, or all the
   * publications up to it if cumulative.
   *
   * @return the number of resolved publications
   */
  int resolveAccepted(long sequenceNumber, boolean cumulative) {
    Map<Long, Promise<Void>> resolved = removeUpTo(sequenceNumber, cumulative);
    for (Promise<Void> promise : resolved.values()) {
      promise.succeed(null);
    }
    return resolved.size();
  }

  /**
   * Resolve with failure the publication with the given sequence number, or all the
   * publications up to it if cumulative.
   *
   * @return the number of resolved publications
   */
  int resolveRejected(long sequenceNumber, boolean cumulative) {
    Map<Long, Promise<Void>> resolved = removeUpTo(sequenceNumber, cumulative);
    for (Entry<Long, Promise<Void>> entry : resolved.entrySet()) {
      entry
          .getValue()
          .fail(
              new PublishException(
                  Constants.MESSAGE_PUBLISH_REJECTED,
                  Constants.CODE_PUBLISH_REJECTED,
                  entry.getKey()));
    }
    return resolved.size();
  }

  /**
   * Fail all the outstanding publications.
   *
   * @return the number of failed publications
   */
  int failAll(String message, short code, Throwable cause) {
    Map<Long, Promise<Void>> outstanding =
        lock(
            this.lock,
            () -> {
              Map<Long, Promise<Void>> snapshot = new TreeMap<>(this.unconfirmed);
              this.unconfirmed.clear();
              return snapshot;
            });
    Iterator<Entry<Long, Promise<Void>>> iterator = outstanding.entrySet().iterator();
    while (iterator.hasNext()) {
      Entry<Long, Promise<Void>> entry = iterator.next();
      entry.getValue().fail(new PublishException(message, code, entry.getKey(), cause));
    }
    return outstanding.size();
  }

  int size() {
    return lock(this.lock, this.unconfirmed::size);
  }

  // for testing
  List<Long> sequenceNumbers() {
    return lock(this.lock, () -> new ArrayList<>(this.unconfirmed.keySet()));
  }

  private Map<Long, Promise<Void>> removeUpTo(long sequenceNumber, boolean cumulative) {
    Map<Long, Promise<Void>> removed =
        lock(
            this.lock,
            () -> {
              if (cumulative) {
                NavigableMap<Long, Promise<Void>> head =
                    this.unconfirmed.headMap(sequenceNumber, true);
                Map<Long, Promise<Void>> result = new TreeMap<>(head);
                head.clear();
                return result;
              } else {
                Promise<Void> promise = this.unconfirmed.remove(sequenceNumber);
                if (promise == null) {
                  return Collections.<Long, Promise<Void>>emptyMap();
                } else {
                  return Collections.singletonMap(sequenceNumber, promise);
                }
              }
            });
    if (removed.isEmpty()) {
      LOGGER.debug(
          "No outstanding publication for sequence number {} (cumulative = {})",
          sequenceNumber,
          cumulative);
    }
    return removed;
  }
}
