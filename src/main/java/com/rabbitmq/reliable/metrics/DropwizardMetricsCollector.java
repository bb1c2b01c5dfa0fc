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
package com.rabbitmq.reliable.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.rabbitmq.reliable.AcknowledgmentAction;

public class DropwizardMetricsCollector implements MetricsCollector {

  private final Counter channels;

  private final Meter publish;
  private final Meter publishConfirm;
  private final Meter publishError;
  private final Meter consume;
  private final Meter accepted;
  private final Meter discarded;
  private final Meter requeued;
  private final Meter handlerFailure;

  private final Counter outstandingPublishConfirm;

  public DropwizardMetricsCollector(MetricRegistry registry, String metricsPrefix) {
    this.channels = registry.counter(metricsPrefix + ".channels");
    this.publish = registry.meter(metricsPrefix + ".published");
    this.publishConfirm = registry.meter(metricsPrefix + ".confirmed");
    this.publishError = registry.meter(metricsPrefix + ".errored");
    this.consume = registry.meter(metricsPrefix + ".consumed");
    this.accepted = registry.meter(metricsPrefix + ".accepted");
    this.discarded = registry.meter(metricsPrefix + ".discarded");
    this.requeued = registry.meter(metricsPrefix + ".requeued");
    this.handlerFailure = registry.meter(metricsPrefix + ".handler_failed");
    this.outstandingPublishConfirm =
        registry.counter(metricsPrefix + ".outstanding_publish_confirm");
  }

  public DropwizardMetricsCollector() {
    this(new MetricRegistry());
  }

  public DropwizardMetricsCollector(MetricRegistry metricRegistry) {
    this(metricRegistry, "rabbitmq.reliable");
  }

  @Override
  public void openChannel() {
    this.channels.inc();
  }

  @Override
  public void closeChannel() {
    this.channels.dec();
  }

  @Override
  public void publish(int count) {
    publish.mark(count);
    outstandingPublishConfirm.inc(count);
  }

  @Override
  public void publishConfirm(int count) {
    publishConfirm.mark(count);
    outstandingPublishConfirm.dec(count);
  }

  @Override
  public void publishError(int count) {
    publishError.mark(count);
    outstandingPublishConfirm.dec(count);
  }

  @Override
  public void consume(long count) {
    consume.mark(count);
  }

  @Override
  public void acknowledge(AcknowledgmentAction action) {
    switch (action) {
      case ACCEPT:
        accepted.mark();
        break;
      case REJECT_DISCARD:
        discarded.mark();
        break;
      case REJECT_REQUEUE:
        requeued.mark();
        break;
      default:
        throw new IllegalArgumentException("Unknown acknowledgment action: " + action);
    }
  }

  @Override
  public void handlerFailure() {
    handlerFailure.mark();
  }
}
