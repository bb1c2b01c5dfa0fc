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

import com.rabbitmq.reliable.AcknowledgmentAction;
import io.micrometer.core.instrument.*;

import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

public class MicrometerMetricsCollector implements MetricsCollector {

    private final AtomicLong channels;
    private final Counter publish;
    private final Counter publishConfirm;
    private final Counter publishError;
    private final Counter consume;
    private final Counter accepted;
    private final Counter discarded;
    private final Counter requeued;
    private final Counter handlerFailure;

    private final AtomicLong outstandingPublishConfirm;

    public MicrometerMetricsCollector(MeterRegistry registry) {
        this(registry, "rabbitmq.reliable");
    }

    public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
        this(registry, prefix, Collections.emptyList());
    }

    public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix, final String ... tags) {
        this(registry, prefix, Tags.of(tags));
    }

    public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
        this.channels = registry.gauge(prefix + ".channels", tags, new AtomicLong(0));
        this.publish = registry.counter(prefix + ".published", tags);
        this.publishConfirm = registry.counter(prefix + ".confirmed", tags);
        this.publishError = registry.counter(prefix + ".errored", tags);
        this.consume = registry.counter(prefix + ".consumed", tags);
        this.accepted = registry.counter(prefix + ".accepted", tags);
        this.discarded = registry.counter(prefix + ".discarded", tags);
        this.requeued = registry.counter(prefix + ".requeued", tags);
        this.handlerFailure = registry.counter(prefix + ".handler_failed", tags);
        this.outstandingPublishConfirm = registry.gauge(prefix + ".outstanding_publish_confirm", tags, new AtomicLong(0));
    }

    @Override
    public void openChannel() {
        channels.incrementAndGet();
    }

    @Override
    public void closeChannel() {
        channels.decrementAndGet();
    }

    @Override
    public void publish(int count) {
        publish.increment(count);
        outstandingPublishConfirm.addAndGet(count);
    }

    @Override
    public void publishConfirm(int count) {
        publishConfirm.increment(count);
        outstandingPublishConfirm.addAndGet(-count);
    }

    @Override
    public void publishError(int count) {
        publishError.increment(count);
        outstandingPublishConfirm.addAndGet(-count);
    }

    @Override
    public void consume(long count) {
        consume.increment(count);
    }

    @Override
    public void acknowledge(AcknowledgmentAction action) {
        switch (action) {
            case ACCEPT:
                accepted.increment();
                break;
            case REJECT_DISCARD:
                discarded.increment();
                break;
            case REJECT_REQUEUE:
                requeued.increment();
                break;
            default:
                throw new IllegalArgumentException("Unknown acknowledgment action: " + action);
        }
    }

    @Override
    public void handlerFailure() {
        handlerFailure.increment();
    }
}
