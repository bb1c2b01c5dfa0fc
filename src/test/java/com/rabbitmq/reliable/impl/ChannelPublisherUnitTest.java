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

import static com.rabbitmq.reliable.impl.TestUtils.command;
import static com.rabbitmq.reliable.impl.TestUtils.confirmListener;
import static com.rabbitmq.reliable.impl.TestUtils.failureOf;
import static com.rabbitmq.reliable.impl.TestUtils.waitAtMost;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.reliable.CompletionHandle;
import com.rabbitmq.reliable.Constants;
import com.rabbitmq.reliable.Effect;
import com.rabbitmq.reliable.PublishCommand;
import com.rabbitmq.reliable.PublishException;
import com.rabbitmq.reliable.ReliableException;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import com.rabbitmq.reliable.metrics.MicrometerMetricsCollector;
import com.rabbitmq.reliable.metrics.NoOpMetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class ChannelPublisherUnitTest {

  @Mock Channel channel;

  AutoCloseable mocks;
  AtomicLong nextSequenceNumber;
  BlockingQueue<Long> sentSequenceNumbers;
  AtomicInteger closingCallbackCalls;
  Effect effect = Effect.completableFuture();
  ExecutorService executorService;

  @BeforeEach
  void init() throws Exception {
    mocks = MockitoAnnotations.openMocks(this);
    nextSequenceNumber = new AtomicLong(1);
    sentSequenceNumbers = new LinkedBlockingQueue<>();
    closingCallbackCalls = new AtomicInteger(0);
    when(channel.getNextPublishSeqNo()).thenAnswer(invocation -> nextSequenceNumber.get());
    doAnswer(
            invocation -> {
              sentSequenceNumbers.add(nextSequenceNumber.getAndIncrement());
              return null;
            })
        .when(channel)
        .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
    when(channel.isOpen()).thenReturn(true);
  }

  @AfterEach
  void tearDown() throws Exception {
    if (executorService != null) {
      executorService.shutdownNow();
    }
    mocks.close();
  }

  @Test
  void creationShouldEnableConfirmsAndRegisterListeners() throws Exception {
    publisher();
    verify(channel).confirmSelect();
    verify(channel).addConfirmListener(any(ConfirmListener.class));
    verify(channel).addShutdownListener(any(ShutdownListener.class));
  }

  @Test
  void creationShouldFailIfConfirmSelectFails() throws Exception {
    when(channel.confirmSelect()).thenThrow(new IOException("channel error"));
    assertThatThrownBy(this::publisher)
        .isInstanceOf(ReliableException.class)
        .hasCauseInstanceOf(IOException.class)
        .extracting("code")
        .isEqualTo(Constants.CODE_CONFIRM_SELECT_FAILED);
  }

  @Test
  void publishShouldSucceedWhenBrokerAcceptsPublication() throws Exception {
    ChannelPublisher publisher = publisher();
    PublishCommand command = command("orders", "new", "hello");
    CompletionHandle<Void> handle = publisher.publish(command);

    verify(channel)
        .basicPublish(
            eq("orders"),
            eq("new"),
            eq(command.properties()),
            eq("hello".getBytes(StandardCharsets.UTF_8)));
    assertThat(sentSequenceNumbers).containsExactly(1L);
    assertThat(handle.isDone()).isFalse();
    assertThat(publisher.unconfirmedCount()).isEqualTo(1);

    confirmListener(channel).handleAck(1, false);

    assertThat(handle.toCompletableFuture().get(10, TimeUnit.SECONDS)).isNull();
    assertThat(publisher.unconfirmedCount()).isZero();
  }

  @Test
  void cumulativeAcceptShouldConfirmAllPreviousPublications() throws Exception {
    ChannelPublisher publisher = publisher();
    CompletionHandle<Void> first = publisher.publish(command());
    CompletionHandle<Void> second = publisher.publish(command());
    CompletionHandle<Void> third = publisher.publish(command());
    assertThat(sentSequenceNumbers).containsExactly(1L, 2L, 3L);

    confirmListener(channel).handleAck(2, true);

    assertThat(first.isDone()).isTrue();
    assertThat(second.isDone()).isTrue();
    assertThat(first.toCompletableFuture().isCompletedExceptionally()).isFalse();
    assertThat(second.toCompletableFuture().isCompletedExceptionally()).isFalse();
    assertThat(third.isDone()).isFalse();
    assertThat(publisher.unconfirmedCount()).isEqualTo(1);
  }

  @Test
  void publishShouldFailWhenBrokerRejectsPublication() throws Exception {
    nextSequenceNumber.set(5);
    ChannelPublisher publisher = publisher();
    CompletionHandle<Void> handle = publisher.publish(command());
    assertThat(sentSequenceNumbers).containsExactly(5L);

    confirmListener(channel).handleNack(5, false);

    Throwable failure = failureOf(handle);
    assertThat(failure)
        .isInstanceOf(PublishException.class)
        .hasMessage("broker rejected publication");
    assertThat(((PublishException) failure).getCode()).isEqualTo(Constants.CODE_PUBLISH_REJECTED);
    assertThat(((PublishException) failure).getSequenceNumber()).isEqualTo(5L);
  }

  @Test
  void rejectShouldNotResolveOtherPublications() throws Exception {
    ChannelPublisher publisher = publisher();
    CompletionHandle<Void> first = publisher.publish(command());
    CompletionHandle<Void> second = publisher.publish(command());
    CompletionHandle<Void> third = publisher.publish(command());

    confirmListener(channel).handleNack(2, false);

    assertThat(first.isDone()).isFalse();
    assertThat(failureOf(second)).isInstanceOf(PublishException.class);
    assertThat(third.isDone()).isFalse();
  }

  @Test
  void confirmForUnknownSequenceNumberShouldChangeNothing() throws Exception {
    ChannelPublisher publisher = publisher();
    CompletionHandle<Void> handle = publisher.publish(command());

    ConfirmListener listener = confirmListener(channel);
    listener.handleAck(42, false);
    listener.handleNack(43, false);

    assertThat(handle.isDone()).isFalse();
    assertThat(publisher.unconfirmedCount()).isEqualTo(1);
  }

  @Test
  void sendFailureShouldFailHandleImmediately() throws Exception {
    IOException sendFailure = new IOException("connection reset");
    doThrow(sendFailure)
        .when(channel)
        .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
    ChannelPublisher publisher = publisher();
    CompletionHandle<Void> handle = publisher.publish(command());

    assertThat(handle.isDone()).isTrue();
    Throwable failure = failureOf(handle);
    assertThat(failure)
        .isInstanceOf(PublishException.class)
        .hasMessage("transport send failure")
        .hasCause(sendFailure);
    assertThat(((PublishException) failure).getCode())
        .isEqualTo(Constants.CODE_PUBLISH_TRANSPORT_FAILURE);
    assertThat(publisher.unconfirmedCount()).isZero();

    // a late confirm for the same sequence number finds nothing
    confirmListener(channel).handleAck(1, true);
    assertThat(publisher.unconfirmedCount()).isZero();
  }

  @Test
  void sendFailureWithClosedChannelShouldFailHandleImmediately() throws Exception {
    doThrow(new AlreadyClosedException(new ShutdownSignalException(false, false, null, channel)))
        .when(channel)
        .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
    ChannelPublisher publisher = publisher();
    CompletionHandle<Void> handle = publisher.publish(command());

    assertThat(failureOf(handle))
        .isInstanceOf(PublishException.class)
        .hasCauseInstanceOf(AlreadyClosedException.class);
    assertThat(publisher.unconfirmedCount()).isZero();
  }

  @Test
  void channelShutdownShouldFailOutstandingPublications() throws Exception {
    ChannelPublisher publisher = publisher();
    CompletionHandle<Void> first = publisher.publish(command());
    CompletionHandle<Void> second = publisher.publish(command());
    confirmListener(channel).handleAck(1, false);

    ArgumentCaptor<ShutdownListener> captor = ArgumentCaptor.forClass(ShutdownListener.class);
    verify(channel).addShutdownListener(captor.capture());
    ShutdownSignalException signal = new ShutdownSignalException(false, false, null, channel);
    captor.getValue().shutdownCompleted(signal);

    assertThat(first.toCompletableFuture().isCompletedExceptionally()).isFalse();
    Throwable failure = failureOf(second);
    assertThat(failure).isInstanceOf(PublishException.class).hasCause(signal);
    assertThat(((PublishException) failure).getCode()).isEqualTo(Constants.CODE_CHANNEL_CLOSED);
    assertThat(publisher.unconfirmedCount()).isZero();
  }

  @Test
  void closeShouldFailOutstandingAndNewPublications() throws Exception {
    ChannelPublisher publisher = publisher();
    CompletionHandle<Void> outstanding = publisher.publish(command());
    ConfirmListener listener = confirmListener(channel);

    publisher.close();

    Throwable failure = failureOf(outstanding);
    assertThat(((PublishException) failure).getCode()).isEqualTo(Constants.CODE_PUBLISHER_CLOSED);
    verify(channel).removeConfirmListener(listener);
    verify(channel).removeShutdownListener(any(ShutdownListener.class));
    verify(channel, never()).close();
    assertThat(closingCallbackCalls).hasValue(1);
    assertThat(publisher.isOpen()).isFalse();

    CompletionHandle<Void> afterClose = publisher.publish(command());
    assertThat(((PublishException) failureOf(afterClose)).getCode())
        .isEqualTo(Constants.CODE_PUBLISHER_CLOSED);
    verify(channel, times(1))
        .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));

    publisher.close();
    assertThat(closingCallbackCalls).hasValue(1);
  }

  @Test
  void closeShouldCloseOwnedChannel() throws Exception {
    ChannelPublisher publisher =
        new ChannelPublisher(
            channel, new ReentrantLock(), true, effect, NoOpMetricsCollector.SINGLETON, () -> {});
    publisher.close();
    verify(channel).close();
  }

  @Test
  void nullPropertiesShouldBeSentAsEmptyProperties() throws Exception {
    ChannelPublisher publisher = publisher();
    publisher.publish(new PublishCommand("", "queue", null, null));
    ArgumentCaptor<AMQP.BasicProperties> captor =
        ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    verify(channel).basicPublish(eq(""), eq("queue"), captor.capture(), any(byte[].class));
    assertThat(captor.getValue()).isNotNull();
    assertThat(captor.getValue().getHeaders()).isNull();
  }

  @Test
  void confirmSentDuringPublishShouldNotBeLost() throws Exception {
    executorService = Executors.newSingleThreadExecutor();
    ChannelPublisher publisher = publisher();
    ConfirmListener listener = confirmListener(channel);
    CountDownLatch confirmAttempted = new CountDownLatch(1);
    doAnswer(
            invocation -> {
              long sequenceNumber = nextSequenceNumber.getAndIncrement();
              // the broker confirms before the send call returns
              executorService.submit(
                  () -> {
                    confirmAttempted.countDown();
                    listener.handleAck(sequenceNumber, false);
                    return null;
                  });
              confirmAttempted.await(10, TimeUnit.SECONDS);
              Thread.sleep(50);
              return null;
            })
        .when(channel)
        .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));

    CompletionHandle<Void> handle = publisher.publish(command());

    assertThat(handle.toCompletableFuture().get(10, TimeUnit.SECONDS)).isNull();
    assertThat(publisher.unconfirmedCount()).isZero();
  }

  @Test
  void concurrentPublishingAndConfirmsShouldResolveEveryHandleExactlyOnce() throws Exception {
    int threadCount = 4;
    int messagesPerThread = 500;
    int messageCount = threadCount * messagesPerThread;
    executorService = Executors.newFixedThreadPool(threadCount + 1);
    ChannelPublisher publisher = publisher();
    ConfirmListener listener = confirmListener(channel);
    AtomicInteger successes = new AtomicInteger(0);
    AtomicInteger failures = new AtomicInteger(0);
    AtomicInteger resolutions = new AtomicInteger(0);
    CountDownLatch publishLatch = new CountDownLatch(threadCount);
    AtomicBoolean brokerRunning = new AtomicBoolean(true);

    executorService.submit(
        () -> {
          Random random = new Random();
          while (brokerRunning.get() || !sentSequenceNumbers.isEmpty()) {
            Long sequenceNumber = sentSequenceNumbers.poll(100, TimeUnit.MILLISECONDS);
            if (sequenceNumber != null) {
              if (sequenceNumber % 100 == 0) {
                listener.handleNack(sequenceNumber, false);
              } else {
                listener.handleAck(sequenceNumber, random.nextInt(10) == 0);
              }
            }
          }
          return null;
        });

    List<CompletionHandle<Void>> handles = new ArrayList<>();
    List<List<CompletionHandle<Void>>> handlesPerThread = new ArrayList<>();
    for (int i = 0; i < threadCount; i++) {
      List<CompletionHandle<Void>> threadHandles = new ArrayList<>();
      handlesPerThread.add(threadHandles);
      executorService.submit(
          () -> {
            for (int j = 0; j < messagesPerThread; j++) {
              threadHandles.add(
                  publisher
                      .publish(command())
                      .whenComplete(
                          (value, failure) -> {
                            resolutions.incrementAndGet();
                            if (failure == null) {
                              successes.incrementAndGet();
                            } else {
                              failures.incrementAndGet();
                            }
                          }));
            }
            publishLatch.countDown();
          });
    }

    assertThat(publishLatch.await(10, TimeUnit.SECONDS)).isTrue();
    handlesPerThread.forEach(handles::addAll);
    brokerRunning.set(false);
    waitAtMost(() -> resolutions.get() == messageCount);
    assertThat(handles).hasSize(messageCount).allMatch(CompletionHandle::isDone);
    assertThat(successes.get() + failures.get()).isEqualTo(messageCount);
    // every 100th sequence number is rejected, unless a cumulative ack got it first
    assertThat(failures.get()).isLessThanOrEqualTo(messageCount / 100);
    assertThat(publisher.unconfirmedCount()).isZero();
    Thread.sleep(200);
    assertThat(resolutions).hasValue(messageCount);
  }

  @Test
  void metricsShouldTrackPublicationOutcomes() throws Exception {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MetricsCollector metricsCollector = new MicrometerMetricsCollector(registry);
    ChannelPublisher publisher =
        new ChannelPublisher(
            channel, new ReentrantLock(), false, effect, metricsCollector, () -> {});
    publisher.publish(command());
    publisher.publish(command());
    publisher.publish(command());
    ConfirmListener listener = confirmListener(channel);
    listener.handleAck(2, true);
    listener.handleNack(3, false);

    assertThat(registry.get("rabbitmq.reliable.published").counter().count()).isEqualTo(3.0);
    assertThat(registry.get("rabbitmq.reliable.confirmed").counter().count()).isEqualTo(2.0);
    assertThat(registry.get("rabbitmq.reliable.errored").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("rabbitmq.reliable.outstanding_publish_confirm").gauge().value())
        .isZero();
  }

  private ChannelPublisher publisher() {
    return new ChannelPublisher(
        channel,
        new ReentrantLock(),
        false,
        effect,
        NoOpMetricsCollector.SINGLETON,
        () -> closingCallbackCalls.incrementAndGet());
  }
}
