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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.Connection;
import com.rabbitmq.reliable.AcknowledgmentAction;
import com.rabbitmq.reliable.CompletionHandle;
import com.rabbitmq.reliable.Constants;
import com.rabbitmq.reliable.Consumer;
import com.rabbitmq.reliable.Effect;
import com.rabbitmq.reliable.Environment;
import com.rabbitmq.reliable.Publisher;
import com.rabbitmq.reliable.ReliableException;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class AmqpEnvironmentUnitTest {

  @Mock Connection connection;
  @Mock Channel channel;

  AutoCloseable mocks;
  Environment environment;

  @BeforeEach
  void init() throws Exception {
    mocks = MockitoAnnotations.openMocks(this);
    when(connection.createChannel()).thenReturn(channel);
    when(channel.isOpen()).thenReturn(true);
    environment = Environment.builder().connection(connection).build();
  }

  @AfterEach
  void tearDown() throws Exception {
    environment.close();
    mocks.close();
  }

  @Test
  void builderShouldRequireConnection() {
    assertThatThrownBy(() -> Environment.builder().build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void builderShouldUseCompletableFutureEffectByDefault() {
    assertThat(environment.effect()).isInstanceOf(CompletableFutureEffect.class);
    Effect effect = Effect.completableFuture();
    try (Environment env = Environment.builder().connection(connection).effect(effect).build()) {
      assertThat(env.effect()).isSameAs(effect);
    }
  }

  @Test
  void publisherShouldOpenAndCloseItsOwnChannel() throws Exception {
    Publisher publisher = environment.publisherBuilder().build();
    verify(connection, times(1)).createChannel();
    verify(channel).confirmSelect();
    assertThat(((AmqpEnvironment) environment).publisherCount()).isEqualTo(1);
    publisher.close();
    verify(channel).close();
    assertThat(((AmqpEnvironment) environment).publisherCount()).isZero();
  }

  @Test
  void publisherShouldNotCloseChannelItDoesNotOwn() throws Exception {
    Channel applicationChannel = mock(Channel.class);
    Publisher publisher = environment.publisherBuilder().channel(applicationChannel).build();
    verify(connection, never()).createChannel();
    publisher.close();
    verify(applicationChannel, never()).close();
  }

  @Test
  void publisherCreationFailureShouldCloseOwnedChannel() throws Exception {
    when(channel.confirmSelect()).thenThrow(new IOException("not supported"));
    assertThatThrownBy(() -> environment.publisherBuilder().build())
        .isInstanceOf(ReliableException.class);
    verify(channel).close();
    assertThat(((AmqpEnvironment) environment).publisherCount()).isZero();
  }

  @Test
  void channelOpeningFailureShouldBeReported() throws Exception {
    when(connection.createChannel()).thenThrow(new IOException("connection closed"));
    assertThatThrownBy(() -> environment.publisherBuilder().build())
        .isInstanceOf(ReliableException.class)
        .extracting("code")
        .isEqualTo(Constants.CODE_CHANNEL_OPENING_FAILED);
  }

  @Test
  void consumerBuilderShouldValidateSettings() {
    assertThatThrownBy(() -> environment.consumerBuilder().build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> environment.consumerBuilder().queue("orders").build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> environment.consumerBuilder().prefetchCount(-1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> environment.consumerBuilder().failureAction(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void consumerShouldUseDefaultsAndGeneratedConsumerTag() throws Exception {
    Consumer consumer =
        environment
            .consumerBuilder()
            .queue("orders")
            .handler(delivery -> environment.effect().succeed(AcknowledgmentAction.ACCEPT))
            .build();
    verify(channel).basicQos(ChannelConsumerBuilder.DEFAULT_PREFETCH_COUNT);
    verify(channel)
        .basicConsume(
            eq("orders"),
            eq(false),
            eq(consumer.consumerTag()),
            any(com.rabbitmq.client.Consumer.class));
    assertThat(consumer.consumerTag()).startsWith("ctag-orders-");
    assertThat(((AmqpEnvironment) environment).consumerCount()).isEqualTo(1);
    consumer.close();
    verify(channel).basicCancel(consumer.consumerTag());
    verify(channel).close();
    assertThat(((AmqpEnvironment) environment).consumerCount()).isZero();
  }

  @Test
  void consumerShouldUseConsumerTagAndPrefetchCountFromBuilder() throws Exception {
    Consumer consumer =
        environment
            .consumerBuilder()
            .queue("orders")
            .consumerTag("my-consumer")
            .prefetchCount(50)
            .handler(delivery -> environment.effect().succeed(AcknowledgmentAction.ACCEPT))
            .build();
    verify(channel).basicQos(50);
    verify(channel)
        .basicConsume(
            eq("orders"), eq(false), eq("my-consumer"), any(com.rabbitmq.client.Consumer.class));
    assertThat(consumer.consumerTag()).isEqualTo("my-consumer");
  }

  @Test
  void publishersSharingChannelShouldNotReadSameSequenceNumber() throws Exception {
    Channel sharedChannel = mock(Channel.class);
    AtomicLong nextSequenceNumber = new AtomicLong(1);
    List<Long> sequenceNumbersRead = new CopyOnWriteArrayList<>();
    when(sharedChannel.getNextPublishSeqNo())
        .thenAnswer(
            invocation -> {
              long sequenceNumber = nextSequenceNumber.get();
              sequenceNumbersRead.add(sequenceNumber);
              return sequenceNumber;
            });
    doAnswer(
            invocation -> {
              // leaves time for the other publisher to read the sequence number
              Thread.sleep(100);
              nextSequenceNumber.incrementAndGet();
              return null;
            })
        .when(sharedChannel)
        .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));

    Publisher publisher1 = environment.publisherBuilder().channel(sharedChannel).build();
    Publisher publisher2 = environment.publisherBuilder().channel(sharedChannel).build();
    AmqpEnvironment amqpEnvironment = (AmqpEnvironment) environment;
    assertThat(amqpEnvironment.channelLock(sharedChannel))
        .isSameAs(amqpEnvironment.channelLock(sharedChannel))
        .isNotSameAs(amqpEnvironment.channelLock(channel));

    ExecutorService executorService = Executors.newFixedThreadPool(2);
    try {
      CountDownLatch startLatch = new CountDownLatch(1);
      Future<CompletionHandle<Void>> publication1 =
          executorService.submit(
              () -> {
                startLatch.await();
                return publisher1.publish(TestUtils.command());
              });
      Future<CompletionHandle<Void>> publication2 =
          executorService.submit(
              () -> {
                startLatch.await();
                return publisher2.publish(TestUtils.command());
              });
      startLatch.countDown();
      CompletionHandle<Void> handle1 = publication1.get(10, TimeUnit.SECONDS);
      CompletionHandle<Void> handle2 = publication2.get(10, TimeUnit.SECONDS);

      assertThat(sequenceNumbersRead).containsExactlyInAnyOrder(1L, 2L);

      ArgumentCaptor<ConfirmListener> captor = ArgumentCaptor.forClass(ConfirmListener.class);
      verify(sharedChannel, times(2)).addConfirmListener(captor.capture());
      for (ConfirmListener listener : captor.getAllValues()) {
        listener.handleAck(1, false);
      }
      assertThat(handle1.isDone() ^ handle2.isDone()).isTrue();

      for (ConfirmListener listener : captor.getAllValues()) {
        listener.handleAck(2, false);
      }
      assertThat(handle1.toCompletableFuture().get(10, TimeUnit.SECONDS)).isNull();
      assertThat(handle2.toCompletableFuture().get(10, TimeUnit.SECONDS)).isNull();
    } finally {
      executorService.shutdownNow();
    }
  }

  @Test
  void closeShouldCloseAllPublishersAndConsumers() throws Exception {
    environment.publisherBuilder().build();
    environment.publisherBuilder().build();
    environment
        .consumerBuilder()
        .queue("orders")
        .handler(delivery -> environment.effect().succeed(AcknowledgmentAction.ACCEPT))
        .build();
    AmqpEnvironment amqpEnvironment = (AmqpEnvironment) environment;
    assertThat(amqpEnvironment.publisherCount()).isEqualTo(2);
    assertThat(amqpEnvironment.consumerCount()).isEqualTo(1);

    environment.close();

    assertThat(amqpEnvironment.publisherCount()).isZero();
    assertThat(amqpEnvironment.consumerCount()).isZero();
    verify(channel, times(3)).close();
    verify(channel).basicCancel(anyString());
    verify(connection, never()).close();
    assertThatThrownBy(() -> environment.publisherBuilder())
        .isInstanceOf(IllegalStateException.class);
  }
}
