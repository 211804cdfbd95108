/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.batchretry.kafka.listener;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.batchretry.kafka.test.utils.KafkaTestUtils.batch;
import static org.batchretry.kafka.test.utils.KafkaTestUtils.record;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.SerializationException;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import org.batchretry.kafka.BatchRetryException;
import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.util.backoff.FixedBackOff;

/**
 * @since 1.0
 */
public class RetryingBatchErrorHandlerTests {

	private final ConsumerRecord<String, String> record1 = record("foo", 0, 0L, "bar");

	private final ConsumerRecord<String, String> record2 = record("foo", 0, 1L, "baz");

	private final ConsumerRecords<String, String> records = batch(this.record1, this.record2);

	@Test
	public void testClassifier() {
		AtomicReference<ConsumerRecord<?, ?>> recovered = new AtomicReference<>();
		RetryingBatchErrorHandler handler = new RetryingBatchErrorHandler((r, t) -> recovered.set(r),
				new FixedBackOff(0L, 1L));
		IllegalStateException illegalState = new IllegalStateException();
		Consumer<?, ?> consumer = mock(Consumer.class);
		handler.handle(illegalState, this.records, consumer);
		assertThat(recovered.get()).isNull();
		handler.handle(new SerializationException("intended", illegalState), this.records, consumer);
		assertThat(recovered.get()).isSameAs(this.record2);
		handler.addNotRetryableException(IllegalStateException.class);
		recovered.set(null);
		handler.handle(illegalState, this.records, consumer);
		assertThat(recovered.get()).isSameAs(this.record2);
		InOrder inOrder = inOrder(consumer);
		inOrder.verify(consumer).seek(new TopicPartition("foo", 0), 0L); // not recovered so seek
		inOrder.verify(consumer, times(2)).seek(new TopicPartition("foo", 0), 2L); // 2x recovered seek next
		inOrder.verifyNoMoreInteractions();
		assertThat(handler.getStore(consumer)).isNull();
		assertThat(handler.removeNotRetryableException(IllegalStateException.class)).isTrue();
	}

	@Test
	public void testWrappedNotRetryableException() {
		List<ConsumerRecord<?, ?>> recovered = new ArrayList<>();
		RetryingBatchErrorHandler handler = new RetryingBatchErrorHandler((r, t) -> recovered.add(r),
				new FixedBackOff(0L, 5L));
		Consumer<?, ?> consumer = mock(Consumer.class);
		handler.handle(new RuntimeException("wrapper", new SerializationException("bad bytes")), this.records,
				consumer);
		assertThat(recovered).containsExactly(this.record1, this.record2);
		verify(consumer).seek(new TopicPartition("foo", 0), 2L);
	}

	@Test
	public void testSuppliedClassifier() {
		RetryingBatchErrorHandler handler = new RetryingBatchErrorHandler(new FixedBackOff(0L, 1L));
		Map<Class<? extends Throwable>, Boolean> classified =
				Collections.singletonMap(IllegalArgumentException.class, false);
		handler.setClassifier(new BinaryExceptionClassifier(classified, true));
		assertThatIllegalArgumentException()
				.isThrownBy(() -> handler.addNotRetryableException(IllegalStateException.class));
		assertThatIllegalArgumentException()
				.isThrownBy(() -> handler.removeNotRetryableException(IllegalStateException.class));
		Consumer<?, ?> consumer = mock(Consumer.class);
		handler.handle(new RuntimeException(new IllegalArgumentException()), this.records, consumer);
		verify(consumer).seek(new TopicPartition("foo", 0), 2L);
	}

	@Test
	public void testStorePerConsumer() {
		RetryingBatchErrorHandler handler = new RetryingBatchErrorHandler(mock(ConsumerRecordRecoverer.class),
				new FixedBackOff(0L, 1L));
		Consumer<?, ?> consumer1 = mock(Consumer.class);
		Consumer<?, ?> consumer2 = mock(Consumer.class);
		RuntimeException failure = new RuntimeException("test");
		handler.handle(failure, this.records, consumer1);
		assertThat(handler.getStore(consumer1).size()).isEqualTo(1);
		assertThat(handler.getStore(consumer2)).isNull();

		handler.handle(failure, this.records, consumer2);
		assertThat(handler.getStore(consumer2).size()).isEqualTo(1);
		assertThat(handler.getStore(consumer1)).isNotSameAs(handler.getStore(consumer2));

		handler.handle(failure, this.records, consumer1);
		assertThat(handler.getStore(consumer1)).isNull();
		assertThat(handler.getStore(consumer2)).isNotNull();
		verify(consumer1).seek(new TopicPartition("foo", 0), 2L);

		handler.clearState(consumer2);
		assertThat(handler.getStore(consumer2)).isNull();
		handler.handle(failure, this.records, consumer2);
		verify(consumer2, times(2)).seek(new TopicPartition("foo", 0), 0L);
	}

	@Test
	public void testEmptyBatch() {
		RetryingBatchErrorHandler handler = new RetryingBatchErrorHandler();
		RuntimeException failure = new RuntimeException("poll failed");
		assertThatExceptionOfType(BatchRetryException.class)
				.isThrownBy(() -> handler.handle(failure, ConsumerRecords.empty(), mock(Consumer.class)))
				.withCause(failure);
	}

	@Test
	public void testConsumerRequired() {
		RetryingBatchErrorHandler handler = new RetryingBatchErrorHandler();
		assertThatExceptionOfType(UnsupportedOperationException.class)
				.isThrownBy(() -> handler.handle(new RuntimeException(), this.records));
	}

	@Test
	public void testRecovererFailureKeepsStore() {
		IllegalStateException recoveryFailure = new IllegalStateException("cannot recover");
		RetryingBatchErrorHandler handler = new RetryingBatchErrorHandler((r, t) -> {
			throw recoveryFailure;
		}, new FixedBackOff(0L, 0L));
		Consumer<?, ?> consumer = mock(Consumer.class);
		assertThatThrownBy(() -> handler.handle(new RuntimeException(), this.records, consumer))
				.isSameAs(recoveryFailure);
		assertThat(handler.getStore(consumer).size()).isEqualTo(1);
		verify(consumer).seek(new TopicPartition("foo", 0), 0L);
	}

}
