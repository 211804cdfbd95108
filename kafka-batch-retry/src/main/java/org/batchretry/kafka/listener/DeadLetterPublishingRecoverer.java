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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.apache.kafka.common.header.internals.RecordHeaders;

import org.batchretry.kafka.BatchRetryException;
import org.batchretry.kafka.support.KafkaHeaders;
import org.springframework.util.Assert;

/**
 * A {@link ConsumerRecordRecoverer} that publishes a failed record to a dead-letter topic.
 * <p>
 * The send is synchronous: the recoverer waits for the broker to acknowledge the record and
 * throws a {@link BatchRetryException} if the publication fails, so that a batch is never
 * moved past before its records are safely stored.
 *
 * @since 1.0
 */
public class DeadLetterPublishingRecoverer implements ConsumerRecordRecoverer {

	/**
	 * The default time to wait for the result of a dead-letter publication.
	 */
	public static final Duration DEFAULT_WAIT_FOR_SEND_RESULT_TIMEOUT = Duration.ofSeconds(30);

	private static final Log logger = LogFactory.getLog(DeadLetterPublishingRecoverer.class); // NOSONAR

	private static final BiFunction<ConsumerRecord<?, ?>, Exception, TopicPartition>
		DEFAULT_DESTINATION_RESOLVER = (cr, e) -> new TopicPartition(cr.topic() + ".DLT", cr.partition());

	private final Producer<Object, Object> producer;

	private final BiFunction<ConsumerRecord<?, ?>, Exception, TopicPartition> destinationResolver;

	private Duration waitForSendResultTimeout = DEFAULT_WAIT_FOR_SEND_RESULT_TIMEOUT;

	/**
	 * Create an instance with the provided producer and a default destination resolving
	 * function that returns a TopicPartition based on the original topic (appended with
	 * ".DLT") from the failed record, and the same partition as the failed record.
	 * Therefore the dead-letter topic must have at least as many partitions as the
	 * original topic.
	 * @param producer the {@link Producer} to use for publishing.
	 */
	public DeadLetterPublishingRecoverer(Producer<?, ?> producer) {
		this(producer, DEFAULT_DESTINATION_RESOLVER);
	}

	/**
	 * Create an instance with the provided producer and destination resolving function,
	 * that receives the failed consumer record and the exception and returns a
	 * {@link TopicPartition}. If the partition in the {@link TopicPartition} is less than
	 * 0, no partition is set when publishing to the topic.
	 * @param producer the {@link Producer} to use for publishing; its serializers must
	 * accept the keys and values of the failed records.
	 * @param destinationResolver the resolving function.
	 */
	@SuppressWarnings("unchecked")
	public DeadLetterPublishingRecoverer(Producer<?, ?> producer,
			BiFunction<ConsumerRecord<?, ?>, Exception, TopicPartition> destinationResolver) {

		Assert.notNull(producer, "The producer cannot be null");
		Assert.notNull(destinationResolver, "The destinationResolver cannot be null");
		this.producer = (Producer<Object, Object>) producer;
		this.destinationResolver = destinationResolver;
	}

	/**
	 * Set the time to wait for the broker to acknowledge a dead-letter record.
	 * @param waitForSendResultTimeout the timeout.
	 */
	public void setWaitForSendResultTimeout(Duration waitForSendResultTimeout) {
		Assert.notNull(waitForSendResultTimeout, "'waitForSendResultTimeout' cannot be null");
		Assert.isTrue(!waitForSendResultTimeout.isNegative() && !waitForSendResultTimeout.isZero(),
				"'waitForSendResultTimeout' must be positive");
		this.waitForSendResultTimeout = waitForSendResultTimeout;
	}

	@Override
	public void accept(ConsumerRecord<?, ?> record, Exception exception) {
		TopicPartition tp = this.destinationResolver.apply(record, exception);
		RecordHeaders headers = new RecordHeaders(record.headers().toArray());
		enhanceHeaders(headers, record, exception);
		ProducerRecord<Object, Object> outRecord = createProducerRecord(record, tp, headers);
		publish(outRecord);
	}

	/**
	 * Subclasses can override this method to customize the producer record to send to the
	 * dead-letter topic. The default implementation simply copies the key and value from
	 * the consumer record and adds the headers. The timestamp is not set (the original
	 * timestamp is in one of the headers). IMPORTANT: if the partition in the
	 * {@link TopicPartition} is less than 0, it must be set to null in the
	 * {@link ProducerRecord}.
	 * @param record the failed record
	 * @param topicPartition the {@link TopicPartition} returned by the destination
	 * resolver.
	 * @param headers the headers - original record headers plus DLT headers.
	 * @return the producer record to send.
	 * @see KafkaHeaders
	 */
	protected ProducerRecord<Object, Object> createProducerRecord(ConsumerRecord<?, ?> record,
			TopicPartition topicPartition, RecordHeaders headers) {

		return new ProducerRecord<>(topicPartition.topic(),
				topicPartition.partition() < 0 ? null : topicPartition.partition(),
				record.key(), record.value(), headers);
	}

	private void publish(ProducerRecord<Object, Object> outRecord) {
		try {
			RecordMetadata metadata = this.producer.send(outRecord)
					.get(this.waitForSendResultTimeout.toMillis(), TimeUnit.MILLISECONDS);
			if (logger.isDebugEnabled()) {
				logger.debug("Successful dead-letter publication: " + metadata);
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new BatchRetryException("Interrupted during dead-letter publication for: " + outRecord, e);
		}
		catch (ExecutionException e) {
			throw new BatchRetryException("Dead-letter publication failed for: " + outRecord, e.getCause());
		}
		catch (TimeoutException e) {
			throw new BatchRetryException("Timed out waiting for dead-letter publication of: " + outRecord, e);
		}
	}

	private void enhanceHeaders(RecordHeaders kafkaHeaders, ConsumerRecord<?, ?> record, Exception exception) {
		kafkaHeaders.add(
				new RecordHeader(KafkaHeaders.DLT_ORIGINAL_TOPIC, record.topic().getBytes(StandardCharsets.UTF_8)));
		kafkaHeaders.add(new RecordHeader(KafkaHeaders.DLT_ORIGINAL_PARTITION,
				ByteBuffer.allocate(Integer.BYTES).putInt(record.partition()).array()));
		kafkaHeaders.add(new RecordHeader(KafkaHeaders.DLT_ORIGINAL_OFFSET,
				ByteBuffer.allocate(Long.BYTES).putLong(record.offset()).array()));
		kafkaHeaders.add(new RecordHeader(KafkaHeaders.DLT_ORIGINAL_TIMESTAMP,
				ByteBuffer.allocate(Long.BYTES).putLong(record.timestamp()).array()));
		kafkaHeaders.add(new RecordHeader(KafkaHeaders.DLT_ORIGINAL_TIMESTAMP_TYPE,
				record.timestampType().toString().getBytes(StandardCharsets.UTF_8)));
		kafkaHeaders.add(new RecordHeader(KafkaHeaders.DLT_EXCEPTION_FQCN,
				exception.getClass().getName().getBytes(StandardCharsets.UTF_8)));
		String message = exception.getMessage();
		if (message != null) {
			kafkaHeaders.add(new RecordHeader(KafkaHeaders.DLT_EXCEPTION_MESSAGE,
					message.getBytes(StandardCharsets.UTF_8)));
		}
		kafkaHeaders.add(new RecordHeader(KafkaHeaders.DLT_EXCEPTION_STACKTRACE,
				getStackTraceAsString(exception).getBytes(StandardCharsets.UTF_8)));
	}

	private String getStackTraceAsString(Throwable cause) {
		StringWriter stringWriter = new StringWriter();
		PrintWriter printWriter = new PrintWriter(stringWriter, true);
		cause.printStackTrace(printWriter);
		return stringWriter.getBuffer().toString();
	}

}
