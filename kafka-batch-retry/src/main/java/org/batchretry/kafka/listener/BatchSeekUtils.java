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

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

import org.batchretry.kafka.support.OffsetSnapshot;

/**
 * Seek utilities for a batch of records.
 *
 * @since 1.0
 */
public final class BatchSeekUtils {

	private BatchSeekUtils() {
		super();
	}

	/**
	 * Seek each partition of the batch to its first record so the whole batch is
	 * redelivered by the next poll.
	 * @param records the records.
	 * @param consumer the consumer.
	 */
	public static void seekToCurrent(ConsumerRecords<?, ?> records, Consumer<?, ?> consumer) {
		OffsetSnapshot.of(records).getOffsets().forEach(consumer::seek);
	}

	/**
	 * Seek each partition of the batch past its last record.
	 * @param records the records.
	 * @param consumer the consumer.
	 */
	public static void seekToNext(ConsumerRecords<?, ?> records, Consumer<?, ?> consumer) {
		nextOffsets(records).forEach((tp, offset) -> consumer.seek(tp, offset.offset()));
	}

	/**
	 * Return the offset following the last record of each partition in the batch,
	 * suitable for a commit.
	 * @param records the records.
	 * @return the offsets.
	 */
	public static Map<TopicPartition, OffsetAndMetadata> nextOffsets(ConsumerRecords<?, ?> records) {
		Map<TopicPartition, Long> last = new LinkedHashMap<>();
		for (ConsumerRecord<?, ?> record : records) {
			last.merge(new TopicPartition(record.topic(), record.partition()), record.offset(), Long::max);
		}
		Map<TopicPartition, OffsetAndMetadata> next = new LinkedHashMap<>();
		last.forEach((tp, offset) -> next.put(tp, new OffsetAndMetadata(offset + 1)));
		return next;
	}

}
