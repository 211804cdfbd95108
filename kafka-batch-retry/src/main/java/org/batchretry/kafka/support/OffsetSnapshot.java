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

package org.batchretry.kafka.support;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;

import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

/**
 * The smallest offset of each {@link TopicPartition} present in a batch. A batch that is
 * redelivered from the same position yields an equal snapshot.
 *
 * @since 1.0
 */
public final class OffsetSnapshot {

	private final Map<TopicPartition, Long> offsets;

	private OffsetSnapshot(Map<TopicPartition, Long> offsets) {
		this.offsets = Collections.unmodifiableMap(offsets);
	}

	/**
	 * Take a snapshot of the supplied batch.
	 * @param records the records of the batch; must not be empty.
	 * @return the snapshot.
	 */
	public static OffsetSnapshot of(Iterable<? extends ConsumerRecord<?, ?>> records) {
		Assert.notNull(records, "'records' cannot be null");
		Map<TopicPartition, Long> offsets = new LinkedHashMap<>();
		for (ConsumerRecord<?, ?> record : records) {
			offsets.merge(new TopicPartition(record.topic(), record.partition()), record.offset(), Long::min);
		}
		Assert.isTrue(!offsets.isEmpty(), "Cannot take an offset snapshot of an empty batch");
		return new OffsetSnapshot(offsets);
	}

	/**
	 * Return the smallest offset recorded for the partition.
	 * @param topicPartition the partition.
	 * @return the offset, or null if the partition is not part of the snapshot.
	 */
	@Nullable
	public Long getOffset(TopicPartition topicPartition) {
		return this.offsets.get(topicPartition);
	}

	public Map<TopicPartition, Long> getOffsets() {
		return this.offsets;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return this.offsets.equals(((OffsetSnapshot) o).offsets);
	}

	@Override
	public int hashCode() {
		return this.offsets.hashCode();
	}

	@Override
	public String toString() {
		return "OffsetSnapshot" + this.offsets;
	}

}
