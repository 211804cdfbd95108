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
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;

import org.springframework.util.Assert;

/**
 * Identifies a batch of records by the set of {@link TopicPartition}s it spans.
 * <p>
 * Two consecutive batches can span the same partitions without being the same batch;
 * an {@link OffsetSnapshot} must also be compared to decide that.
 *
 * @since 1.0
 */
public final class BatchIdentity {

	private final Set<TopicPartition> topicPartitions;

	private BatchIdentity(Set<TopicPartition> topicPartitions) {
		this.topicPartitions = Collections.unmodifiableSet(topicPartitions);
	}

	/**
	 * Create the identity of the supplied batch.
	 * @param records the records of the batch; must not be empty.
	 * @return the identity.
	 */
	public static BatchIdentity of(Iterable<? extends ConsumerRecord<?, ?>> records) {
		Assert.notNull(records, "'records' cannot be null");
		Set<TopicPartition> topicPartitions = new LinkedHashSet<>();
		for (ConsumerRecord<?, ?> record : records) {
			topicPartitions.add(new TopicPartition(record.topic(), record.partition()));
		}
		Assert.isTrue(!topicPartitions.isEmpty(), "Cannot identify an empty batch");
		return new BatchIdentity(topicPartitions);
	}

	public Set<TopicPartition> getTopicPartitions() {
		return this.topicPartitions;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return this.topicPartitions.equals(((BatchIdentity) o).topicPartitions);
	}

	@Override
	public int hashCode() {
		return this.topicPartitions.hashCode();
	}

	@Override
	public String toString() {
		return "BatchIdentity" + this.topicPartitions;
	}

}
