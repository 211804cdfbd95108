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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.batchretry.kafka.test.utils.KafkaTestUtils.batch;
import static org.batchretry.kafka.test.utils.KafkaTestUtils.record;

import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

/**
 * @since 1.0
 */
public class OffsetSnapshotTests {

	private static final TopicPartition FOO_0 = new TopicPartition("foo", 0);

	private static final TopicPartition FOO_1 = new TopicPartition("foo", 1);

	@Test
	public void testSmallestOffsetPerPartition() {
		OffsetSnapshot snapshot = OffsetSnapshot.of(batch(
				record("foo", 0, 12L, "a"),
				record("foo", 0, 10L, "b"),
				record("foo", 1, 20L, "c"),
				record("foo", 1, 21L, "d")));
		assertThat(snapshot.getOffsets()).hasSize(2);
		assertThat(snapshot.getOffset(FOO_0)).isEqualTo(10L);
		assertThat(snapshot.getOffset(FOO_1)).isEqualTo(20L);
		assertThat(snapshot.getOffset(new TopicPartition("bar", 0))).isNull();
	}

	@Test
	public void testRedeliveredBatchHasEqualSnapshot() {
		OffsetSnapshot first = OffsetSnapshot.of(batch(record("foo", 0, 10L, "a"), record("foo", 1, 20L, "b")));
		OffsetSnapshot again = OffsetSnapshot.of(batch(record("foo", 0, 10L, "a"), record("foo", 1, 20L, "b"),
				record("foo", 1, 21L, "c")));
		assertThat(first).isEqualTo(again);
	}

	@Test
	public void testOneMovedPartitionChangesSnapshot() {
		OffsetSnapshot first = OffsetSnapshot.of(batch(record("foo", 0, 10L, "a"), record("foo", 1, 20L, "b")));
		OffsetSnapshot moved = OffsetSnapshot.of(batch(record("foo", 0, 15L, "a"), record("foo", 1, 20L, "b")));
		assertThat(first).isNotEqualTo(moved);
	}

	@Test
	public void testEmptyBatchRejected() {
		assertThatIllegalArgumentException().isThrownBy(() -> OffsetSnapshot.of(ConsumerRecords.empty()));
	}

}
