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

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecords;

/**
 * A {@link BatchErrorHandler} that needs the consumer, for example to seek.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ConsumerAwareBatchErrorHandler extends BatchErrorHandler {

	@Override
	default void handle(Exception thrownException, ConsumerRecords<?, ?> data) {
		throw new UnsupportedOperationException("A consumer is required to handle a batch failure");
	}

	@Override
	void handle(Exception thrownException, ConsumerRecords<?, ?> data, Consumer<?, ?> consumer);

}
