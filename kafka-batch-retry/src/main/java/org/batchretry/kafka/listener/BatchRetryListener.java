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

import org.apache.kafka.clients.consumer.ConsumerRecords;

/**
 * A listener for retry activity on failed batches.
 *
 * @since 1.0
 */
public interface BatchRetryListener {

	/**
	 * Called after a delivery of the batch failed and the batch will be retried.
	 * @param records the records.
	 * @param ex the exception.
	 * @param deliveryAttempt the failed delivery attempt, starting at 1.
	 */
	default void failedDelivery(ConsumerRecords<?, ?> records, Exception ex, int deliveryAttempt) {
	}

	/**
	 * Called after every record of an exhausted batch was recovered.
	 * @param records the records.
	 * @param ex the exception.
	 */
	default void recovered(ConsumerRecords<?, ?> records, Exception ex) {
	}

	/**
	 * Called after the recoverer threw an exception.
	 * @param records the records.
	 * @param original the exception that caused the recovery.
	 * @param failure the exception thrown by the recoverer.
	 */
	default void recoveryFailed(ConsumerRecords<?, ?> records, Exception original, Exception failure) {
	}

}
