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

import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetCommitCallback;
import org.apache.kafka.common.TopicPartition;

import org.batchretry.kafka.support.BatchIdentity;
import org.springframework.util.Assert;

/**
 * Logs the asynchronous commit of the offsets following a recovered batch; DEBUG on
 * success and ERROR on failure. A failed commit is not retried: the batch is already
 * recovered, so it is at most redelivered and recovered again after a rebalance.
 *
 * @since 1.0
 */
public final class LoggingCommitCallback implements OffsetCommitCallback {

	private static final Log logger = LogFactory.getLog(LoggingCommitCallback.class); // NOSONAR

	private final BatchIdentity batchIdentity;

	public LoggingCommitCallback(BatchIdentity batchIdentity) {
		Assert.notNull(batchIdentity, "'batchIdentity' cannot be null");
		this.batchIdentity = batchIdentity;
	}

	public BatchIdentity getBatchIdentity() {
		return this.batchIdentity;
	}

	@Override
	public void onComplete(Map<TopicPartition, OffsetAndMetadata> offsets, Exception exception) {
		if (exception != null) {
			logger.error("Failed to commit " + offsets + " after recovering batch " + this.batchIdentity
					+ "; it may be recovered again", exception);
		}
		else if (logger.isDebugEnabled()) {
			logger.debug("Committed " + offsets + " after recovering batch " + this.batchIdentity);
		}
	}

}
