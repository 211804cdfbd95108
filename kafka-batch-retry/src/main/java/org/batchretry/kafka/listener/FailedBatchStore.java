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

import java.util.HashMap;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.batchretry.kafka.support.BatchIdentity;
import org.batchretry.kafka.support.OffsetSnapshot;
import org.springframework.lang.Nullable;
import org.springframework.util.Assert;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

/**
 * Tracks the batches that failed on one consumer, together with their back off progress.
 * <p>
 * An instance belongs to a single consumer (worker) and must not be shared; it is not
 * thread-safe. The table is created on the first failure and discarded as soon as the
 * last entry is removed.
 *
 * @since 1.0
 */
public class FailedBatchStore {

	private static final Log LOGGER = LogFactory.getLog(FailedBatchStore.class); // NOSONAR

	@Nullable
	private Map<BatchIdentity, FailedBatch> failures;

	/**
	 * Record a delivery failure for the batch; reuse the existing entry when the batch was
	 * redelivered from the same offsets, otherwise start a new back off for it. The back off
	 * execution is advanced exactly once.
	 * @param identity the batch identity.
	 * @param offsets the offset snapshot of the batch.
	 * @param backOff the back off used to start a new execution.
	 * @return the entry, reporting the next back off.
	 */
	public FailedBatch recordFailure(BatchIdentity identity, OffsetSnapshot offsets, BackOff backOff) {
		Assert.notNull(identity, "'identity' cannot be null");
		Assert.notNull(offsets, "'offsets' cannot be null");
		Assert.notNull(backOff, "'backOff' cannot be null");
		if (this.failures == null) {
			this.failures = new HashMap<>();
		}
		FailedBatch failedBatch = this.failures.get(identity);
		if (failedBatch == null || !failedBatch.getOffsets().equals(offsets)) {
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug((failedBatch == null ? "Tracking new failed batch " : "Offsets changed, restarting back off for ")
						+ identity + " at " + offsets);
			}
			failedBatch = new FailedBatch(offsets, backOff.start());
			this.failures.put(identity, failedBatch);
		}
		else if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Batch " + identity + " failed again, reusing back off after "
					+ failedBatch.getDeliveryAttempt() + " attempt(s)");
		}
		failedBatch.advance();
		return failedBatch;
	}

	/**
	 * Return the entry tracked for the batch.
	 * @param identity the batch identity.
	 * @return the entry, or null if the batch is not failing.
	 */
	@Nullable
	public FailedBatch get(BatchIdentity identity) {
		return this.failures == null ? null : this.failures.get(identity);
	}

	/**
	 * Stop tracking the batch.
	 * @param identity the batch identity.
	 * @return true if the batch was tracked.
	 */
	public boolean remove(BatchIdentity identity) {
		if (this.failures == null) {
			return false;
		}
		boolean removed = this.failures.remove(identity) != null;
		if (this.failures.isEmpty()) {
			this.failures = null;
		}
		return removed;
	}

	public int size() {
		return this.failures == null ? 0 : this.failures.size();
	}

	public boolean isEmpty() {
		return this.failures == null;
	}

	@Override
	public String toString() {
		return "FailedBatchStore" + (this.failures == null ? "{}" : this.failures);
	}

	/**
	 * The retry state of a failing batch.
	 */
	public static final class FailedBatch {

		private final OffsetSnapshot offsets;

		private final BackOffExecution backOffExecution;

		private int deliveryAttempt;

		private long nextBackOff;

		FailedBatch(OffsetSnapshot offsets, BackOffExecution backOffExecution) {
			this.offsets = offsets;
			this.backOffExecution = backOffExecution;
		}

		void advance() {
			this.deliveryAttempt++;
			this.nextBackOff = this.backOffExecution.nextBackOff();
		}

		public OffsetSnapshot getOffsets() {
			return this.offsets;
		}

		/**
		 * Return the number of failed deliveries recorded since this entry was created.
		 * @return the delivery attempt.
		 */
		public int getDeliveryAttempt() {
			return this.deliveryAttempt;
		}

		/**
		 * Return the back off computed by the last failure.
		 * @return the interval in milliseconds or {@link BackOffExecution#STOP}.
		 */
		public long getNextBackOff() {
			return this.nextBackOff;
		}

		public boolean isExhausted() {
			return this.nextBackOff == BackOffExecution.STOP;
		}

		@Override
		public String toString() {
			return "FailedBatch{offsets=" + this.offsets + ", deliveryAttempt=" + this.deliveryAttempt
					+ ", nextBackOff=" + this.nextBackOff + "}";
		}

	}

}
