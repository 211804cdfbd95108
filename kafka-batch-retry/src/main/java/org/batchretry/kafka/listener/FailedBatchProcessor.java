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

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetCommitCallback;
import org.apache.kafka.common.TopicPartition;

import org.batchretry.kafka.listener.FailedBatchStore.FailedBatch;
import org.batchretry.kafka.support.BatchIdentity;
import org.batchretry.kafka.support.OffsetSnapshot;
import org.springframework.lang.Nullable;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.util.Assert;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Decides, for a batch that failed, whether to retry it after a back off or to recover
 * all of its records and move past it.
 * <p>
 * The batch is identified by its partitions together with the smallest offset of each
 * partition (see {@link FailedBatchStore}); a redelivery of the same batch reuses the
 * back off, while a batch that starts at different offsets is treated as a new failure.
 * While the back off has not stopped, the calling thread sleeps for the next interval and
 * then seeks each partition back to the start of the batch. Once it stops, each record is
 * passed to the {@link ConsumerRecordRecoverer} in order and each partition is positioned
 * after the batch.
 * <p>
 * The processor itself holds no retry state and can be shared by any number of
 * consumers, each passing its own {@link FailedBatchStore}.
 *
 * @since 1.0
 */
public class FailedBatchProcessor {

	/**
	 * The default number of deliveries of a failing batch before it is recovered.
	 */
	public static final int DEFAULT_MAX_FAILURES = 10;

	/**
	 * The default timeout when committing the offsets of a recovered batch synchronously.
	 */
	public static final Duration DEFAULT_SYNC_COMMIT_TIMEOUT = Duration.ofSeconds(60);

	protected static final Log LOGGER = LogFactory.getLog(FailedBatchProcessor.class); // NOSONAR visibility

	private static final ConsumerRecordRecoverer LOGGING_RECOVERER =
			(record, ex) -> LOGGER.error("Back off exhausted for " + record, ex);

	private final BackOff backOff;

	private final ConsumerRecordRecoverer recoverer;

	private Sleeper sleeper = new ThreadWaitSleeper();

	private List<BatchRetryListener> retryListeners = Collections.emptyList();

	private boolean commitRecovered;

	private boolean syncCommits = true;

	private Duration syncCommitTimeout = DEFAULT_SYNC_COMMIT_TIMEOUT;

	@Nullable
	private OffsetCommitCallback commitCallback;

	/**
	 * Construct an instance with the default recoverer, which logs each record, retrying
	 * without delay until {@value #DEFAULT_MAX_FAILURES} deliveries have failed.
	 */
	public FailedBatchProcessor() {
		this(null, new FixedBackOff(0L, DEFAULT_MAX_FAILURES - 1));
	}

	/**
	 * Construct an instance with the default recoverer, which logs each record, and the
	 * provided back off.
	 * @param backOff the back off.
	 */
	public FailedBatchProcessor(BackOff backOff) {
		this(null, backOff);
	}

	/**
	 * Construct an instance with the provided recoverer and back off.
	 * @param recoverer the recoverer; if null, the default (logging) recoverer is used.
	 * @param backOff the back off.
	 */
	public FailedBatchProcessor(@Nullable ConsumerRecordRecoverer recoverer, BackOff backOff) {
		Assert.notNull(backOff, "'backOff' cannot be null");
		this.recoverer = recoverer == null ? LOGGING_RECOVERER : recoverer;
		this.backOff = backOff;
	}

	public BackOff getBackOff() {
		return this.backOff;
	}

	public ConsumerRecordRecoverer getRecoverer() {
		return this.recoverer;
	}

	/**
	 * Set the sleeper used to wait between deliveries; default {@link ThreadWaitSleeper}.
	 * @param sleeper the sleeper.
	 */
	public void setSleeper(Sleeper sleeper) {
		Assert.notNull(sleeper, "'sleeper' cannot be null");
		this.sleeper = sleeper;
	}

	/**
	 * Set the listeners notified of failed deliveries and recoveries.
	 * @param listeners the listeners.
	 */
	public void setRetryListeners(BatchRetryListener... listeners) {
		Assert.noNullElements(listeners, "'listeners' cannot have null elements");
		this.retryListeners = Collections.unmodifiableList(Arrays.asList(listeners));
	}

	public boolean isCommitRecovered() {
		return this.commitRecovered;
	}

	/**
	 * Set to true to commit the offsets following a recovered batch.
	 * @param commitRecovered true to commit.
	 */
	public void setCommitRecovered(boolean commitRecovered) {
		this.commitRecovered = commitRecovered;
	}

	/**
	 * Set to false to commit the offsets of recovered batches asynchronously.
	 * @param syncCommits false for async commits.
	 */
	public void setSyncCommits(boolean syncCommits) {
		this.syncCommits = syncCommits;
	}

	/**
	 * Set the timeout for synchronous commits of recovered batches.
	 * @param syncCommitTimeout the timeout.
	 */
	public void setSyncCommitTimeout(Duration syncCommitTimeout) {
		Assert.notNull(syncCommitTimeout, "'syncCommitTimeout' cannot be null");
		Assert.isTrue(!syncCommitTimeout.isNegative(), "'syncCommitTimeout' cannot be negative");
		this.syncCommitTimeout = syncCommitTimeout;
	}

	/**
	 * Set the callback for asynchronous commits of recovered batches; by default a
	 * {@link LoggingCommitCallback} for the recovered batch is used.
	 * @param commitCallback the callback.
	 */
	public void setCommitCallback(OffsetCommitCallback commitCallback) {
		Assert.notNull(commitCallback, "'commitCallback' cannot be null");
		this.commitCallback = commitCallback;
	}

	/**
	 * Retry or recover the failed batch.
	 * @param store the failed batches of the consumer that polled the batch.
	 * @param records the batch; must not be empty.
	 * @param consumer the consumer, used for seeking.
	 * @param thrownException the exception that caused the failure.
	 */
	public void seekToCurrentOrRecover(FailedBatchStore store, ConsumerRecords<?, ?> records,
			Consumer<?, ?> consumer, Exception thrownException) {

		Assert.notNull(store, "'store' cannot be null");
		Assert.isTrue(records != null && !records.isEmpty(), "Cannot retry an empty batch");
		BatchIdentity identity = BatchIdentity.of(records);
		FailedBatch failedBatch = store.recordFailure(identity, OffsetSnapshot.of(records), this.backOff);
		if (failedBatch.isExhausted()) {
			LOGGER.warn("Batch " + identity + " has exceeded its back off after " + failedBatch.getDeliveryAttempt()
					+ " attempt(s), recovering " + records.count() + " record(s)");
			doRecover(store, identity, records, consumer, thrownException);
		}
		else {
			notifyFailedDelivery(records, thrownException, failedBatch.getDeliveryAttempt());
			pause(identity, failedBatch.getNextBackOff());
			BatchSeekUtils.seekToCurrent(records, consumer);
		}
	}

	/**
	 * Recover each record of the batch without retrying and seek past it.
	 * @param store the failed batches of the consumer that polled the batch.
	 * @param records the batch; must not be empty.
	 * @param consumer the consumer, used for seeking.
	 * @param thrownException the exception that caused the failure.
	 */
	public void recover(FailedBatchStore store, ConsumerRecords<?, ?> records, Consumer<?, ?> consumer,
			Exception thrownException) {

		Assert.notNull(store, "'store' cannot be null");
		Assert.isTrue(records != null && !records.isEmpty(), "Cannot recover an empty batch");
		doRecover(store, BatchIdentity.of(records), records, consumer, thrownException);
	}

	private void doRecover(FailedBatchStore store, BatchIdentity identity, ConsumerRecords<?, ?> records,
			Consumer<?, ?> consumer, Exception thrownException) {

		try {
			for (ConsumerRecord<?, ?> record : records) {
				this.recoverer.accept(record, thrownException);
			}
		}
		catch (RuntimeException ex) {
			LOGGER.error("Recoverer threw an exception for batch " + identity + "; it will be redelivered", ex);
			notifyRecoveryFailed(records, thrownException, ex);
			BatchSeekUtils.seekToCurrent(records, consumer);
			throw ex;
		}
		BatchSeekUtils.seekToNext(records, consumer);
		store.remove(identity);
		commitIfNecessary(identity, records, consumer);
		notifyRecovered(records, thrownException);
	}

	private void pause(BatchIdentity identity, long backOff) {
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Back off not stopped yet for " + identity + ", waiting " + backOff + " ms");
		}
		try {
			this.sleeper.sleep(backOff);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			LOGGER.debug("Interrupted during back off for " + identity + ", seeking now");
		}
	}

	private void commitIfNecessary(BatchIdentity identity, ConsumerRecords<?, ?> records, Consumer<?, ?> consumer) {
		if (this.commitRecovered) {
			Map<TopicPartition, OffsetAndMetadata> offsets = BatchSeekUtils.nextOffsets(records);
			if (this.syncCommits) {
				consumer.commitSync(offsets, this.syncCommitTimeout);
			}
			else {
				consumer.commitAsync(offsets,
						this.commitCallback == null ? new LoggingCommitCallback(identity) : this.commitCallback);
			}
		}
	}

	private void notifyFailedDelivery(ConsumerRecords<?, ?> records, Exception thrownException, int attempt) {
		for (BatchRetryListener listener : this.retryListeners) {
			try {
				listener.failedDelivery(records, thrownException, attempt);
			}
			catch (RuntimeException ex) {
				LOGGER.error("Retry listener failed in failedDelivery", ex);
			}
		}
	}

	private void notifyRecovered(ConsumerRecords<?, ?> records, Exception thrownException) {
		for (BatchRetryListener listener : this.retryListeners) {
			try {
				listener.recovered(records, thrownException);
			}
			catch (RuntimeException ex) {
				LOGGER.error("Retry listener failed in recovered", ex);
			}
		}
	}

	private void notifyRecoveryFailed(ConsumerRecords<?, ?> records, Exception thrownException, Exception failure) {
		for (BatchRetryListener listener : this.retryListeners) {
			try {
				listener.recoveryFailed(records, thrownException, failure);
			}
			catch (RuntimeException ex) {
				LOGGER.error("Retry listener failed in recoveryFailed", ex);
			}
		}
	}

}
