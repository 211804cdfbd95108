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
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.SerializationException;

import org.batchretry.kafka.BatchRetryException;
import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.lang.Nullable;
import org.springframework.util.Assert;
import org.springframework.util.backoff.BackOff;

/**
 * A batch error handler that seeks back to the start of a failed batch so that it is
 * redelivered, until the back off is exhausted; the records are then passed to the
 * recoverer and the consumer is positioned after the batch. See
 * {@link FailedBatchProcessor}.
 * <p>
 * Each consumer gets its own {@link FailedBatchStore}, which is dropped as soon as it no
 * longer tracks a failing batch, or when {@link #clearState(Consumer)} is called.
 *
 * @since 1.0
 */
public class RetryingBatchErrorHandler implements ConsumerAwareBatchErrorHandler {

	protected static final Log LOGGER = LogFactory.getLog(RetryingBatchErrorHandler.class); // NOSONAR visibility

	private final FailedBatchProcessor processor;

	private final Map<Consumer<?, ?>, FailedBatchStore> stores = new ConcurrentHashMap<>();

	private BinaryExceptionClassifier classifier;

	/**
	 * Construct an instance with the default recoverer, which logs each record after
	 * {@value FailedBatchProcessor#DEFAULT_MAX_FAILURES} deliveries of the batch have
	 * failed.
	 */
	public RetryingBatchErrorHandler() {
		this(new FailedBatchProcessor());
	}

	/**
	 * Construct an instance with the default (logging) recoverer and the provided back off.
	 * @param backOff the back off.
	 */
	public RetryingBatchErrorHandler(BackOff backOff) {
		this(new FailedBatchProcessor(backOff));
	}

	/**
	 * Construct an instance with the provided recoverer and back off.
	 * @param recoverer the recoverer; if null, the default (logging) recoverer is used.
	 * @param backOff the back off.
	 */
	public RetryingBatchErrorHandler(@Nullable ConsumerRecordRecoverer recoverer, BackOff backOff) {
		this(new FailedBatchProcessor(recoverer, backOff));
	}

	/**
	 * Construct an instance that delegates to the provided processor.
	 * @param processor the processor.
	 */
	public RetryingBatchErrorHandler(FailedBatchProcessor processor) {
		Assert.notNull(processor, "'processor' cannot be null");
		this.processor = processor;
		this.classifier = configureDefaultClassifier();
	}

	public FailedBatchProcessor getProcessor() {
		return this.processor;
	}

	protected BinaryExceptionClassifier getClassifier() {
		return this.classifier;
	}

	/**
	 * Set an exception classifier to determine whether the exception should cause a retry
	 * (until exhaustion) or not. If not, the batch goes straight to the recoverer. By
	 * default, the following exceptions will not be retried:
	 * <ul>
	 * <li>{@link SerializationException}</li>
	 * <li>{@link ClassCastException}</li>
	 * <li>{@link NoSuchMethodException}</li>
	 * </ul>
	 * All others will be retried. The classifier's
	 * {@link BinaryExceptionClassifier#setTraverseCauses(boolean) traverseCauses} will be
	 * set to true because listener exceptions are often wrapped.
	 * @param classifier the classifier.
	 */
	public void setClassifier(BinaryExceptionClassifier classifier) {
		Assert.notNull(classifier, "'classifier' cannot be null");
		classifier.setTraverseCauses(true);
		this.classifier = classifier;
	}

	/**
	 * Add an exception type to the default list of exceptions that are not retried; if
	 * and only if an external classifier has not been provided.
	 * @param exceptionType the exception type.
	 * @see #removeNotRetryableException(Class)
	 * @see #setClassifier(BinaryExceptionClassifier)
	 */
	public void addNotRetryableException(Class<? extends Exception> exceptionType) {
		Assert.isTrue(this.classifier instanceof ExtendedBinaryExceptionClassifier,
				"Cannot add exception types to a supplied classifier");
		((ExtendedBinaryExceptionClassifier) this.classifier).getClassified().put(exceptionType, false);
	}

	/**
	 * Remove an exception type from the list of exceptions that are not retried; if and
	 * only if an external classifier has not been provided.
	 * @param exceptionType the exception type.
	 * @return true if the removal was successful.
	 * @see #addNotRetryableException(Class)
	 * @see #setClassifier(BinaryExceptionClassifier)
	 */
	public boolean removeNotRetryableException(Class<? extends Exception> exceptionType) {
		Assert.isTrue(this.classifier instanceof ExtendedBinaryExceptionClassifier,
				"Cannot remove exception types from a supplied classifier");
		return ((ExtendedBinaryExceptionClassifier) this.classifier).getClassified().remove(exceptionType) != null;
	}

	@Override
	public void handle(Exception thrownException, ConsumerRecords<?, ?> records, Consumer<?, ?> consumer) {
		Assert.notNull(consumer, "'consumer' cannot be null");
		if (records == null || records.isEmpty()) {
			throw new BatchRetryException("Batch listener failed but there are no records to retry",
					thrownException);
		}
		FailedBatchStore store = this.stores.computeIfAbsent(consumer, c -> new FailedBatchStore());
		try {
			if (this.classifier.classify(thrownException)) {
				this.processor.seekToCurrentOrRecover(store, records, consumer, thrownException);
			}
			else {
				if (LOGGER.isDebugEnabled()) {
					LOGGER.debug("Not retrying " + records.count() + " record(s) after " + thrownException);
				}
				this.processor.recover(store, records, consumer, thrownException);
			}
		}
		finally {
			if (store.isEmpty()) {
				this.stores.remove(consumer);
			}
		}
	}

	@Override
	public void clearState(Consumer<?, ?> consumer) {
		this.stores.remove(consumer);
	}

	/**
	 * Return the failed batches tracked for the consumer.
	 * @param consumer the consumer.
	 * @return the store, or null if the consumer has no failing batch.
	 */
	@Nullable
	public FailedBatchStore getStore(Consumer<?, ?> consumer) {
		return this.stores.get(consumer);
	}

	private static BinaryExceptionClassifier configureDefaultClassifier() {
		Map<Class<? extends Throwable>, Boolean> classified = new HashMap<>();
		classified.put(SerializationException.class, false);
		classified.put(ClassCastException.class, false);
		classified.put(NoSuchMethodException.class, false);
		ExtendedBinaryExceptionClassifier defaultClassifier = new ExtendedBinaryExceptionClassifier(classified, true);
		defaultClassifier.setTraverseCauses(true);
		return defaultClassifier;
	}

	/**
	 * Extended to provide visibility to the current classified exceptions.
	 */
	@SuppressWarnings("serial")
	private static class ExtendedBinaryExceptionClassifier extends BinaryExceptionClassifier {

		ExtendedBinaryExceptionClassifier(Map<Class<? extends Throwable>, Boolean> typeMap, boolean defaultValue) {
			super(typeMap, defaultValue);
		}

		@Override
		protected Map<Class<? extends Throwable>, Boolean> getClassified() { // NOSONAR worthless override
			return super.getClassified();
		}

	}

}
