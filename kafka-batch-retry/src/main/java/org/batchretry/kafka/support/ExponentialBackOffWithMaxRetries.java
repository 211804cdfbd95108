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

import org.springframework.util.Assert;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * An {@link ExponentialBackOff} that stops after a fixed number of retries instead of
 * relying on the maximum elapsed time alone. The {@code maxElapsedTime} still applies
 * if it is reached first.
 *
 * @since 1.0
 */
public class ExponentialBackOffWithMaxRetries extends ExponentialBackOff {

	private final int maxRetries;

	/**
	 * Construct an instance that will calculate the intervals from the initial interval,
	 * multiplier and max interval properties, stopping after the supplied number of
	 * retries.
	 * @param maxRetries the maximum number of retries; zero means recover on the first
	 * failure.
	 */
	public ExponentialBackOffWithMaxRetries(int maxRetries) {
		Assert.isTrue(maxRetries >= 0, "'maxRetries' cannot be negative");
		this.maxRetries = maxRetries;
	}

	public int getMaxRetries() {
		return this.maxRetries;
	}

	@Override
	public BackOffExecution start() {
		return new MaxRetriesBackOffExecution(super.start(), this.maxRetries);
	}

	private static final class MaxRetriesBackOffExecution implements BackOffExecution {

		private final BackOffExecution delegate;

		private final int maxRetries;

		private int retries;

		MaxRetriesBackOffExecution(BackOffExecution delegate, int maxRetries) {
			this.delegate = delegate;
			this.maxRetries = maxRetries;
		}

		@Override
		public long nextBackOff() {
			if (this.retries >= this.maxRetries) {
				return STOP;
			}
			this.retries++;
			return this.delegate.nextBackOff();
		}

		@Override
		public String toString() {
			return "MaxRetriesBackOffExecution{retries=" + this.retries + ", maxRetries=" + this.maxRetries
					+ ", delegate=" + this.delegate + "}";
		}

	}

}
