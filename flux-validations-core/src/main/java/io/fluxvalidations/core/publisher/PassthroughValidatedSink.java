/*
 * Copyright (c) 2024 The Flux Validations Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.fluxvalidations.core.publisher;

import java.util.Objects;
import java.util.function.Supplier;

import io.fluxvalidations.core.Validator;
import reactor.core.publisher.Sinks;

/**
 * A {@link ValidatedSink} over a multicast sink that relays valid values to the
 * subscribers present at the time of the push, without buffering. Values pushed while
 * there are no subscribers are dropped by the wrapped sink.
 *
 * @param <T> the type of values pushed into the sink
 * @see Sinks.MulticastSpec#directBestEffort()
 */
public final class PassthroughValidatedSink<T> extends ValidatedSink<T> {

	/**
	 * Create a sink relaying only the values accepted by the given validator.
	 *
	 * @param validator the {@link Validator} applied to every pushed value
	 */
	public PassthroughValidatedSink(Validator<? super T> validator) {
		super(validator, Sinks.many().multicast().directBestEffort());
	}

	/**
	 * Create a sink relaying only the values accepted by the supplied validator. The
	 * supplier is invoked once, immediately.
	 *
	 * @param validatorSupplier the {@link Supplier} of the {@link Validator}
	 */
	public PassthroughValidatedSink(Supplier<? extends Validator<? super T>> validatorSupplier) {
		this(Objects.requireNonNull(validatorSupplier, "validatorSupplier").get());
	}
}
