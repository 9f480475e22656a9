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
import java.util.Optional;

import io.fluxvalidations.core.Validator;
import reactor.core.CoreSubscriber;
import reactor.core.Scannable;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Emits a single value wrapped in an {@link Optional} if it passes validation, or an
 * empty {@link Optional} otherwise, then completes. Never fails because of a rejection.
 * The value is validated once, when the {@link Mono} is assembled.
 *
 * @param <T> the validated type
 */
final class MonoValidated<T> extends Mono<Optional<T>> implements Scannable {

	static <T> Mono<Optional<T>> of(T value, Validator<? super T> validator) {
		return onAssembly(new MonoValidated<>(value, validator));
	}

	final T value;

	final Validator<? super T> validator;

	final Optional<T> result;

	MonoValidated(T value, Validator<? super T> validator) {
		this.value = Objects.requireNonNull(value, "value");
		this.validator = Objects.requireNonNull(validator, "validator");
		ValidationOutcome<T> outcome = ValidationOutcome.of(validator, value);
		if (outcome.isAccepted()) {
			this.result = Optional.of(value);
		}
		else {
			Validations.onRejected(this, outcome);
			this.result = Optional.empty();
		}
	}

	@Override
	public void subscribe(CoreSubscriber<? super Optional<T>> actual) {
		actual.onSubscribe(new ValidatedSubscription<Optional<T>>(actual, result, null));
	}

	@Override
	@Nullable
	public Object scanUnsafe(Attr key) {
		if (key == Attr.RUN_STYLE) return Attr.RunStyle.SYNC;
		return null;
	}
}
