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
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxOperator;
import reactor.core.publisher.Operators;
import reactor.util.annotation.Nullable;

/**
 * Validates each upstream value and emits it wrapped in an {@link Optional}, or an empty
 * {@link Optional} once for the first rejected value. The sequence never fails because
 * of a rejection, but the operator stops validating after the first one: later values
 * are discarded while upstream completion and errors are still relayed.
 *
 * @param <T> the validated type
 */
final class FluxValidate<T> extends FluxOperator<T, Optional<T>> {

	final Validator<? super T> validator;

	FluxValidate(Flux<? extends T> source, Validator<? super T> validator) {
		super(source);
		this.validator = Objects.requireNonNull(validator, "validator");
	}

	@Override
	public void subscribe(CoreSubscriber<? super Optional<T>> actual) {
		source.subscribe(new ValidateSubscriber<>(actual, validator));
	}

	@Override
	@Nullable
	public Object scanUnsafe(Attr key) {
		if (key == Attr.RUN_STYLE) return Attr.RunStyle.SYNC;
		return super.scanUnsafe(key);
	}

	static final class ValidateSubscriber<T> extends ValidationSubscriber<T, Optional<T>> {

		ValidateSubscriber(CoreSubscriber<? super Optional<T>> actual,
				Validator<? super T> validator) {
			super(actual, validator);
		}

		@Override
		public void onNext(T t) {
			CoreSubscriber<? super Optional<T>> a = actual;
			ValidationOutcome<T> outcome;
			try {
				outcome = validate(t);
			}
			catch (AlreadyTerminatedException e) {
				Operators.onDiscard(t, ctx);
				return;
			}

			if (outcome.isAccepted()) {
				a.onNext(Optional.of(t));
				return;
			}

			// only the validator is released, downstream stays attached for terminal signals
			validator = null;
			Operators.onDiscard(t, ctx);
			Validations.onRejected(this, outcome);
			a.onNext(Optional.empty());
		}
	}
}
