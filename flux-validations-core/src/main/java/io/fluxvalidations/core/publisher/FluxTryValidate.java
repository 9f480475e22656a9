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

import io.fluxvalidations.core.ValidationException;
import io.fluxvalidations.core.Validator;
import reactor.core.CoreSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxOperator;
import reactor.core.publisher.Operators;
import reactor.util.annotation.Nullable;

/**
 * Validates each upstream value and relays the accepted ones. The first rejected value
 * cancels the upstream and terminates the sequence with a {@link ValidationException}.
 * Accepted empty {@link java.util.Optional} values are skipped.
 *
 * @param <T> the validated type
 */
final class FluxTryValidate<T> extends FluxOperator<T, T> {

	final Validator<? super T> validator;

	FluxTryValidate(Flux<? extends T> source, Validator<? super T> validator) {
		super(source);
		this.validator = Objects.requireNonNull(validator, "validator");
	}

	@Override
	public void subscribe(CoreSubscriber<? super T> actual) {
		source.subscribe(new TryValidateSubscriber<>(actual, validator));
	}

	@Override
	@Nullable
	public Object scanUnsafe(Attr key) {
		if (key == Attr.RUN_STYLE) return Attr.RunStyle.SYNC;
		return super.scanUnsafe(key);
	}

	static final class TryValidateSubscriber<T> extends ValidationSubscriber<T, T> {

		TryValidateSubscriber(CoreSubscriber<? super T> actual, Validator<? super T> validator) {
			super(actual, validator);
		}

		@Override
		public void onNext(T t) {
			CoreSubscriber<? super T> a = actual;
			ValidationOutcome<T> outcome;
			try {
				outcome = validate(t);
			}
			catch (AlreadyTerminatedException e) {
				Operators.onDiscard(t, ctx);
				return;
			}

			if (!outcome.isAccepted()) {
				reject(a, outcome);
				return;
			}
			if (ValidationOutcome.isAbsent(t)) {
				Operators.onDiscard(t, ctx);
				return;
			}
			a.onNext(t);
		}
	}
}
