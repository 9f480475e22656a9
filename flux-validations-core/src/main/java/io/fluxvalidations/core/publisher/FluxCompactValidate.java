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

import io.fluxvalidations.core.Validator;
import org.reactivestreams.Subscription;
import reactor.core.CoreSubscriber;
import reactor.core.Fuseable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxOperator;
import reactor.core.publisher.Operators;
import reactor.util.annotation.Nullable;

/**
 * Relays the upstream values its validator accepts and silently drops the others,
 * requesting a replacement for each dropped value. Accepted empty
 * {@link java.util.Optional} values are dropped as well.
 *
 * @param <T> the validated type
 */
final class FluxCompactValidate<T> extends FluxOperator<T, T> {

	final Validator<? super T> validator;

	FluxCompactValidate(Flux<? extends T> source, Validator<? super T> validator) {
		super(source);
		this.validator = Objects.requireNonNull(validator, "validator");
	}

	@Override
	public void subscribe(CoreSubscriber<? super T> actual) {
		source.subscribe(new CompactValidateSubscriber<>(actual, validator));
	}

	@Override
	@Nullable
	public Object scanUnsafe(Attr key) {
		if (key == Attr.RUN_STYLE) return Attr.RunStyle.SYNC;
		return super.scanUnsafe(key);
	}

	static final class CompactValidateSubscriber<T> extends ValidationSubscriber<T, T>
			implements Fuseable.ConditionalSubscriber<T> {

		CompactValidateSubscriber(CoreSubscriber<? super T> actual, Validator<? super T> validator) {
			super(actual, validator);
		}

		@Override
		public void onNext(T t) {
			if (!tryOnNext(t)) {
				Subscription s = this.s;
				if (!isComplete() && s != null) {
					s.request(1);
				}
			}
		}

		@Override
		public boolean tryOnNext(T t) {
			CoreSubscriber<? super T> a = actual;
			Validator<? super T> v = validator;
			if (a == null || v == null) {
				Operators.onDiscard(t, ctx);
				return false;
			}

			ValidationOutcome<T> outcome = ValidationOutcome.of(v, t);
			if (!outcome.isAccepted()) {
				Operators.onDiscard(t, ctx);
				Validations.onRejected(this, outcome);
				return false;
			}
			if (ValidationOutcome.isAbsent(t)) {
				Operators.onDiscard(t, ctx);
				return false;
			}
			a.onNext(t);
			return true;
		}
	}
}
