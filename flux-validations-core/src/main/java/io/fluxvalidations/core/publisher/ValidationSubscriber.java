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

import io.fluxvalidations.core.Validator;
import org.reactivestreams.Subscription;
import reactor.core.CoreSubscriber;
import reactor.core.Scannable;
import reactor.core.publisher.Operators;
import reactor.util.annotation.Nullable;
import reactor.util.context.Context;

/**
 * Base of the validating operators: the subscriber given to the upstream source, which is
 * at the same time the {@link Subscription} given to the downstream subscriber.
 * <p>
 * The subscription is complete as soon as either {@link #actual} or {@link #validator}
 * is cleared. Cancellation and terminal signals clear all references together, after
 * which requests are ignored and incoming values are discarded.
 *
 * @param <T> the upstream (validated) type
 * @param <O> the downstream type
 */
abstract class ValidationSubscriber<T, O> implements CoreSubscriber<T>, Subscription, Scannable {

	final Context ctx;

	@Nullable
	Validator<? super T> validator;

	@Nullable
	CoreSubscriber<? super O> actual;

	@Nullable
	Subscription s;

	boolean done;

	ValidationSubscriber(CoreSubscriber<? super O> actual, Validator<? super T> validator) {
		this.actual = actual;
		this.ctx = actual.currentContext();
		this.validator = validator;
	}

	final boolean isComplete() {
		return actual == null || validator == null;
	}

	/**
	 * Validate an incoming value against the live validator.
	 *
	 * @param value the value to validate
	 * @return the outcome of the validation
	 * @throws AlreadyTerminatedException if this subscription is already complete
	 */
	final ValidationOutcome<T> validate(T value) {
		Validator<? super T> v = validator;
		if (v == null || actual == null) {
			throw AlreadyTerminatedException.INSTANCE;
		}
		return ValidationOutcome.of(v, value);
	}

	/**
	 * Terminate with the rejection: cancel upstream, release every reference, then signal
	 * the error downstream.
	 */
	final void reject(CoreSubscriber<? super O> a, ValidationOutcome<T> outcome) {
		done = true;
		cancel();
		Operators.onDiscard(outcome.value, ctx);
		Validations.onRejected(this, outcome);
		a.onError(outcome.error);
	}

	final void clear() {
		actual = null;
		s = null;
		validator = null;
	}

	@Override
	public Context currentContext() {
		return ctx;
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (Operators.validate(this.s, s)) {
			this.s = s;
			CoreSubscriber<? super O> a = actual;
			if (a != null) {
				a.onSubscribe(this);
			}
			else {
				s.cancel();
			}
		}
	}

	@Override
	public void onError(Throwable t) {
		CoreSubscriber<? super O> a = actual;
		if (done || a == null) {
			Operators.onErrorDropped(t, ctx);
			return;
		}
		done = true;
		clear();
		a.onError(t);
	}

	@Override
	public void onComplete() {
		CoreSubscriber<? super O> a = actual;
		if (done || a == null) {
			return;
		}
		done = true;
		clear();
		a.onComplete();
	}

	@Override
	public void request(long n) {
		Subscription s = this.s;
		if (!isComplete() && s != null) {
			s.request(n);
		}
	}

	@Override
	public void cancel() {
		Subscription s = this.s;
		if (s != null) {
			s.cancel();
		}
		clear();
	}

	@Override
	@Nullable
	public Object scanUnsafe(Attr key) {
		if (key == Attr.PARENT) return s;
		if (key == Attr.ACTUAL) return actual;
		if (key == Attr.TERMINATED) return done;
		if (key == Attr.CANCELLED) return !done && actual == null;
		if (key == Attr.RUN_STYLE) return Attr.RunStyle.SYNC;

		return null;
	}
}
