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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Operators;
import reactor.core.publisher.Sinks;
import reactor.util.annotation.Nullable;

/**
 * A {@link Sinks.Many} that validates every value pushed into it and silently drops the
 * rejected ones before they reach the wrapped sink. Terminal signals, subscribers and
 * introspection are delegated unchanged, and a rejection never terminates the sink.
 * <p>
 * The sink is also a {@link CoreSubscriber}, so it can be subscribed to an upstream
 * {@link org.reactivestreams.Publisher}: it requests an unbounded amount and pushes every
 * received value through the same validation.
 *
 * @param <T> the type of values pushed into the sink
 */
public class ValidatedSink<T> implements Sinks.Many<T>, CoreSubscriber<T> {

	final Validator<? super T> validator;

	final Sinks.Many<T> delegate;

	@Nullable
	Subscription s;

	/**
	 * Wrap a {@link Sinks.Many} so that only values accepted by the validator reach it.
	 *
	 * @param validator the {@link Validator} applied to every pushed value
	 * @param delegate the sink receiving the accepted values
	 */
	public ValidatedSink(Validator<? super T> validator, Sinks.Many<T> delegate) {
		this.validator = Objects.requireNonNull(validator, "validator");
		this.delegate = Objects.requireNonNull(delegate, "delegate");
	}

	/**
	 * Return the {@link Validator} applied to every pushed value.
	 *
	 * @return the validator of this sink
	 */
	public Validator<? super T> validator() {
		return validator;
	}

	/**
	 * Validate the value and push it to the wrapped sink if it is accepted. A rejected
	 * value is dropped and {@link Sinks.EmitResult#OK} is returned.
	 *
	 * @param t the value to push
	 * @return the result of the wrapped sink, or {@link Sinks.EmitResult#OK} if the
	 * value was dropped
	 */
	@Override
	public Sinks.EmitResult tryEmitNext(T t) {
		if (!accept(t)) {
			return Sinks.EmitResult.OK;
		}
		return delegate.tryEmitNext(t);
	}

	@Override
	public void emitNext(T t, Sinks.EmitFailureHandler failureHandler) {
		if (accept(t)) {
			delegate.emitNext(t, failureHandler);
		}
	}

	@Override
	public Sinks.EmitResult tryEmitComplete() {
		Sinks.EmitResult result = delegate.tryEmitComplete();
		if (result == Sinks.EmitResult.OK) {
			cancelUpstream();
		}
		return result;
	}

	@Override
	public Sinks.EmitResult tryEmitError(Throwable error) {
		Sinks.EmitResult result = delegate.tryEmitError(error);
		if (result == Sinks.EmitResult.OK) {
			cancelUpstream();
		}
		return result;
	}

	@Override
	public void emitComplete(Sinks.EmitFailureHandler failureHandler) {
		delegate.emitComplete(failureHandler);
		cancelUpstream();
	}

	@Override
	public void emitError(Throwable error, Sinks.EmitFailureHandler failureHandler) {
		delegate.emitError(error, failureHandler);
		cancelUpstream();
	}

	@Override
	public int currentSubscriberCount() {
		return delegate.currentSubscriberCount();
	}

	@Override
	public Flux<T> asFlux() {
		return delegate.asFlux();
	}

	/**
	 * Attach an upstream {@link Subscription}, requesting an unbounded amount. Only one
	 * upstream can be attached: any later {@link Subscription} is cancelled, including
	 * once the sink has been terminated.
	 *
	 * @param s the upstream {@link Subscription}
	 */
	@Override
	public void onSubscribe(Subscription s) {
		if (Operators.validate(this.s, s)) {
			this.s = s;
			s.request(Long.MAX_VALUE);
		}
	}

	@Override
	public void onNext(T t) {
		Sinks.EmitResult result = tryEmitNext(t);
		if (result.isFailure()) {
			Operators.onNextDropped(t, currentContext());
			if (result == Sinks.EmitResult.FAIL_TERMINATED || result == Sinks.EmitResult.FAIL_CANCELLED) {
				cancelUpstream();
			}
		}
	}

	@Override
	public void onError(Throwable t) {
		s = Operators.cancelledSubscription();
		if (delegate.tryEmitError(t).isFailure()) {
			Operators.onErrorDropped(t, currentContext());
		}
	}

	@Override
	public void onComplete() {
		s = Operators.cancelledSubscription();
		delegate.tryEmitComplete();
	}

	@Override
	@Nullable
	public Object scanUnsafe(Attr key) {
		if (key == Attr.PARENT) return s;
		return delegate.scanUnsafe(key);
	}

	final void cancelUpstream() {
		Subscription s = this.s;
		this.s = Operators.cancelledSubscription();
		if (s != null) {
			s.cancel();
		}
	}

	final boolean accept(T t) {
		ValidationOutcome<T> outcome = ValidationOutcome.of(validator, t);
		if (outcome.isAccepted()) {
			return true;
		}
		Validations.onRejected(this, outcome);
		return false;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + validator.readable() + ")";
	}
}
