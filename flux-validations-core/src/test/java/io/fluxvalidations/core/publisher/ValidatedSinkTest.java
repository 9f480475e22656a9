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

import io.fluxvalidations.core.Validatable;
import io.fluxvalidations.core.Validator;
import io.fluxvalidations.core.Validators;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.reactivestreams.Subscription;
import reactor.core.Scannable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;
import reactor.test.publisher.TestPublisher;
import reactor.test.subscriber.TestSubscriber;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static reactor.core.publisher.Sinks.EmitFailureHandler.FAIL_FAST;

public class ValidatedSinkTest {

	static final Validator<CharSequence> NOT_EMPTY_MIN_3 =
			Validator.not(Validators.empty()).and(Validators.count(3));

	@Test
	public void nullArguments() {
		assertThatExceptionOfType(NullPointerException.class)
				.isThrownBy(() -> new ValidatedSink<String>(null, Sinks.many().multicast().directBestEffort()));
		assertThatExceptionOfType(NullPointerException.class)
				.isThrownBy(() -> new ValidatedSink<String>(NOT_EMPTY_MIN_3, null));
	}

	@Test
	public void rejectedValuesNeverReachSubscribers() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);

		StepVerifier.create(sink.asFlux())
		            .then(() -> {
			            assertThat(sink.tryEmitNext("foo-bar")).isEqualTo(Sinks.EmitResult.OK);
			            assertThat(sink.tryEmitNext("fo")).isEqualTo(Sinks.EmitResult.OK);
			            assertThat(sink.tryEmitNext("baz-qux")).isEqualTo(Sinks.EmitResult.OK);
			            assertThat(sink.tryEmitComplete()).isEqualTo(Sinks.EmitResult.OK);
		            })
		            .expectNext("foo-bar", "baz-qux")
		            .verifyComplete();
	}

	@Test
	public void acceptedValueGetsDelegateResult() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);

		assertThat(sink.currentSubscriberCount()).isZero();
		assertThat(sink.tryEmitNext("foo-bar")).isEqualTo(Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER);
		assertThat(sink.tryEmitNext("fo")).isEqualTo(Sinks.EmitResult.OK);
	}

	@Test
	public void emitNextDropsRejected() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);
		TestSubscriber<String> actual = TestSubscriber.create();
		sink.asFlux().subscribe(actual);

		sink.emitNext("fo", FAIL_FAST);
		sink.emitNext("foo-bar", FAIL_FAST);
		sink.emitComplete(FAIL_FAST);

		assertThat(actual.getReceivedOnNext()).containsExactly("foo-bar");
		assertThat(actual.isTerminatedComplete()).isTrue();
	}

	@Test
	public void errorIsDelegated() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);

		StepVerifier.create(sink.asFlux())
		            .then(() -> sink.tryEmitNext("fo"))
		            .then(() -> sink.emitError(new IllegalStateException("boom"), FAIL_FAST))
		            .verifyErrorMessage("boom");
	}

	@Test
	public void subscribedToUpstream() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);
		TestSubscriber<String> actual = TestSubscriber.create();
		sink.asFlux().subscribe(actual);

		Flux.just("foo-bar", "fo", "", "baz-qux").subscribe(sink);

		assertThat(actual.getReceivedOnNext()).containsExactly("foo-bar", "baz-qux");
		assertThat(actual.isTerminatedComplete()).isTrue();
	}

	@Test
	public void subscribedToFailingUpstream() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);
		TestSubscriber<String> actual = TestSubscriber.create();
		sink.asFlux().subscribe(actual);

		Flux.just("fo", "foo")
		    .concatWith(Flux.error(new IllegalStateException("boom")))
		    .subscribe(sink);

		assertThat(actual.getReceivedOnNext()).containsExactly("foo");
		assertThat(actual.expectTerminalError()).hasMessage("boom");
	}

	@Test
	public void onSubscribeRequestsUnbounded() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);
		Subscription upstream = Mockito.mock(Subscription.class);

		sink.onSubscribe(upstream);

		Mockito.verify(upstream).request(Long.MAX_VALUE);
	}

	@Test
	public void secondUpstreamIsCancelled() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);
		TestPublisher<String> first = TestPublisher.create();
		TestPublisher<String> second = TestPublisher.create();

		first.flux().subscribe(sink);
		second.flux().subscribe(sink);

		second.assertCancelled();
		second.assertMaxRequested(0);
		first.assertNotCancelled();
		first.assertMinRequested(Long.MAX_VALUE);
		assertThat(sink.scan(Scannable.Attr.PARENT)).isNotNull();
	}

	@Test
	public void upstreamCancelledWhenSinkCompletes() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);
		TestPublisher<String> upstream = TestPublisher.create();
		upstream.flux().subscribe(sink);

		assertThat(sink.tryEmitComplete()).isEqualTo(Sinks.EmitResult.OK);

		upstream.assertCancelled();
	}

	@Test
	public void upstreamCancelledWhenSinkErrors() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);
		TestPublisher<String> upstream = TestPublisher.create();
		upstream.flux().subscribe(sink);

		sink.emitError(new IllegalStateException("boom"), FAIL_FAST);

		upstream.assertCancelled();
	}

	@Test
	public void upstreamAfterTerminationIsCancelled() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);
		sink.tryEmitComplete();
		TestPublisher<String> upstream = TestPublisher.create();

		upstream.flux().subscribe(sink);

		upstream.assertCancelled();
	}

	@Test
	public void upstreamCompletionIsNotCancellation() {
		PassthroughValidatedSink<String> sink = Validations.sink(NOT_EMPTY_MIN_3);
		TestPublisher<String> upstream = TestPublisher.create();
		TestSubscriber<String> actual = TestSubscriber.create();
		sink.asFlux().subscribe(actual);
		upstream.flux().subscribe(sink);

		upstream.next("foo-bar", "fo");
		upstream.complete();

		upstream.assertNotCancelled();
		assertThat(actual.getReceivedOnNext()).containsExactly("foo-bar");
		assertThat(actual.isTerminatedComplete()).isTrue();
	}

	@Test
	public void wrapsReplaySink() {
		ValidatedSink<String> sink = new ValidatedSink<>(NOT_EMPTY_MIN_3, Sinks.many().replay().all());

		sink.tryEmitNext("foo-bar");
		sink.tryEmitNext("fo");
		sink.tryEmitNext("baz");
		sink.tryEmitComplete();

		StepVerifier.create(sink.asFlux())
		            .expectNext("foo-bar", "baz")
		            .verifyComplete();
	}

	@Test
	public void supplierAndClosure() {
		PassthroughValidatedSink<String> supplied = Validations.sink(() -> NOT_EMPTY_MIN_3);
		PassthroughValidatedSink<String> closure =
				Validations.sink("length", value -> value.length() >= 3 ? value : null);

		StepVerifier.create(Flux.merge(supplied.asFlux(), closure.asFlux()))
		            .then(() -> {
			            supplied.tryEmitNext("fo");
			            supplied.tryEmitNext("foo");
			            closure.tryEmitNext("ba");
			            closure.tryEmitNext("bar");
			            supplied.tryEmitComplete();
			            closure.tryEmitComplete();
		            })
		            .expectNext("foo", "bar")
		            .verifyComplete();

		assertThat(closure.validator().readable()).isEqualTo("length");
	}

	@Test
	public void validatableValues() {
		PassthroughValidatedSink<Validatable> sink = Validations.sink();
		Validatable valid = () -> { };
		Validatable invalid = () -> {
			throw new IllegalArgumentException("invalid");
		};

		StepVerifier.create(sink.asFlux())
		            .then(() -> {
			            sink.tryEmitNext(invalid);
			            sink.tryEmitNext(valid);
			            sink.tryEmitComplete();
		            })
		            .expectNext(valid)
		            .verifyComplete();
	}

	@Test
	public void toStringUsesValidatorName() {
		assertThat(Validations.sink(NOT_EMPTY_MIN_3))
				.hasToString("PassthroughValidatedSink(not empty and at least 3 characters)");
	}

	@Test
	public void scanIsDelegated() {
		Sinks.Many<String> delegate = Sinks.many().multicast().directBestEffort();
		ValidatedSink<String> sink = new ValidatedSink<>(NOT_EMPTY_MIN_3, delegate);

		assertThat(sink.scan(Scannable.Attr.TERMINATED)).isFalse();
		sink.tryEmitComplete();
		assertThat(sink.scan(Scannable.Attr.TERMINATED)).isTrue();
	}
}
