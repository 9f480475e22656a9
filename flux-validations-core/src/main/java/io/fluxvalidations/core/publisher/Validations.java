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
import java.util.function.Function;
import java.util.function.Supplier;

import io.fluxvalidations.core.Validatable;
import io.fluxvalidations.core.ValidationException;
import io.fluxvalidations.core.Validator;
import io.fluxvalidations.core.Validators;
import reactor.core.Scannable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * Entry points of the validating operators, sources and sinks.
 * <p>
 * Operators are returned as functions to be applied with {@link Flux#transform(Function)}:
 * <pre>
 * {@code
 * Flux.just("foo-bar", "fo")
 *     .transform(Validations.compactValidate(Validator.not(Validators.empty()).and(Validators.count(3))))
 *     .subscribe(System.out::println); // prints "foo-bar"
 * }
 * </pre>
 * Every factory accepts a {@link Validator}, a {@link Supplier} of one (invoked once, at
 * assembly), no validator at all for {@link Validatable} values, or a name and a closure
 * to build an ad-hoc {@link Validator}.
 *
 * <table>
 * <caption>Handling of rejected values</caption>
 * <tr><th>factory</th><th>on rejection</th><th>terminates</th></tr>
 * <tr><td>{@code validate}</td><td>emits {@link Optional#empty()}</td><td>no</td></tr>
 * <tr><td>{@code tryValidate}</td><td>errors with {@link ValidationException}</td><td>yes</td></tr>
 * <tr><td>{@code compactValidate}</td><td>drops the value</td><td>no</td></tr>
 * <tr><td>{@code validated}</td><td>emits {@link Optional#empty()}</td><td>single value</td></tr>
 * <tr><td>{@code tryValidated}</td><td>errors with {@link ValidationException}</td><td>yes</td></tr>
 * <tr><td>{@code sink}</td><td>drops the value</td><td>no</td></tr>
 * </table>
 */
public final class Validations {

	/**
	 * Whether rejected values are logged at DEBUG level, from the
	 * {@code io.fluxvalidations.logRejections} system property. Defaults to {@code true}.
	 */
	public static final boolean LOG_REJECTIONS =
			Optional.ofNullable(System.getProperty("io.fluxvalidations.logRejections"))
			        .map(Boolean::parseBoolean)
			        .orElse(true);

	static final Logger log = Loggers.getLogger(Validations.class);

	/**
	 * Validate each value, emitting it wrapped in an {@link Optional}. The first rejected
	 * value is replaced by an empty {@link Optional}, after which the operator stops
	 * validating: later values are discarded while completion is still relayed.
	 *
	 * @param validator the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 */
	public static <T> Function<Flux<T>, Flux<Optional<T>>> validate(Validator<? super T> validator) {
		Objects.requireNonNull(validator, "validator");
		return source -> new FluxValidate<>(source, validator);
	}

	/**
	 * Same as {@link #validate(Validator)}, with a supplied {@link Validator}.
	 *
	 * @param validatorSupplier the {@link Supplier} of the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 */
	public static <T> Function<Flux<T>, Flux<Optional<T>>> validate(Supplier<? extends Validator<? super T>> validatorSupplier) {
		return validate(supply(validatorSupplier));
	}

	/**
	 * Same as {@link #validate(Validator)}, validating {@link Validatable} values against
	 * their own rules.
	 *
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 */
	public static <T extends Validatable> Function<Flux<T>, Flux<Optional<T>>> validate() {
		return validate(Validators.<T>valid());
	}

	/**
	 * Same as {@link #validate(Validator)}, with an ad-hoc validator rejecting values for
	 * which the closure returns {@code null}.
	 *
	 * @param name the name of the validator, used in the rejection description
	 * @param closure returns the value if it is valid, {@code null} otherwise
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 * @see Validator#returning(String, Function)
	 */
	public static <T> Function<Flux<T>, Flux<Optional<T>>> validate(String name, Function<? super T, ?> closure) {
		return validate(Validator.<T>returning(name, closure));
	}

	/**
	 * Validate each value, relaying the accepted ones. The first rejected value cancels
	 * the source and terminates the sequence with a {@link ValidationException}. Accepted
	 * empty {@link Optional} values are skipped.
	 *
	 * @param validator the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 */
	public static <T> Function<Flux<T>, Flux<T>> tryValidate(Validator<? super T> validator) {
		Objects.requireNonNull(validator, "validator");
		return source -> new FluxTryValidate<>(source, validator);
	}

	/**
	 * Same as {@link #tryValidate(Validator)}, with a supplied {@link Validator}.
	 *
	 * @param validatorSupplier the {@link Supplier} of the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 */
	public static <T> Function<Flux<T>, Flux<T>> tryValidate(Supplier<? extends Validator<? super T>> validatorSupplier) {
		return tryValidate(supply(validatorSupplier));
	}

	/**
	 * Same as {@link #tryValidate(Validator)}, validating {@link Validatable} values
	 * against their own rules.
	 *
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 */
	public static <T extends Validatable> Function<Flux<T>, Flux<T>> tryValidate() {
		return tryValidate(Validators.<T>valid());
	}

	/**
	 * Same as {@link #tryValidate(Validator)}, with an ad-hoc validator rejecting values
	 * for which the rule throws.
	 *
	 * @param name the name of the validator
	 * @param rule throws to reject a value
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 * @see Validator#named(String, Validator.Rule)
	 */
	public static <T> Function<Flux<T>, Flux<T>> tryValidate(String name, Validator.Rule<? super T> rule) {
		return tryValidate(Validator.<T>named(name, rule));
	}

	/**
	 * Validate each value, relaying the accepted ones and dropping the others. A
	 * replacement value is requested for each dropped one. Accepted empty
	 * {@link Optional} values are dropped as well.
	 *
	 * @param validator the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 */
	public static <T> Function<Flux<T>, Flux<T>> compactValidate(Validator<? super T> validator) {
		Objects.requireNonNull(validator, "validator");
		return source -> new FluxCompactValidate<>(source, validator);
	}

	/**
	 * Same as {@link #compactValidate(Validator)}, with a supplied {@link Validator}.
	 *
	 * @param validatorSupplier the {@link Supplier} of the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 */
	public static <T> Function<Flux<T>, Flux<T>> compactValidate(Supplier<? extends Validator<? super T>> validatorSupplier) {
		return compactValidate(supply(validatorSupplier));
	}

	/**
	 * Same as {@link #compactValidate(Validator)}, validating {@link Validatable} values
	 * against their own rules.
	 *
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 */
	public static <T extends Validatable> Function<Flux<T>, Flux<T>> compactValidate() {
		return compactValidate(Validators.<T>valid());
	}

	/**
	 * Same as {@link #compactValidate(Validator)}, with an ad-hoc validator rejecting
	 * values for which the closure returns {@code null}.
	 *
	 * @param name the name of the validator
	 * @param closure returns the value if it is valid, {@code null} otherwise
	 * @param <T> the validated type
	 * @return a transformation for {@link Flux#transform(Function)}
	 */
	public static <T> Function<Flux<T>, Flux<T>> compactValidate(String name, Function<? super T, ?> closure) {
		return compactValidate(Validator.<T>returning(name, closure));
	}

	/**
	 * Create a {@link Mono} emitting the value wrapped in an {@link Optional} if it is
	 * valid, or an empty {@link Optional} otherwise. The value is validated immediately.
	 *
	 * @param value the value to emit
	 * @param validator the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a new {@link Mono}
	 */
	public static <T> Mono<Optional<T>> validated(T value, Validator<? super T> validator) {
		return MonoValidated.of(value, validator);
	}

	/**
	 * Same as {@link #validated(Object, Validator)}, with a supplied {@link Validator}.
	 *
	 * @param value the value to emit
	 * @param validatorSupplier the {@link Supplier} of the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a new {@link Mono}
	 */
	public static <T> Mono<Optional<T>> validated(T value, Supplier<? extends Validator<? super T>> validatorSupplier) {
		return validated(value, supply(validatorSupplier));
	}

	/**
	 * Same as {@link #validated(Object, Validator)}, validating a {@link Validatable}
	 * value against its own rules.
	 *
	 * @param value the value to emit
	 * @param <T> the validated type
	 * @return a new {@link Mono}
	 */
	public static <T extends Validatable> Mono<Optional<T>> validated(T value) {
		return validated(value, Validators.<T>valid());
	}

	/**
	 * Same as {@link #validated(Object, Validator)}, with an ad-hoc validator rejecting
	 * the value if the closure returns {@code null}.
	 *
	 * @param value the value to emit
	 * @param name the name of the validator
	 * @param closure returns the value if it is valid, {@code null} otherwise
	 * @param <T> the validated type
	 * @return a new {@link Mono}
	 */
	public static <T> Mono<Optional<T>> validated(T value, String name, Function<? super T, ?> closure) {
		return validated(value, Validator.<T>returning(name, closure));
	}

	/**
	 * Create a {@link Mono} emitting the value if it is valid, or failing with a
	 * {@link ValidationException} otherwise. The value is validated immediately.
	 *
	 * @param value the value to emit
	 * @param validator the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a new {@link Mono}
	 */
	public static <T> Mono<T> tryValidated(T value, Validator<? super T> validator) {
		return MonoTryValidated.of(value, validator);
	}

	/**
	 * Same as {@link #tryValidated(Object, Validator)}, with a supplied {@link Validator}.
	 *
	 * @param value the value to emit
	 * @param validatorSupplier the {@link Supplier} of the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a new {@link Mono}
	 */
	public static <T> Mono<T> tryValidated(T value, Supplier<? extends Validator<? super T>> validatorSupplier) {
		return tryValidated(value, supply(validatorSupplier));
	}

	/**
	 * Same as {@link #tryValidated(Object, Validator)}, validating a {@link Validatable}
	 * value against its own rules.
	 *
	 * @param value the value to emit
	 * @param <T> the validated type
	 * @return a new {@link Mono}
	 */
	public static <T extends Validatable> Mono<T> tryValidated(T value) {
		return tryValidated(value, Validators.<T>valid());
	}

	/**
	 * Same as {@link #tryValidated(Object, Validator)}, with an ad-hoc validator
	 * rejecting the value if the rule throws.
	 *
	 * @param value the value to emit
	 * @param name the name of the validator
	 * @param rule throws to reject the value
	 * @param <T> the validated type
	 * @return a new {@link Mono}
	 */
	public static <T> Mono<T> tryValidated(T value, String name, Validator.Rule<? super T> rule) {
		return tryValidated(value, Validator.<T>named(name, rule));
	}

	/**
	 * Create a {@link PassthroughValidatedSink} dropping the values the validator rejects.
	 *
	 * @param validator the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a new {@link PassthroughValidatedSink}
	 */
	public static <T> PassthroughValidatedSink<T> sink(Validator<? super T> validator) {
		return new PassthroughValidatedSink<>(validator);
	}

	/**
	 * Create a {@link PassthroughValidatedSink} dropping the values the supplied
	 * validator rejects.
	 *
	 * @param validatorSupplier the {@link Supplier} of the {@link Validator} to apply
	 * @param <T> the validated type
	 * @return a new {@link PassthroughValidatedSink}
	 */
	public static <T> PassthroughValidatedSink<T> sink(Supplier<? extends Validator<? super T>> validatorSupplier) {
		return new PassthroughValidatedSink<T>(supply(validatorSupplier));
	}

	/**
	 * Create a {@link PassthroughValidatedSink} dropping the {@link Validatable} values
	 * that fail their own rules.
	 *
	 * @param <T> the validated type
	 * @return a new {@link PassthroughValidatedSink}
	 */
	public static <T extends Validatable> PassthroughValidatedSink<T> sink() {
		return new PassthroughValidatedSink<T>(Validators.<T>valid());
	}

	/**
	 * Create a {@link PassthroughValidatedSink} dropping the values for which the
	 * closure returns {@code null}.
	 *
	 * @param name the name of the validator
	 * @param closure returns the value if it is valid, {@code null} otherwise
	 * @param <T> the validated type
	 * @return a new {@link PassthroughValidatedSink}
	 */
	public static <T> PassthroughValidatedSink<T> sink(String name, Function<? super T, ?> closure) {
		return new PassthroughValidatedSink<T>(Validator.<T>returning(name, closure));
	}

	static <T> Validator<? super T> supply(Supplier<? extends Validator<? super T>> validatorSupplier) {
		return Objects.requireNonNull(Objects.requireNonNull(validatorSupplier, "validatorSupplier").get(),
				"The validatorSupplier returned a null Validator");
	}

	static void onRejected(Scannable source, ValidationOutcome<?> outcome) {
		if (LOG_REJECTIONS && log.isDebugEnabled() && outcome.error != null) {
			log.debug("{} rejected {}: {}", source.stepName(), outcome.value, outcome.error.getDescription());
		}
	}

	Validations() {
	}
}
