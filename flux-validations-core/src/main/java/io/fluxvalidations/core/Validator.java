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

package io.fluxvalidations.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * A check that either accepts a value, by returning normally, or rejects it by throwing.
 * Rejections are conventionally signalled with a {@link ValidationException}, but any
 * {@link RuntimeException} is treated as one by the validating operators.
 * <p>
 * Validators are immutable and can be combined with {@link #and(Validator)},
 * {@link #or(Validator)} and {@link #not(Validator)}:
 * <pre>
 * {@code
 * Validator<CharSequence> v = Validator.not(Validators.empty()).and(Validators.count(3));
 * }
 * </pre>
 *
 * @param <T> the type of validated values
 */
@FunctionalInterface
public interface Validator<T> {

	/**
	 * Check the given value, returning normally if it is accepted.
	 *
	 * @param value the value to check
	 * @throws ValidationException if the value is rejected
	 */
	void validate(T value);

	/**
	 * A short human readable name for what this validator accepts, used to build the
	 * description of composed validators.
	 *
	 * @return the name of this validator
	 */
	default String readable() {
		return "valid";
	}

	/**
	 * Compose this validator with another one, accepting only values accepted by both.
	 * The first rejection wins.
	 *
	 * @param other the other {@link Validator}
	 * @return a new composed {@link Validator}
	 */
	default Validator<T> and(Validator<? super T> other) {
		Objects.requireNonNull(other, "other");
		return new NamedValidator<>(readable() + " and " + other.readable(), value -> {
			validate(value);
			other.validate(value);
		});
	}

	/**
	 * Compose this validator with another one, accepting values accepted by either.
	 * When both reject, the descriptions of both rejections are reported.
	 *
	 * @param other the other {@link Validator}
	 * @return a new composed {@link Validator}
	 */
	default Validator<T> or(Validator<? super T> other) {
		Objects.requireNonNull(other, "other");
		return new NamedValidator<>(readable() + " or " + other.readable(), value -> {
			try {
				validate(value);
			}
			catch (RuntimeException left) {
				try {
					other.validate(value);
				}
				catch (RuntimeException right) {
					throw new ValidationException(ValidationException.of(left).getDescription()
							+ " and " + ValidationException.of(right).getDescription());
				}
			}
		});
	}

	/**
	 * Invert a validator: the returned validator rejects what {@code validator} accepts
	 * and accepts what it rejects.
	 *
	 * @param validator the {@link Validator} to invert
	 * @param <T> the type of validated values
	 * @return a new inverted {@link Validator}
	 */
	static <T> Validator<T> not(Validator<T> validator) {
		Objects.requireNonNull(validator, "validator");
		return new NamedValidator<>("not " + validator.readable(), value -> {
			boolean accepted;
			try {
				validator.validate(value);
				accepted = true;
			}
			catch (RuntimeException e) {
				accepted = false;
			}
			if (accepted) {
				throw new ValidationException("is " + validator.readable());
			}
		});
	}

	/**
	 * Build an ad-hoc validator out of a throwing {@link Rule}. Any exception thrown by
	 * the rule is a rejection; checked exceptions are normalized into a
	 * {@link ValidationException}.
	 *
	 * @param name the name of the validator
	 * @param rule the rule to apply
	 * @param <T> the type of validated values
	 * @return a new named {@link Validator}
	 */
	static <T> Validator<T> named(String name, Rule<? super T> rule) {
		return new NamedValidator<>(name, rule);
	}

	/**
	 * Build an ad-hoc validator out of a function that returns the value when it is
	 * valid, or {@code null} when it is not. A {@code null} result is rejected with the
	 * description {@code "<name> invalid."}.
	 *
	 * @param name the name of the validator
	 * @param closure the function returning the value or {@code null}
	 * @param <T> the type of validated values
	 * @return a new named {@link Validator}
	 */
	static <T> Validator<T> returning(String name, Function<? super T, ?> closure) {
		Objects.requireNonNull(closure, "closure");
		return new NamedValidator<>(name, value -> {
			if (closure.apply(value) == null) {
				throw new ValidationException(name + " invalid.");
			}
		});
	}

	/**
	 * A check that may throw any exception to reject a value.
	 *
	 * @param <T> the type of checked values
	 */
	@FunctionalInterface
	interface Rule<T> {

		/**
		 * Check the value, returning normally if it is accepted.
		 *
		 * @param value the value to check
		 * @throws Exception to reject the value
		 */
		void check(T value) throws Exception;
	}
}
