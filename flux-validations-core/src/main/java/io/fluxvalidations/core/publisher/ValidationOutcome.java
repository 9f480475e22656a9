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

import java.util.Optional;

import io.fluxvalidations.core.ValidationException;
import io.fluxvalidations.core.Validator;
import reactor.core.Exceptions;
import reactor.util.annotation.Nullable;

/**
 * The result of running a {@link Validator} against one value: either accepted, or
 * rejected with a normalized {@link ValidationException}.
 *
 * @param <T> the validated type
 */
final class ValidationOutcome<T> {

	/**
	 * Run the validator against the value. Any failure it throws, JVM fatal errors
	 * excepted, is turned into a rejection.
	 *
	 * @param validator the {@link Validator} to run
	 * @param value the value to validate
	 * @param <T> the validated type
	 * @return the outcome of the validation
	 */
	static <T> ValidationOutcome<T> of(Validator<? super T> validator, T value) {
		try {
			validator.validate(value);
		}
		catch (Throwable e) {
			Exceptions.throwIfJvmFatal(e);
			return new ValidationOutcome<>(value, ValidationException.of(e));
		}
		return new ValidationOutcome<>(value, null);
	}

	/**
	 * Return true if the value is an empty {@link Optional}, which validating operators
	 * treat as "nothing to forward".
	 */
	static boolean isAbsent(Object value) {
		return value instanceof Optional && !((Optional<?>) value).isPresent();
	}

	final T value;

	@Nullable
	final ValidationException error;

	ValidationOutcome(T value, @Nullable ValidationException error) {
		this.value = value;
		this.error = error;
	}

	boolean isAccepted() {
		return error == null;
	}

	@Override
	public String toString() {
		return error == null ? "Accepted(" + value + ")" : "Rejected(" + error.getDescription() + ")";
	}
}
