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

import java.util.Optional;

/**
 * Stock {@link Validator validators}, meant to be combined with
 * {@link Validator#and(Validator)}, {@link Validator#or(Validator)} and
 * {@link Validator#not(Validator)}.
 */
public final class Validators {

	/**
	 * Accept empty character sequences.
	 *
	 * @return a new {@link Validator}
	 */
	public static Validator<CharSequence> empty() {
		return Validator.named("empty", value -> {
			if (value.length() != 0) {
				throw new ValidationException("is not empty");
			}
		});
	}

	/**
	 * Accept character sequences that have at least {@code min} characters.
	 *
	 * @param min the minimum length, inclusive
	 * @return a new {@link Validator}
	 */
	public static Validator<CharSequence> count(int min) {
		return count(min, Integer.MAX_VALUE);
	}

	/**
	 * Accept character sequences whose length is between {@code min} and {@code max},
	 * both inclusive.
	 *
	 * @param min the minimum length, inclusive
	 * @param max the maximum length, inclusive
	 * @return a new {@link Validator}
	 */
	public static Validator<CharSequence> count(int min, int max) {
		if (min < 0 || max < min) {
			throw new IllegalArgumentException("invalid length range [" + min + ", " + max + "]");
		}
		String name = max == Integer.MAX_VALUE ? "at least " + min + " characters" :
				"between " + min + " and " + max + " characters";
		return Validator.named(name, value -> {
			int length = value.length();
			if (length < min) {
				throw new ValidationException("is less than required minimum of " + min + " characters");
			}
			if (length > max) {
				throw new ValidationException("is greater than required maximum of " + max + " characters");
			}
		});
	}

	/**
	 * Accept {@link Optional} values that hold something.
	 *
	 * @return a new {@link Validator}
	 */
	public static Validator<Optional<?>> present() {
		return Validator.named("present", value -> {
			if (!value.isPresent()) {
				throw new ValidationException("is absent");
			}
		});
	}

	/**
	 * Accept empty {@link Optional} values.
	 *
	 * @return a new {@link Validator}
	 */
	public static Validator<Optional<?>> absent() {
		return Validator.named("absent", value -> {
			if (value.isPresent()) {
				throw new ValidationException("is present");
			}
		});
	}

	/**
	 * Accept {@link Validatable} values that pass their own rules.
	 *
	 * @param <T> the type of validated values
	 * @return a new {@link Validator}
	 */
	public static <T extends Validatable> Validator<T> valid() {
		return Validator.named("valid", Validatable::validate);
	}

	Validators() {
	}
}
