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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

public class ValidatorsTest {

	@Test
	public void empty() {
		assertThatCode(() -> Validators.empty().validate("")).doesNotThrowAnyException();
		assertThatExceptionOfType(ValidationException.class)
				.isThrownBy(() -> Validators.empty().validate("foo"))
				.withMessage("is not empty");
	}

	@Test
	public void countMinimum() {
		Validator<CharSequence> test = Validators.count(3);

		assertThatCode(() -> test.validate("foo")).doesNotThrowAnyException();
		assertThatCode(() -> test.validate(new StringBuilder("foo-bar"))).doesNotThrowAnyException();
		assertThatExceptionOfType(ValidationException.class)
				.isThrownBy(() -> test.validate("fo"))
				.withMessage("is less than required minimum of 3 characters");
	}

	@Test
	public void countRange() {
		Validator<CharSequence> test = Validators.count(2, 4);

		assertThatCode(() -> test.validate("fo")).doesNotThrowAnyException();
		assertThatCode(() -> test.validate("four")).doesNotThrowAnyException();
		assertThatExceptionOfType(ValidationException.class)
				.isThrownBy(() -> test.validate("f"))
				.withMessage("is less than required minimum of 2 characters");
		assertThatExceptionOfType(ValidationException.class)
				.isThrownBy(() -> test.validate("fives"))
				.withMessage("is greater than required maximum of 4 characters");
	}

	@Test
	public void countInvalidRange() {
		assertThatExceptionOfType(IllegalArgumentException.class)
				.isThrownBy(() -> Validators.count(-1))
				.withMessage("invalid length range [-1, 2147483647]");
		assertThatExceptionOfType(IllegalArgumentException.class)
				.isThrownBy(() -> Validators.count(4, 2));
	}

	@Test
	public void presentAndAbsent() {
		assertThatCode(() -> Validators.present().validate(Optional.of("foo"))).doesNotThrowAnyException();
		assertThatExceptionOfType(ValidationException.class)
				.isThrownBy(() -> Validators.present().validate(Optional.empty()))
				.withMessage("is absent");

		assertThatCode(() -> Validators.absent().validate(Optional.empty())).doesNotThrowAnyException();
		assertThatExceptionOfType(ValidationException.class)
				.isThrownBy(() -> Validators.absent().validate(Optional.of("foo")))
				.withMessage("is present");
	}

	@Test
	public void validUsesOwnRules() {
		Validatable valid = () -> { };
		Validatable invalid = () -> {
			throw new ValidationException("name is too short");
		};

		assertThatCode(() -> Validators.valid().validate(valid)).doesNotThrowAnyException();
		assertThatExceptionOfType(ValidationException.class)
				.isThrownBy(() -> Validators.valid().validate(invalid))
				.withMessage("name is too short");
	}
}
