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

/**
 * A {@link Validator} that owns its name and delegates to a {@link Validator.Rule}.
 *
 * @param <T> the type of validated values
 */
final class NamedValidator<T> implements Validator<T> {

	final String          name;
	final Rule<? super T> rule;

	NamedValidator(String name, Rule<? super T> rule) {
		this.name = Objects.requireNonNull(name, "name");
		this.rule = Objects.requireNonNull(rule, "rule");
	}

	@Override
	public void validate(T value) {
		try {
			rule.check(value);
		}
		catch (RuntimeException e) {
			throw e;
		}
		catch (Exception e) {
			throw ValidationException.of(e);
		}
	}

	@Override
	public String readable() {
		return name;
	}

	@Override
	public String toString() {
		return "Validator(" + name + ")";
	}
}
