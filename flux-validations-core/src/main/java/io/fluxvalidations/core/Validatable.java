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

/**
 * A value that carries its own validation rules. Operators and sources that are not given
 * an explicit {@link Validator} use {@link Validators#valid()} for such values.
 */
public interface Validatable {

	/**
	 * Check this value against its own rules.
	 *
	 * @throws ValidationException if this value is not valid
	 */
	void validate();
}
