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
 * The failure raised by a {@link Validator} that rejects a value, and the single shape
 * every validation failure is normalized to before it reaches a subscriber.
 * <p>
 * Only the textual description is carried: when a foreign exception is normalized via
 * {@link #of(Throwable)}, its type, cause and stack trace are not retained.
 */
public class ValidationException extends RuntimeException {

	private static final long serialVersionUID = 3364823098418475893L;

	/**
	 * Create a {@link ValidationException} with the given description.
	 *
	 * @param description the human readable reason of the rejection
	 */
	public ValidationException(String description) {
		super(Objects.requireNonNull(description, "description"));
	}

	/**
	 * Return the human readable reason of the rejection.
	 *
	 * @return the description
	 */
	public String getDescription() {
		return getMessage();
	}

	/**
	 * Normalize any failure thrown by a validator into a new {@link ValidationException}.
	 * The description is the failure's message, or its simple class name if it has none.
	 *
	 * @param failure the failure to normalize
	 * @return a new {@link ValidationException} carrying only the description
	 */
	public static ValidationException of(Throwable failure) {
		String message = failure.getMessage();
		if (message == null || message.isEmpty()) {
			message = failure.getClass().getSimpleName();
		}
		return new ValidationException(message);
	}
}
