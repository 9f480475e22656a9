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

/**
 * Signals that a validation was attempted on a subscription that already terminated.
 * Never reaches a subscriber: operators turn it into a silent discard.
 */
final class AlreadyTerminatedException extends RuntimeException {

	private static final long serialVersionUID = -2619733584226357071L;

	static final AlreadyTerminatedException INSTANCE = new AlreadyTerminatedException();

	private AlreadyTerminatedException() {
		super("The validation subscription has already terminated", null, false, false);
	}
}
