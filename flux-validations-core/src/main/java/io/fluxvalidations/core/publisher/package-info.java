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

/**
 * Validating operators for {@link reactor.core.publisher.Flux} and
 * {@link reactor.core.publisher.Mono}, entered through
 * {@link io.fluxvalidations.core.publisher.Validations}.
 *
 * <h2>Operators</h2>
 * {@code validate} turns rejected values into an empty {@link java.util.Optional},
 * {@code tryValidate} terminates with a {@link io.fluxvalidations.core.ValidationException}
 * and {@code compactValidate} drops them.
 *
 * <h2>Sources and sinks</h2>
 * {@code validated} and {@code tryValidated} build single-value sources, while
 * {@link io.fluxvalidations.core.publisher.PassthroughValidatedSink} drops invalid values
 * pushed into it.
 */
@NonNullApi
package io.fluxvalidations.core.publisher;

import reactor.util.annotation.NonNullApi;
