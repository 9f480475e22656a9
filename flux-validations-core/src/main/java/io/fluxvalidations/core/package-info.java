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
 * The validator contract consumed by the validating operators: {@link io.fluxvalidations.core.Validator},
 * its stock rules in {@link io.fluxvalidations.core.Validators}, self-validating
 * {@link io.fluxvalidations.core.Validatable} values and the normalized
 * {@link io.fluxvalidations.core.ValidationException}.
 */
@NonNullApi
package io.fluxvalidations.core;

import reactor.util.annotation.NonNullApi;
