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

import org.reactivestreams.Subscription;
import reactor.core.CoreSubscriber;
import reactor.core.Scannable;
import reactor.core.publisher.Operators;
import reactor.util.annotation.Nullable;
import reactor.util.context.Context;

/**
 * The {@link Subscription} of a single-value validated source: delivers the precomputed
 * result on the first positive request, then releases the subscriber.
 *
 * @param <O> the delivered type
 */
final class ValidatedSubscription<O> implements Subscription, Scannable {

	final Context ctx;

	@Nullable
	final O value;

	@Nullable
	final Throwable error;

	@Nullable
	CoreSubscriber<? super O> actual;

	boolean delivered;

	ValidatedSubscription(CoreSubscriber<? super O> actual, @Nullable O value,
			@Nullable Throwable error) {
		this.actual = actual;
		this.ctx = actual.currentContext();
		this.value = value;
		this.error = error;
	}

	@Override
	public void request(long n) {
		if (!Operators.validate(n)) {
			return;
		}
		CoreSubscriber<? super O> a = actual;
		if (a == null) {
			return;
		}
		actual = null;
		delivered = true;
		if (error != null) {
			a.onError(error);
			return;
		}
		if (value != null) {
			a.onNext(value);
		}
		a.onComplete();
	}

	@Override
	public void cancel() {
		if (actual != null && value != null) {
			Operators.onDiscard(value, ctx);
		}
		actual = null;
	}

	@Override
	@Nullable
	public Object scanUnsafe(Attr key) {
		if (key == Attr.ACTUAL) return actual;
		if (key == Attr.TERMINATED) return delivered;
		if (key == Attr.CANCELLED) return !delivered && actual == null;
		if (key == Attr.RUN_STYLE) return Attr.RunStyle.SYNC;

		return null;
	}
}
