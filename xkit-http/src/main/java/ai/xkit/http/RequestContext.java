/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.xkit.http;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Request-scoped cancellation signal. A context is cancelled either explicitly through {@link
 * #cancel()} or when its deadline, if any, passes. Components waiting on behalf of a request use
 * {@link #awaitCancellation(Duration)} to stop early.
 *
 * <p>Thread safe: a context is typically cancelled from another thread than the one executing the
 * request.
 */
public final class RequestContext {

    private static final RequestContext BACKGROUND = new RequestContext(false, Long.MAX_VALUE);

    private final boolean cancellable;
    private final long deadlineNanos;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    private RequestContext(boolean cancellable, long deadlineNanos) {
        this.cancellable = cancellable;
        this.deadlineNanos = deadlineNanos;
    }

    /** A context that is never cancelled. */
    public static RequestContext background() {
        return BACKGROUND;
    }

    /** A context cancelled only through {@link #cancel()}. */
    public static RequestContext cancellable() {
        return new RequestContext(true, Long.MAX_VALUE);
    }

    /** A context cancelled through {@link #cancel()} or once the timeout elapses. */
    public static RequestContext withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("invalid timeout: " + timeout);
        }
        long now = System.nanoTime();
        long deadline = now + toNanos(timeout);
        if (deadline < now || deadline == Long.MAX_VALUE) {
            // overflowed, too far away to ever be reached
            return cancellable();
        }
        return new RequestContext(true, deadline);
    }

    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("background context cannot be cancelled");
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || deadlineReached();
    }

    /**
     * Waits until the context is cancelled or the timeout elapses, whichever comes first.
     *
     * @return true if the context got cancelled, false if the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        if (isCancelled()) {
            return true;
        }
        long waitNanos = Math.max(0, toNanos(timeout));
        if (deadlineNanos != Long.MAX_VALUE) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= waitNanos) {
                cancelled.await(Math.max(0, remaining), TimeUnit.NANOSECONDS);
                return true;
            }
        }
        return cancelled.await(waitNanos, TimeUnit.NANOSECONDS);
    }

    private boolean deadlineReached() {
        return deadlineNanos != Long.MAX_VALUE && deadlineNanos - System.nanoTime() <= 0;
    }

    // saturates instead of overflowing for durations above ~292 years
    private static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException overflow) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "RequestContext{background}";
        }
        return "RequestContext{cancelled=" + isCancelled() + '}';
    }
}
