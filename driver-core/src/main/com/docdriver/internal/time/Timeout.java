/*
 * Copyright 2008-present MongoDB, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.docdriver.internal.time;

import com.docdriver.MongoInterruptedException;
import com.docdriver.annotations.Immutable;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;

import static com.docdriver.assertions.Assertions.isTrue;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * A deadline for a blocking call, measured with {@link System#nanoTime()}.  A timeout is either infinite, or finite with a start
 * time and a duration; a zero duration expires immediately.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
@Immutable
public final class Timeout {
    private static final Timeout INFINITE = new Timeout(-1, 0);
    private static final Timeout IMMEDIATE = new Timeout(0, 0);

    private final long durationNanos;
    private final long startNanos;

    private Timeout(final long durationNanos, final long startNanos) {
        this.durationNanos = durationNanos;
        this.startNanos = startNanos;
    }

    /**
     * Returns an infinite timeout, which never expires.
     *
     * @return an infinite timeout
     */
    public static Timeout infinite() {
        return INFINITE;
    }

    /**
     * Returns a timeout that has already expired.
     *
     * @return an immediate timeout
     */
    public static Timeout immediate() {
        return IMMEDIATE;
    }

    /**
     * Starts a timeout now.  A negative duration means the timeout is infinite; a zero duration means it is immediate.
     *
     * @param duration the duration
     * @param unit     the unit of the duration
     * @return the timeout
     */
    public static Timeout startNow(final long duration, final TimeUnit unit) {
        if (duration < 0) {
            return INFINITE;
        } else if (duration == 0) {
            return IMMEDIATE;
        }
        return new Timeout(NANOSECONDS.convert(duration, unit), System.nanoTime());
    }

    /**
     * Returns the earlier of two timeouts.  Both must have been started.
     *
     * @param first  the first timeout
     * @param second the second timeout
     * @return the timeout that expires first
     */
    public static Timeout earliest(final Timeout first, final Timeout second) {
        if (first.isInfinite() || second.isImmediate()) {
            return second;
        }
        if (second.isInfinite() || first.isImmediate()) {
            return first;
        }
        return first.deadlineNanos() - second.deadlineNanos() <= 0 ? first : second;
    }

    /**
     * Gets the full duration this timeout was started with.
     *
     * @param unit the unit to return the duration in
     * @return the duration
     * @throws IllegalStateException if the timeout is infinite
     */
    public long getDuration(final TimeUnit unit) {
        isTrue("timeout is finite", !isInfinite());
        return unit.convert(durationNanos, NANOSECONDS);
    }

    public boolean isInfinite() {
        return durationNanos < 0;
    }

    public boolean isImmediate() {
        return durationNanos == 0;
    }

    /**
     * Gets the remaining time, which is never negative.
     *
     * @param unit the unit to return the remaining time in
     * @return the remaining time, or 0 if expired
     * @throws IllegalStateException if the timeout is infinite
     */
    public long remaining(final TimeUnit unit) {
        isTrue("timeout is finite", !isInfinite());
        long remainingNanos = deadlineNanos() - System.nanoTime();
        return remainingNanos <= 0 ? 0 : unit.convert(remainingNanos, NANOSECONDS);
    }

    /**
     * @return true if the timeout is finite and its deadline has passed
     */
    public boolean expired() {
        if (isInfinite()) {
            return false;
        }
        return isImmediate() || deadlineNanos() - System.nanoTime() <= 0;
    }

    /**
     * Waits on the condition until signalled or until the timeout expires.  The lock guarding the condition must be held.
     *
     * @param condition the condition
     * @param action    a description of what is being waited for, used in the interruption message
     * @throws MongoInterruptedException if the waiting thread is interrupted
     */
    public void awaitOn(final Condition condition, final String action) {
        try {
            if (isInfinite()) {
                condition.await();
            } else {
                long remainingNanos = remaining(NANOSECONDS);
                if (remainingNanos > 0) {
                    condition.awaitNanos(remainingNanos);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MongoInterruptedException("Interrupted while " + action, e);
        }
    }

    private long deadlineNanos() {
        return startNanos + durationNanos;
    }

    @Override
    public String toString() {
        return "Timeout{"
               + "durationNanos=" + durationNanos
               + ", startNanos=" + startNanos
               + '}';
    }
}
