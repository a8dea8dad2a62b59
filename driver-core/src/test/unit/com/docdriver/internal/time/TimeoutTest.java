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

import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

import java.util.Collection;

import static java.util.Arrays.asList;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.DynamicTest.dynamicTest;

final class TimeoutTest {

    @TestFactory
    Collection<DynamicTest> timeoutTest() {
        return asList(
                dynamicTest("negative durations are infinite", () -> {
                    Timeout timeout = Timeout.startNow(-1, MILLISECONDS);
                    assertAll(
                            () -> assertTrue(timeout.isInfinite()),
                            () -> assertFalse(timeout.expired()),
                            () -> assertThrows(IllegalStateException.class, () -> timeout.remaining(MILLISECONDS))
                    );
                }),
                dynamicTest("zero durations are immediate", () -> {
                    Timeout timeout = Timeout.startNow(0, MILLISECONDS);
                    assertAll(
                            () -> assertTrue(timeout.isImmediate()),
                            () -> assertTrue(timeout.expired()),
                            () -> assertTrue(timeout.remaining(MILLISECONDS) == 0)
                    );
                }),
                dynamicTest("positive durations count down", () -> {
                    Timeout timeout = Timeout.startNow(1, SECONDS);
                    assertAll(
                            () -> assertFalse(timeout.expired()),
                            () -> assertTrue(timeout.remaining(MILLISECONDS) > 0),
                            () -> assertTrue(timeout.remaining(MILLISECONDS) <= 1000)
                    );
                }),
                dynamicTest("the duration is kept after expiry", () -> {
                    Timeout timeout = Timeout.startNow(1, MILLISECONDS);
                    Thread.sleep(10);
                    assertAll(
                            () -> assertEquals(1, timeout.getDuration(MILLISECONDS)),
                            () -> assertEquals(0, Timeout.immediate().getDuration(MILLISECONDS)),
                            () -> assertThrows(IllegalStateException.class, () -> Timeout.infinite().getDuration(MILLISECONDS))
                    );
                }),
                dynamicTest("short durations expire", () -> {
                    Timeout timeout = Timeout.startNow(1, MILLISECONDS);
                    Thread.sleep(10);
                    assertAll(
                            () -> assertTrue(timeout.expired()),
                            () -> assertTrue(timeout.remaining(MILLISECONDS) == 0)
                    );
                }),
                dynamicTest("earliest picks the first deadline", () -> {
                    Timeout shorter = Timeout.startNow(1, SECONDS);
                    Timeout longer = Timeout.startNow(60, SECONDS);
                    assertAll(
                            () -> assertSame(shorter, Timeout.earliest(shorter, longer)),
                            () -> assertSame(shorter, Timeout.earliest(longer, shorter)),
                            () -> assertSame(shorter, Timeout.earliest(Timeout.infinite(), shorter)),
                            () -> assertSame(shorter, Timeout.earliest(shorter, Timeout.infinite())),
                            () -> assertSame(Timeout.immediate(), Timeout.earliest(longer, Timeout.immediate())),
                            () -> assertSame(Timeout.immediate(), Timeout.earliest(Timeout.immediate(), longer))
                    );
                })
        );
    }
}
