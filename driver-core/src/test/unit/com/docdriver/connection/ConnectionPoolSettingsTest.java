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

package com.docdriver.connection;

import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConnectionPoolSettingsTest {

    @Test
    public void testDefaults() {
        ConnectionPoolSettings settings = ConnectionPoolSettings.builder().build();

        assertEquals(100, settings.getMaxSize());
        assertEquals(0, settings.getMinSize());
        assertEquals(2, settings.getMaxWaitTime(MINUTES));
        assertEquals(0, settings.getMaxConnectionIdleTime(MILLISECONDS));
        assertEquals(0, settings.getMaxConnectionLifeTime(MILLISECONDS));
        assertEquals(0, settings.getMaintenanceInitialDelay(MILLISECONDS));
        assertEquals(1, settings.getMaintenanceFrequency(MINUTES));
    }

    @Test
    public void testBuilderAndCopy() {
        ConnectionPoolSettings settings = ConnectionPoolSettings.builder()
                .maxSize(5)
                .minSize(2)
                .maxWaitTime(3, SECONDS)
                .maxConnectionIdleTime(4, SECONDS)
                .maxConnectionLifeTime(5, SECONDS)
                .maintenanceInitialDelay(6, SECONDS)
                .maintenanceFrequency(7, SECONDS)
                .build();

        assertEquals(5, settings.getMaxSize());
        assertEquals(2, settings.getMinSize());
        assertEquals(3000, settings.getMaxWaitTime(MILLISECONDS));
        assertEquals(4000, settings.getMaxConnectionIdleTime(MILLISECONDS));
        assertEquals(5000, settings.getMaxConnectionLifeTime(MILLISECONDS));
        assertEquals(6000, settings.getMaintenanceInitialDelay(MILLISECONDS));
        assertEquals(7000, settings.getMaintenanceFrequency(MILLISECONDS));
        assertEquals(settings, ConnectionPoolSettings.builder().applySettings(settings).build());
    }

    @Test
    public void testValidation() {
        assertThrows(IllegalStateException.class, () -> ConnectionPoolSettings.builder().maxSize(0).build());
        assertThrows(IllegalStateException.class, () -> ConnectionPoolSettings.builder().maxSize(1).minSize(2).build());
        assertThrows(IllegalStateException.class, () -> ConnectionPoolSettings.builder().minSize(-1).build());
        assertThrows(IllegalStateException.class, () -> ConnectionPoolSettings.builder().maintenanceFrequency(0, SECONDS).build());
        assertThrows(IllegalStateException.class, () -> ConnectionPoolSettings.builder().maxConnectionIdleTime(-1, SECONDS).build());
    }
}
