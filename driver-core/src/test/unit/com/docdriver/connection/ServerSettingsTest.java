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

import com.docdriver.ConnectionString;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ServerSettingsTest {

    @Test
    public void testDefaults() {
        ServerSettings settings = ServerSettings.builder().build();

        assertEquals(10, settings.getHeartbeatFrequency(SECONDS));
        assertEquals(500, settings.getMinHeartbeatFrequency(MILLISECONDS));
        assertEquals(ServerMonitoringMode.AUTO, settings.getServerMonitoringMode());
        assertTrue(settings.getServerListeners().isEmpty());
        assertTrue(settings.getServerMonitorListeners().isEmpty());
        assertEquals(1000, settings.getMaxDocumentLength());
    }

    @Test
    public void testConnectionString() {
        ServerSettings settings = ServerSettings.builder()
                .applyConnectionString(new ConnectionString("mongodb://host/?heartbeatFrequencyMS=2500&serverMonitoringMode=stream"))
                .build();

        assertEquals(2500, settings.getHeartbeatFrequency(MILLISECONDS));
        assertEquals(ServerMonitoringMode.STREAM, settings.getServerMonitoringMode());
    }

    @Test
    public void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> ServerSettings.builder().heartbeatFrequency(0, SECONDS));
        assertThrows(IllegalArgumentException.class, () -> ServerSettings.builder().minHeartbeatFrequency(0, SECONDS));
        assertThrows(IllegalArgumentException.class, () -> ServerMonitoringMode.fromString("push"));
        assertThrows(IllegalArgumentException.class, () -> ServerSettings.builder().maxDocumentLength(0));
    }

    @Test
    public void testMaxDocumentLengthIsCopied() {
        ServerSettings settings = ServerSettings.builder().maxDocumentLength(250).build();

        assertEquals(250, settings.getMaxDocumentLength());
        assertEquals(250, ServerSettings.builder(settings).build().getMaxDocumentLength());
        assertEquals(settings, ServerSettings.builder().applySettings(settings).build());
    }
}
