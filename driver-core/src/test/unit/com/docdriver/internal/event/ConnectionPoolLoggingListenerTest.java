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


package com.docdriver.internal.event;

import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ConnectionId;
import com.docdriver.connection.ConnectionPoolSettings;
import com.docdriver.connection.ServerId;
import com.docdriver.event.ConnectionCheckOutFailedEvent;
import com.docdriver.event.ConnectionCheckedOutEvent;
import com.docdriver.event.ConnectionClosedEvent;
import com.docdriver.event.ConnectionPoolClearedEvent;
import com.docdriver.event.ConnectionPoolCreatedEvent;
import com.docdriver.event.ConnectionReadyEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ConnectionPoolLoggingListenerTest {
    private static final String LOGGER_NAME = "com.docdriver.connection";

    private final ServerId serverId = new ServerId(new ClusterId(), new ServerAddress("db1.example.com", 27018));
    private final ConnectionId connectionId = new ConnectionId(serverId, 3, null);
    private final ConnectionPoolLoggingListener listener = new ConnectionPoolLoggingListener();

    @Test
    public void shouldLogPoolLifecycle() {
        ConnectionPoolSettings settings = ConnectionPoolSettings.builder()
                .minSize(2)
                .maxSize(10)
                .maxConnectionIdleTime(30, SECONDS)
                .build();

        try (CapturedLog log = CapturedLog.capture(LOGGER_NAME)) {
            listener.connectionPoolCreated(new ConnectionPoolCreatedEvent(serverId, settings));
            listener.connectionPoolCleared(new ConnectionPoolClearedEvent(serverId));

            List<String> messages = log.getMessages();
            assertEquals(2, messages.size());
            assertEquals("Connection pool created: serverHost=db1.example.com, serverPort=27018, maxIdleTimeMS=30000, "
                    + "minPoolSize=2, maxPoolSize=10", messages.get(0));
            assertEquals("Connection pool cleared: serverHost=db1.example.com, serverPort=27018", messages.get(1));
        }
    }

    @Test
    public void shouldLogConnectionEventsWithTheirDriverConnectionId() {
        try (CapturedLog log = CapturedLog.capture(LOGGER_NAME)) {
            listener.connectionReady(new ConnectionReadyEvent(connectionId, MILLISECONDS.toNanos(4)));
            listener.connectionCheckedOut(new ConnectionCheckedOutEvent(connectionId, 42, MILLISECONDS.toNanos(1)));
            listener.connectionClosed(new ConnectionClosedEvent(connectionId, ConnectionClosedEvent.Reason.STALE));

            List<String> messages = log.getMessages();
            assertEquals("Connection ready: serverHost=db1.example.com, serverPort=27018, driverConnectionId=3, durationMS=4",
                    messages.get(0));
            assertEquals("Connection checked out: serverHost=db1.example.com, serverPort=27018, driverConnectionId=3, "
                    + "operationId=42, durationMS=1", messages.get(1));
            assertEquals("Connection closed: serverHost=db1.example.com, serverPort=27018, driverConnectionId=3, "
                    + "reason=Connection became stale because the pool was cleared", messages.get(2));
        }
    }

    @Test
    public void shouldLogTheReasonACheckOutFailed() {
        try (CapturedLog log = CapturedLog.capture(LOGGER_NAME)) {
            listener.connectionCheckOutFailed(new ConnectionCheckOutFailedEvent(serverId, 5,
                    ConnectionCheckOutFailedEvent.Reason.TIMEOUT, MILLISECONDS.toNanos(120)));

            assertEquals("Connection checkout failed: serverHost=db1.example.com, serverPort=27018, operationId=5, "
                    + "reason=Wait queue timeout elapsed without a connection becoming available, durationMS=120",
                    log.getMessages().get(0));
        }
    }

    @Test
    public void shouldDescribeEveryCheckOutFailureReason() {
        assertEquals("Connection pool was closed",
                ConnectionPoolLoggingListener.describe(ConnectionCheckOutFailedEvent.Reason.POOL_CLOSED));
        assertEquals("An error occurred while trying to establish a new connection",
                ConnectionPoolLoggingListener.describe(ConnectionCheckOutFailedEvent.Reason.CONNECTION_ERROR));
        assertEquals("Unknown error", ConnectionPoolLoggingListener.describe(ConnectionCheckOutFailedEvent.Reason.UNKNOWN));
    }
}
