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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.docdriver.MongoSocketReadException;
import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ClusterType;
import com.docdriver.connection.ConnectionId;
import com.docdriver.connection.ServerId;
import com.docdriver.event.ClusterDescriptionChangedEvent;
import com.docdriver.event.ClusterOpeningEvent;
import com.docdriver.event.ServerHeartbeatFailedEvent;
import com.docdriver.event.ServerHeartbeatStartedEvent;
import com.docdriver.event.ServerHeartbeatSucceededEvent;
import com.docdriver.event.ServerOpeningEvent;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SdamLoggingListenerTest {
    private static final String LOGGER_NAME = "com.docdriver.sdam";

    private final ClusterId clusterId = new ClusterId();
    private final ServerId serverId = new ServerId(clusterId, new ServerAddress("localhost", 27017));
    private final ConnectionId connectionId = new ConnectionId(serverId, 7, null);

    @Test
    public void shouldLogTopologyEvents() {
        SdamLoggingListener listener = new SdamLoggingListener(1000);
        ClusterDescription previous = new ClusterDescription(ClusterConnectionMode.MULTIPLE, ClusterType.UNKNOWN,
                Collections.emptyList());
        ClusterDescription current = new ClusterDescription(ClusterConnectionMode.MULTIPLE, ClusterType.REPLICA_SET_NO_PRIMARY,
                Collections.emptyList());

        try (CapturedLog log = CapturedLog.capture(LOGGER_NAME)) {
            listener.clusterOpening(new ClusterOpeningEvent(clusterId));
            listener.serverOpening(new ServerOpeningEvent(serverId));
            listener.clusterDescriptionChanged(new ClusterDescriptionChangedEvent(clusterId, current, previous));

            List<String> messages = log.getMessages();
            assertEquals(3, messages.size());
            assertEquals("Topology opening: topologyId=" + clusterId.getValue(), messages.get(0));
            assertEquals("Server opening: serverHost=localhost, serverPort=27017, topologyId=" + clusterId.getValue(), messages.get(1));
            assertEquals("Topology description changed: topologyId=" + clusterId.getValue()
                    + ", previousDescription=" + previous.getShortDescription()
                    + ", newDescription=" + current.getShortDescription(), messages.get(2));
        }
    }

    @Test
    public void shouldLogHeartbeats() {
        SdamLoggingListener listener = new SdamLoggingListener(1000);
        BsonDocument reply = new BsonDocument("ok", new BsonInt32(1));

        try (CapturedLog log = CapturedLog.capture(LOGGER_NAME)) {
            listener.serverHeartbeatStarted(new ServerHeartbeatStartedEvent(connectionId, true));
            listener.serverHeartbeatSucceeded(new ServerHeartbeatSucceededEvent(connectionId, reply,
                    MILLISECONDS.toNanos(12), true));
            listener.serverHeartbeatFailed(new ServerHeartbeatFailedEvent(connectionId, MILLISECONDS.toNanos(3), false,
                    new MongoSocketReadException("Prematurely reached end of stream", serverId.getAddress())));

            List<String> messages = log.getMessages();
            assertEquals(3, messages.size());
            assertEquals("Server heartbeat started: serverHost=localhost, serverPort=27017, driverConnectionId=7, awaited=true",
                    messages.get(0));
            assertEquals("Server heartbeat succeeded: serverHost=localhost, serverPort=27017, driverConnectionId=7, awaited=true, "
                    + "durationMS=12, reply=" + reply.toJson(), messages.get(1));
            assertTrue(messages.get(2).startsWith("Server heartbeat failed: serverHost=localhost, serverPort=27017, "
                    + "driverConnectionId=7, awaited=false, durationMS=3, failure="));
            assertTrue(messages.get(2).contains("Prematurely reached end of stream"));
        }
    }

    @Test
    public void shouldTruncateLongHeartbeatReplies() {
        SdamLoggingListener listener = new SdamLoggingListener(20);
        BsonDocument reply = new BsonDocument("hosts", new BsonString(repeat('x', 200)));

        try (CapturedLog log = CapturedLog.capture(LOGGER_NAME)) {
            listener.serverHeartbeatSucceeded(new ServerHeartbeatSucceededEvent(connectionId, reply, 0, false));

            String message = log.getMessages().get(0);
            String expectedReply = reply.toJson().substring(0, 20) + "...";
            assertTrue(message.endsWith("reply=" + expectedReply), message);
        }
    }

    @Test
    public void shouldNotLogWhenDebugIsDisabled() {
        SdamLoggingListener listener = new SdamLoggingListener(1000);
        try (CapturedLog log = CapturedLog.capture(LOGGER_NAME)) {
            ((Logger) LoggerFactory.getLogger(LOGGER_NAME)).setLevel(Level.INFO);
            listener.clusterOpening(new ClusterOpeningEvent(clusterId));
            assertTrue(log.getMessages().isEmpty());
        }
    }

    @Test
    public void shouldTruncateStrings() {
        String shortValue = "{\"ok\": 1}";
        assertSame(shortValue, SdamLoggingListener.truncate(shortValue, 1000));
        assertSame(shortValue, SdamLoggingListener.truncate(shortValue, shortValue.length()));
        assertEquals("{\"ok\"...", SdamLoggingListener.truncate(shortValue, 5));
    }

    @Test
    public void shouldNotSplitASurrogatePair() {
        String value = "ab\uD83D\uDE00cd";
        assertEquals("ab\uD83D\uDE00...", SdamLoggingListener.truncate(value, 3));
        assertEquals("ab...", SdamLoggingListener.truncate(value, 2));
    }

    @Test
    public void shouldRejectANonPositiveMaxDocumentLength() {
        assertThrows(IllegalArgumentException.class, () -> new SdamLoggingListener(0));
    }

    private static String repeat(final char c, final int count) {
        char[] chars = new char[count];
        Arrays.fill(chars, c);
        return new String(chars);
    }
}
