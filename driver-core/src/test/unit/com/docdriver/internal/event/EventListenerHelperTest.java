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
import com.docdriver.connection.ServerId;
import com.docdriver.event.ClusterEventMulticaster;
import com.docdriver.event.ClusterListener;
import com.docdriver.event.ClusterOpeningEvent;
import com.docdriver.event.ConnectionPoolClosedEvent;
import com.docdriver.event.ConnectionPoolListener;
import com.docdriver.event.ServerEventMulticaster;
import com.docdriver.event.ServerListener;
import com.docdriver.event.ServerMonitorEventMulticaster;
import com.docdriver.event.ServerMonitorListener;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.docdriver.internal.event.EventListenerHelper.clusterListener;
import static com.docdriver.internal.event.EventListenerHelper.connectionPoolListener;
import static com.docdriver.internal.event.EventListenerHelper.serverListener;
import static com.docdriver.internal.event.EventListenerHelper.serverMonitorListener;
import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EventListenerHelperTest {
    private final ClusterId clusterId = new ClusterId();

    @Test
    public void shouldInstallTheLoggingListenersWhenNoneAreRegistered() {
        assertTrue(clusterListener(Collections.emptyList(), 1000) instanceof SdamLoggingListener);
        assertTrue(serverListener(Collections.emptyList(), 1000) instanceof SdamLoggingListener);
        assertTrue(serverMonitorListener(Collections.emptyList(), 1000) instanceof SdamLoggingListener);
        assertTrue(connectionPoolListener(Collections.emptyList()) instanceof ConnectionPoolLoggingListener);
    }

    @Test
    public void shouldPutTheLoggingListenerAheadOfRegisteredListeners() {
        ClusterListener first = new ClusterListener() { };
        ClusterListener second = new ClusterListener() { };

        ClusterListener listener = clusterListener(asList(first, second), 1000);

        List<ClusterListener> listeners = ((ClusterEventMulticaster) listener).getClusterListeners();
        assertEquals(3, listeners.size());
        assertTrue(listeners.get(0) instanceof SdamLoggingListener);
        assertSame(first, listeners.get(1));
        assertSame(second, listeners.get(2));
    }

    @Test
    public void shouldLogAndNotifyEvenWhenARegisteredListenerThrows() {
        List<ClusterOpeningEvent> received = new ArrayList<>();
        ClusterListener throwing = new ClusterListener() {
            @Override
            public void clusterOpening(final ClusterOpeningEvent event) {
                throw new IllegalStateException("listener failure");
            }
        };
        ClusterListener recording = new ClusterListener() {
            @Override
            public void clusterOpening(final ClusterOpeningEvent event) {
                received.add(event);
            }
        };
        ClusterListener listener = clusterListener(asList(throwing, recording), 1000);
        ClusterOpeningEvent event = new ClusterOpeningEvent(clusterId);

        try (CapturedLog log = CapturedLog.capture("com.docdriver.sdam")) {
            listener.clusterOpening(event);

            assertEquals(Collections.singletonList("Topology opening: topologyId=" + clusterId.getValue()), log.getMessages());
            assertEquals(Collections.singletonList(event), received);
        }
    }

    @Test
    public void shouldLogPoolEventsAlongsideRegisteredListeners() {
        List<Object> received = new ArrayList<>();
        ConnectionPoolListener recording = new ConnectionPoolListener() {
            @Override
            public void connectionPoolClosed(final ConnectionPoolClosedEvent event) {
                received.add(event);
            }
        };
        ConnectionPoolListener listener = connectionPoolListener(Collections.singletonList(recording));

        try (CapturedLog log = CapturedLog.capture("com.docdriver.connection")) {
            listener.connectionPoolClosed(new ConnectionPoolClosedEvent(new ServerId(clusterId, new ServerAddress())));

            assertEquals(1, received.size());
            assertEquals(1, log.getMessagesStartingWith("Connection pool closed:").size());
        }
    }

    @Test
    public void shouldCombineServerAndMonitorListenersTheSameWay() {
        ServerListener server = new ServerListener() { };
        ServerMonitorListener monitor = new ServerMonitorListener() { };

        assertTrue(serverListener(Collections.singletonList(server), 1000) instanceof ServerEventMulticaster);
        assertTrue(serverMonitorListener(Collections.singletonList(monitor), 1000) instanceof ServerMonitorEventMulticaster);
    }
}
