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

package com.docdriver.internal.connection;

import com.docdriver.MongoConnectionPoolTimeoutException;
import com.docdriver.MongoSocketOpenException;
import com.docdriver.MongoSocketReadException;
import com.docdriver.MongoSocketReadTimeoutException;
import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ConnectionDescription;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerId;
import com.docdriver.connection.ServerType;
import com.docdriver.connection.TopologyVersion;
import com.docdriver.event.ServerClosedEvent;
import com.docdriver.event.ServerDescriptionChangedEvent;
import com.docdriver.event.ServerListener;
import com.docdriver.event.ServerOpeningEvent;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static com.docdriver.connection.ServerConnectionState.CONNECTED;
import static com.docdriver.internal.connection.ServerDescriptionHelper.unknownConnectingServerDescription;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class DefaultServerTest {
    private final ServerId serverId = new ServerId(new ClusterId(), new ServerAddress("localhost:27017"));

    @Mock
    private ConnectionPool connectionPool;
    @Mock
    private ServerMonitor serverMonitor;
    @Mock
    private ServerListener serverListener;
    @Mock
    private Cluster cluster;
    @Mock
    private InternalConnection internalConnection;

    private DefaultServer server;

    @BeforeEach
    public void setUp() {
        when(connectionPool.getGeneration()).thenReturn(0);
        when(internalConnection.getGeneration()).thenReturn(0);
        when(internalConnection.getDescription()).thenReturn(new ConnectionDescription(serverId));
        when(connectionPool.get(any(OperationContext.class))).thenReturn(internalConnection);
    }

    private DefaultServer createServer(final ClusterConnectionMode mode) {
        server = new DefaultServer(serverId, mode, connectionPool, sdamServerDescriptionManager -> serverMonitor, serverListener,
                cluster);
        return server;
    }

    @Test
    public void shouldStartTheMonitorAndAnnounceTheServer() {
        createServer(ClusterConnectionMode.MULTIPLE);

        verify(serverMonitor).start();
        verify(serverListener).serverOpening(any(ServerOpeningEvent.class));
        assertEquals(ServerType.UNKNOWN, server.getDescription().getType());
    }

    @Test
    public void shouldMarkThePoolReadyAndNotifyTheClusterOnASuccessfulCheck() {
        createServer(ClusterConnectionMode.MULTIPLE);
        ServerDescription primary = primary(null);

        server.getSdamServerDescriptionManager().monitorUpdate(primary);

        ArgumentCaptor<ServerDescriptionChangedEvent> captor = ArgumentCaptor.forClass(ServerDescriptionChangedEvent.class);
        verify(connectionPool).ready();
        verify(cluster).onChange(captor.capture());
        verify(serverListener).serverDescriptionChanged(any(ServerDescriptionChangedEvent.class));
        assertSame(primary, captor.getValue().getNewDescription());
        assertSame(primary, server.getDescription());
    }

    @Test
    public void shouldClearThePoolWhenACheckFails() {
        createServer(ClusterConnectionMode.MULTIPLE);
        MongoSocketOpenException exception = new MongoSocketOpenException("unreachable", serverId.getAddress());

        server.getSdamServerDescriptionManager().monitorUpdate(unknownConnectingServerDescription(serverId.getAddress(), exception));

        verify(connectionPool).invalidate(exception);
        verify(connectionPool, never()).ready();
    }

    @Test
    public void shouldNotClearThePoolOnAFailedCheckInLoadBalancedMode() {
        createServer(ClusterConnectionMode.LOAD_BALANCED);

        server.getSdamServerDescriptionManager().monitorUpdate(unknownConnectingServerDescription(serverId.getAddress(),
                new MongoSocketOpenException("unreachable", serverId.getAddress())));

        verify(connectionPool, never()).invalidate(any());
    }

    @Test
    public void shouldIgnoreAStaleMonitorUpdate() {
        createServer(ClusterConnectionMode.MULTIPLE);
        ObjectId processId = new ObjectId();
        server.getSdamServerDescriptionManager().monitorUpdate(primary(new TopologyVersion(processId, 2)));

        server.getSdamServerDescriptionManager().monitorUpdate(primary(new TopologyVersion(processId, 2)));
        server.getSdamServerDescriptionManager().monitorUpdate(primary(new TopologyVersion(processId, 1)));

        verify(cluster, times(1)).onChange(any(ServerDescriptionChangedEvent.class));
    }

    @Test
    public void shouldHandleANetworkErrorWhileOpeningAConnection() {
        createServer(ClusterConnectionMode.MULTIPLE);
        MongoSocketOpenException exception = new MongoSocketOpenException("unreachable", serverId.getAddress());
        when(connectionPool.get(any(OperationContext.class))).thenThrow(exception);

        assertThrows(MongoSocketOpenException.class, () -> server.getConnection(new OperationContext()));

        verify(connectionPool).invalidate(exception);
        verify(serverMonitor).cancelCurrentCheck();
        verify(serverMonitor).connect();
        assertEquals(ServerType.UNKNOWN, server.getDescription().getType());
        assertSame(exception, server.getDescription().getException());
    }

    @Test
    public void shouldNotClearThePoolForAPoolTimeout() {
        createServer(ClusterConnectionMode.MULTIPLE);
        when(connectionPool.get(any(OperationContext.class)))
                .thenThrow(new MongoConnectionPoolTimeoutException("timed out", serverId.getAddress()));

        assertThrows(MongoConnectionPoolTimeoutException.class, () -> server.getConnection(new OperationContext()));

        verify(connectionPool, never()).invalidate(any());
    }

    @Test
    public void shouldClearThePoolWhenACommandFailsWithANetworkError() {
        createServer(ClusterConnectionMode.MULTIPLE);
        MongoSocketReadException exception = new MongoSocketReadException("reset", serverId.getAddress());
        when(internalConnection.sendAndReceive(any(CommandMessage.class))).thenThrow(exception);

        Connection connection = server.getConnection(new OperationContext());
        assertThrows(MongoSocketReadException.class, () -> connection.command("admin", new BsonDocument("ping", new BsonInt32(1))));

        verify(connectionPool).invalidate(exception);
        verify(serverMonitor).connect();
    }

    @Test
    public void shouldNotClearThePoolForAReadTimeoutAfterTheHandshake() {
        createServer(ClusterConnectionMode.MULTIPLE);
        when(internalConnection.sendAndReceive(any(CommandMessage.class)))
                .thenThrow(new MongoSocketReadTimeoutException("timed out", serverId.getAddress(), new RuntimeException()));

        Connection connection = server.getConnection(new OperationContext());
        assertThrows(MongoSocketReadTimeoutException.class,
                () -> connection.command("admin", new BsonDocument("ping", new BsonInt32(1))));

        verify(connectionPool, never()).invalidate(any());
    }

    @Test
    public void shouldIgnoreANetworkErrorFromAnOlderGeneration() {
        createServer(ClusterConnectionMode.MULTIPLE);
        Connection connection = server.getConnection(new OperationContext());
        when(connectionPool.getGeneration()).thenReturn(1);

        server.checkIn(connection, ConnectionOutcome.NETWORK_ERROR);

        verify(connectionPool, never()).invalidate(any());
        verify(internalConnection).close();
    }

    @Test
    public void shouldClearThePoolWhenANetworkErrorIsReportedOnCheckIn() {
        createServer(ClusterConnectionMode.MULTIPLE);
        Connection connection = server.getConnection(new OperationContext());

        server.checkIn(connection, ConnectionOutcome.NETWORK_ERROR);

        verify(connectionPool).invalidate(any());
        verify(internalConnection).close();
    }

    @Test
    public void shouldReturnAHealthyConnectionToThePool() {
        createServer(ClusterConnectionMode.MULTIPLE);
        Connection connection = server.getConnection(new OperationContext());

        connection.release();

        verify(connectionPool, never()).invalidate(any());
        verify(internalConnection).close();
    }

    @Test
    public void shouldCloseThePoolAndMonitor() {
        createServer(ClusterConnectionMode.MULTIPLE);

        server.close();
        server.close();

        verify(connectionPool, times(1)).close();
        verify(serverMonitor, times(1)).close();
        verify(serverListener, times(1)).serverClosed(any(ServerClosedEvent.class));
        assertThrows(IllegalStateException.class, () -> server.getDescription());
    }

    private ServerDescription primary(final TopologyVersion topologyVersion) {
        return ServerDescription.builder()
                .address(serverId.getAddress())
                .state(CONNECTED)
                .ok(true)
                .type(ServerType.REPLICA_SET_PRIMARY)
                .setName("rs0")
                .maxWireVersion(17)
                .topologyVersion(topologyVersion)
                .build();
    }
}
