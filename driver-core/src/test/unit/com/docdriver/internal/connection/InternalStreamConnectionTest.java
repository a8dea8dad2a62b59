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

import com.docdriver.MongoCommandException;
import com.docdriver.MongoSocketClosedException;
import com.docdriver.MongoSocketOpenException;
import com.docdriver.MongoSocketReadException;
import com.docdriver.MongoSocketReadTimeoutException;
import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ServerId;
import com.docdriver.connection.ServerType;
import com.docdriver.connection.SocketSettings;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InternalStreamConnectionTest {
    private static final String HELLO_REPLY = "{ok: 1, isWritablePrimary: true, setName: 'rs0', hosts: ['localhost:27017'],"
            + " maxWireVersion: 17, maxMessageSizeBytes: 48000000, connectionId: 7}";

    private TestMongoServer server;
    private InternalStreamConnection connection;

    @AfterEach
    public void tearDown() throws IOException {
        if (connection != null) {
            connection.close();
        }
        if (server != null) {
            server.close();
        }
    }

    @Test
    public void shouldRunTheHandshakeWhenOpened() throws IOException {
        server = new TestMongoServer(command -> command.containsKey("hello") ? BsonDocument.parse(HELLO_REPLY) : ok());
        connection = createConnection(ClusterConnectionMode.MULTIPLE, defaultSocketSettings());

        connection.open();

        assertTrue(connection.opened());
        assertEquals(ServerType.REPLICA_SET_PRIMARY, connection.getDescription().getServerType());
        assertEquals(17, connection.getDescription().getMaxWireVersion());
        assertEquals(Long.valueOf(7), connection.getDescription().getConnectionId().getServerValue());
        assertEquals(ServerType.REPLICA_SET_PRIMARY, connection.getInitialServerDescription().getType());
        assertEquals("rs0", connection.getInitialServerDescription().getSetName());

        BsonDocument hello = server.getReceivedCommands().get(0);
        assertEquals("admin", hello.getString("$db").getValue());
        assertTrue(hello.getBoolean("helloOk").getValue());
        assertEquals("docdriver", hello.getDocument("client").getDocument("driver").getString("name").getValue());
        assertEquals("myApp", hello.getDocument("client").getDocument("application").getString("name").getValue());
        assertFalse(hello.containsKey("loadBalanced"));
    }

    @Test
    public void shouldAnnounceLoadBalancedModeInTheHandshake() throws IOException {
        server = new TestMongoServer(command -> BsonDocument.parse(
                "{ok: 1, isWritablePrimary: true, msg: 'isdbgrid', serviceId: {$oid: '000000000000000000000001'}, maxWireVersion: 17}"));
        connection = createConnection(ClusterConnectionMode.LOAD_BALANCED, defaultSocketSettings());

        connection.open();

        assertTrue(server.getReceivedCommands().get(0).getBoolean("loadBalanced").getValue());
    }

    @Test
    public void shouldSendCommandsAndReceiveReplies() throws IOException {
        server = new TestMongoServer(command -> command.containsKey("hello") ? BsonDocument.parse(HELLO_REPLY)
                : ok().append("echo", command.get("ping")));
        connection = createConnection(ClusterConnectionMode.MULTIPLE, defaultSocketSettings());
        connection.open();

        BsonDocument reply = connection.sendAndReceive(new CommandMessage("test", new BsonDocument("ping", new BsonInt32(5))));

        assertEquals(new BsonInt32(5), reply.get("echo"));
        assertEquals("test", server.getReceivedCommands().get(1).getString("$db").getValue());
    }

    @Test
    public void shouldThrowACommandExceptionForAFailedCommandAndStayOpen() throws IOException {
        server = new TestMongoServer(command -> command.containsKey("hello") ? BsonDocument.parse(HELLO_REPLY)
                : BsonDocument.parse("{ok: 0, code: 59, errmsg: 'no such command'}"));
        connection = createConnection(ClusterConnectionMode.MULTIPLE, defaultSocketSettings());
        connection.open();

        MongoCommandException e = assertThrows(MongoCommandException.class,
                () -> connection.sendAndReceive(new CommandMessage("admin", new BsonDocument("unknown", new BsonInt32(1)))));

        assertEquals(59, e.getErrorCode());
        assertFalse(connection.isClosed());
    }

    @Test
    public void shouldCloseTheConnectionWhenTheServerHangsUp() throws IOException {
        server = new TestMongoServer(command -> command.containsKey("hello") ? BsonDocument.parse(HELLO_REPLY) : null);
        connection = createConnection(ClusterConnectionMode.MULTIPLE, defaultSocketSettings());
        connection.open();

        assertThrows(MongoSocketReadException.class,
                () -> connection.sendAndReceive(new CommandMessage("admin", new BsonDocument("ping", new BsonInt32(1)))));

        assertTrue(connection.isClosed());
        assertThrows(MongoSocketClosedException.class,
                () -> connection.sendAndReceive(new CommandMessage("admin", new BsonDocument("ping", new BsonInt32(1)))));
    }

    @Test
    public void shouldTranslateAReadTimeout() throws IOException {
        server = new TestMongoServer(command -> {
            if (!command.containsKey("hello")) {
                sleep(2000);
            }
            return BsonDocument.parse(HELLO_REPLY);
        });
        connection = createConnection(ClusterConnectionMode.MULTIPLE, SocketSettings.builder()
                .connectTimeout(1, SECONDS)
                .readTimeout(100, MILLISECONDS)
                .build());
        connection.open();

        assertThrows(MongoSocketReadTimeoutException.class,
                () -> connection.sendAndReceive(new CommandMessage("admin", new BsonDocument("ping", new BsonInt32(1)))));
        assertTrue(connection.isClosed());
    }

    @Test
    public void shouldFailToOpenWhenNothingIsListening() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        connection = new InternalStreamConnection(new ServerId(new ClusterId(), new ServerAddress("127.0.0.1", port)),
                new SocketStreamFactory(defaultSocketSettings()), new InternalConnectionInitializer(ClusterConnectionMode.MULTIPLE, null),
                0);

        assertThrows(MongoSocketOpenException.class, () -> connection.open());
        assertTrue(connection.isClosed());
        assertFalse(connection.opened());
    }

    private InternalStreamConnection createConnection(final ClusterConnectionMode mode, final SocketSettings socketSettings) {
        return new InternalStreamConnection(new ServerId(new ClusterId(), server.getAddress()), new SocketStreamFactory(socketSettings),
                new InternalConnectionInitializer(mode, "myApp"), 0);
    }

    private static SocketSettings defaultSocketSettings() {
        return SocketSettings.builder()
                .connectTimeout(1, SECONDS)
                .readTimeout(5, SECONDS)
                .build();
    }

    private static BsonDocument ok() {
        return new BsonDocument("ok", new BsonInt32(1));
    }

    private static void sleep(final long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
