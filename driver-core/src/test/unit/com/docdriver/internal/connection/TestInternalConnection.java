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

import com.docdriver.MongoSocketOpenException;
import com.docdriver.connection.ConnectionDescription;
import com.docdriver.connection.ConnectionId;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerId;
import com.docdriver.connection.ServerType;
import org.bson.BsonDocument;
import org.bson.BsonInt32;

import java.util.ArrayList;
import java.util.List;

import static com.docdriver.internal.connection.ServerDescriptionHelper.unknownConnectingServerDescription;

class TestInternalConnection implements InternalConnection {
    private final ServerId serverId;
    private final int generation;
    private final ConnectionDescription description;
    private final List<BsonDocument> sentCommands = new ArrayList<BsonDocument>();
    private volatile RuntimeException openException;
    private volatile RuntimeException sendException;
    private volatile boolean opened;
    private volatile boolean closed;

    TestInternalConnection(final ServerId serverId, final int generation) {
        this.serverId = serverId;
        this.generation = generation;
        this.description = new ConnectionDescription(new ConnectionId(serverId), 17, ServerType.REPLICA_SET_PRIMARY,
                ServerDescription.getDefaultMaxDocumentSize(), ConnectionDescription.getDefaultMaxMessageSize(), null);
    }

    void failOpen() {
        openException = new MongoSocketOpenException("open failed", serverId.getAddress());
    }

    void failSend(final RuntimeException exception) {
        sendException = exception;
    }

    List<BsonDocument> getSentCommands() {
        synchronized (sentCommands) {
            return new ArrayList<BsonDocument>(sentCommands);
        }
    }

    @Override
    public ConnectionDescription getDescription() {
        return description;
    }

    @Override
    public ServerDescription getInitialServerDescription() {
        return unknownConnectingServerDescription(serverId.getAddress(), null);
    }

    @Override
    public void open() {
        if (openException != null) {
            closed = true;
            throw openException;
        }
        opened = true;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public boolean opened() {
        return opened;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public int getGeneration() {
        return generation;
    }

    @Override
    public BsonDocument sendAndReceive(final CommandMessage message, final int additionalTimeoutMillis) {
        synchronized (sentCommands) {
            sentCommands.add(message.getCommand());
        }
        if (sendException != null) {
            closed = true;
            throw sendException;
        }
        return new BsonDocument("ok", new BsonInt32(1));
    }
}
