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

import com.docdriver.MongoException;
import com.docdriver.annotations.NotThreadSafe;
import com.docdriver.connection.ConnectionDescription;
import org.bson.BsonDocument;

import static com.docdriver.assertions.Assertions.isTrue;

@NotThreadSafe
class DefaultConnection implements Connection {
    private final InternalConnection wrapped;
    private final DefaultServer server;

    DefaultConnection(final InternalConnection wrapped, final DefaultServer server) {
        this.wrapped = wrapped;
        this.server = server;
    }

    @Override
    public ConnectionDescription getDescription() {
        return wrapped.getDescription();
    }

    @Override
    public BsonDocument command(final String database, final BsonDocument command) {
        isTrue("open", !wrapped.isClosed());
        try {
            return wrapped.sendAndReceive(new CommandMessage(database, command));
        } catch (MongoException e) {
            server.getSdamServerDescriptionManager().handleException(e, wrapped.getGeneration(), false);
            throw e;
        }
    }

    @Override
    public void release() {
        server.checkIn(this, ConnectionOutcome.HEALTHY);
    }

    int getGeneration() {
        return wrapped.getGeneration();
    }

    DefaultServer getServer() {
        return server;
    }

    void checkIn() {
        wrapped.close();
    }
}
