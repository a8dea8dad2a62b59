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

import com.docdriver.connection.ConnectionDescription;
import com.docdriver.connection.ServerDescription;
import org.bson.BsonDocument;

/**
 * A physical connection to a server, before it is wrapped for use by the pool or the monitor.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public interface InternalConnection {

    /**
     * Gets the description of the connection.
     *
     * @return the connection description
     */
    ConnectionDescription getDescription();

    /**
     * Get the initial server description, as reported by the handshake.
     *
     * @return the initial server description
     */
    ServerDescription getInitialServerDescription();

    /**
     * Opens the connection and runs the handshake.
     */
    void open();

    /**
     * Closes the connection.
     */
    void close();

    /**
     * Returns if the connection has been opened
     *
     * @return true if connection has been opened
     */
    boolean opened();

    /**
     * Returns the closed state of the connection
     *
     * @return true if connection is closed
     */
    boolean isClosed();

    /**
     * The pool generation this connection was created under.
     *
     * @return the generation
     */
    int getGeneration();

    /**
     * Send a command and receive its reply.
     *
     * @param message the command message
     * @return the reply document
     * @throws com.docdriver.MongoCommandException if the reply is not ok
     */
    default BsonDocument sendAndReceive(final CommandMessage message) {
        return sendAndReceive(message, 0);
    }

    /**
     * Send a command and receive its reply, allowing the read to take longer than the socket read timeout.  Used for awaitable
     * {@code hello} commands.
     *
     * @param message                 the command message
     * @param additionalTimeoutMillis the extra time the read may take
     * @return the reply document
     * @throws com.docdriver.MongoCommandException if the reply is not ok
     */
    BsonDocument sendAndReceive(CommandMessage message, int additionalTimeoutMillis);
}
