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

import com.docdriver.annotations.NotThreadSafe;
import com.docdriver.connection.ConnectionDescription;
import org.bson.BsonDocument;

/**
 * A connection checked out of a server's pool, leased to a single caller until it is checked back in.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
@NotThreadSafe
public interface Connection {

    /**
     * Gets the description of the connection.
     *
     * @return the connection description
     */
    ConnectionDescription getDescription();

    /**
     * Execute the command.  A network error is reported to the server this connection belongs to before it is rethrown.
     *
     * @param database the database to run the command against
     * @param command  the command document
     * @return the command reply
     */
    BsonDocument command(String database, BsonDocument command);

    /**
     * Check the connection back in as healthy.  A connection may be checked in only once.
     */
    void release();
}
