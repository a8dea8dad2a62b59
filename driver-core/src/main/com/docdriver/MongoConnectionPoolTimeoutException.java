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

package com.docdriver;

/**
 * An exception indicating that a connection could not be checked out of a pool before the wait queue timeout elapsed.  Callers may retry
 * after backing off.
 */
public class MongoConnectionPoolTimeoutException extends MongoTimeoutException {

    private static final long serialVersionUID = 7411271906411305281L;

    private final ServerAddress serverAddress;

    /**
     * Construct a new instance.
     *
     * @param message       the message
     * @param serverAddress the address of the server whose pool timed out
     */
    public MongoConnectionPoolTimeoutException(final String message, final ServerAddress serverAddress) {
        super(message);
        this.serverAddress = serverAddress;
    }

    /**
     * @return the address of the server whose pool timed out
     */
    public ServerAddress getServerAddress() {
        return serverAddress;
    }
}
