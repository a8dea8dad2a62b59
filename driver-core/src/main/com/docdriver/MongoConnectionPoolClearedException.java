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

import com.docdriver.connection.ServerId;
import com.docdriver.lang.Nullable;

import static java.lang.String.format;

/**
 * An exception that may usually happen as a result of another thread clearing a connection pool.  Such clearing usually itself happens
 * as a result of an exception, in which case it may be specified via the {@link #getCause()} method.
 */
public final class MongoConnectionPoolClearedException extends MongoClientException {
    private static final long serialVersionUID = 1;

    /**
     * @param connectionPoolServerId A {@link ServerId} specifying the server used by the connection pool that creates a new connection.
     * @param cause What may have caused the connection pool to be cleared.
     */
    public MongoConnectionPoolClearedException(final ServerId connectionPoolServerId, @Nullable final Throwable cause) {
        super(format("Connection pool for %s is paused%s", connectionPoolServerId,
                cause == null ? "" : format(" because another operation failed with: \"%s\"", cause)), cause);
    }
}
