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

import com.docdriver.annotations.ThreadSafe;
import com.docdriver.lang.Nullable;

import java.io.Closeable;

/**
 * A pool of connections to a single server.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
@ThreadSafe
public interface ConnectionPool extends Closeable {

    /**
     * Check out a connection.  Closing the returned connection checks it back in.
     *
     * @param operationContext the operation context
     * @return the connection
     * @throws com.docdriver.MongoConnectionPoolTimeoutException if no connection becomes available in time
     * @throws com.docdriver.MongoConnectionPoolClearedException if the pool is paused
     * @throws IllegalStateException if the pool is closed
     */
    InternalConnection get(OperationContext operationContext);

    /**
     * Mark the pool as paused, increment the generation, and close idle connections.  Connections that are checked out are closed
     * when they are checked back in.
     *
     * @param cause the reason the pool is being cleared, which may be null
     */
    void invalidate(@Nullable Throwable cause);

    /**
     * Mark the pool as ready, so that connections can be checked out again after it was paused.
     */
    void ready();

    /**
     * @return the current generation
     */
    int getGeneration();

    @Override
    void close();
}
