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

import com.docdriver.connection.ServerDescription;

/**
 * The channel through which a server's monitor, and the operations using its connections, report what they learn about the server.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public interface SdamServerDescriptionManager {

    /**
     * Receives a description produced by the monitor.  A description carrying an exception clears the connection pool.
     *
     * @param candidateDescription the new description
     */
    void monitorUpdate(ServerDescription candidateDescription);

    /**
     * Handles an exception raised while opening or using a connection to the server.  A network error marks the server as unknown,
     * clears the connection pool and requests an immediate check, provided the connection belongs to the current pool generation.  A
     * read timeout on an established connection is not treated as a network error.
     *
     * @param exception            the exception
     * @param connectionGeneration the pool generation of the connection that failed
     * @param beforeHandshake      whether the exception was raised before the handshake completed
     */
    void handleException(Throwable exception, int connectionGeneration, boolean beforeHandshake);
}
