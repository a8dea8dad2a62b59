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

import static com.docdriver.assertions.Assertions.notNull;

/**
 * The result of a connection handshake.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public final class InternalConnectionInitializationDescription {
    private final ConnectionDescription connectionDescription;
    private final ServerDescription serverDescription;

    public InternalConnectionInitializationDescription(final ConnectionDescription connectionDescription,
                                                       final ServerDescription serverDescription) {
        this.connectionDescription = notNull("connectionDescription", connectionDescription);
        this.serverDescription = notNull("serverDescription", serverDescription);
    }

    public ConnectionDescription getConnectionDescription() {
        return connectionDescription;
    }

    public ServerDescription getServerDescription() {
        return serverDescription;
    }
}
