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

import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ServerId;
import com.docdriver.lang.Nullable;

import static com.docdriver.assertions.Assertions.notNull;

/**
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public class InternalStreamConnectionFactory implements InternalConnectionFactory {
    private final ClusterConnectionMode clusterConnectionMode;
    private final StreamFactory streamFactory;
    @Nullable
    private final String applicationName;

    public InternalStreamConnectionFactory(final ClusterConnectionMode clusterConnectionMode, final StreamFactory streamFactory,
                                           @Nullable final String applicationName) {
        this.clusterConnectionMode = notNull("clusterConnectionMode", clusterConnectionMode);
        this.streamFactory = notNull("streamFactory", streamFactory);
        this.applicationName = applicationName;
    }

    @Override
    public InternalConnection create(final ServerId serverId, final int generation) {
        return new InternalStreamConnection(serverId, streamFactory,
                new InternalConnectionInitializer(clusterConnectionMode, applicationName), generation);
    }
}
