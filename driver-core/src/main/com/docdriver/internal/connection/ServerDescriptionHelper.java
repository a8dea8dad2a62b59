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

import com.docdriver.ServerAddress;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.TopologyVersion;
import com.docdriver.lang.Nullable;

import static com.docdriver.connection.ServerConnectionState.CONNECTING;
import static com.docdriver.connection.ServerType.UNKNOWN;

/**
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public final class ServerDescriptionHelper {

    public static ServerDescription unknownConnectingServerDescription(final ServerAddress serverAddress,
                                                                       @Nullable final Throwable exception) {
        return ServerDescription.builder()
                .type(UNKNOWN)
                .state(CONNECTING)
                .address(serverAddress)
                .exception(exception)
                .build();
    }

    /**
     * A candidate is stale when both it and the current description carry a topology version and the candidate's is not newer.
     * Descriptions without a topology version, such as those created from a failed check, are never stale.
     *
     * <p>An equal topology version counts as stale, so a server whose state does not change keeps the round trip time, last update
     * time and last write date of the first description accepted for that version. The latency window and the max staleness
     * estimate work from those values until the server's topology version moves on.</p>
     *
     * @param currentDescription   the description currently held for the server
     * @param candidateDescription the newly reported description
     * @return true if the candidate must be discarded
     */
    public static boolean isStale(final ServerDescription currentDescription, final ServerDescription candidateDescription) {
        TopologyVersion currentTopologyVersion = currentDescription.getTopologyVersion();
        TopologyVersion candidateTopologyVersion = candidateDescription.getTopologyVersion();
        return currentTopologyVersion != null && candidateTopologyVersion != null
                && !candidateTopologyVersion.isNewerThan(currentTopologyVersion);
    }

    private ServerDescriptionHelper() {
    }
}
