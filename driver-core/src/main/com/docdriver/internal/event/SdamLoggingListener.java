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


package com.docdriver.internal.event;

import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ConnectionId;
import com.docdriver.connection.ServerId;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;
import com.docdriver.event.ClusterClosedEvent;
import com.docdriver.event.ClusterDescriptionChangedEvent;
import com.docdriver.event.ClusterListener;
import com.docdriver.event.ClusterOpeningEvent;
import com.docdriver.event.ServerClosedEvent;
import com.docdriver.event.ServerDescriptionChangedEvent;
import com.docdriver.event.ServerHeartbeatFailedEvent;
import com.docdriver.event.ServerHeartbeatStartedEvent;
import com.docdriver.event.ServerHeartbeatSucceededEvent;
import com.docdriver.event.ServerListener;
import com.docdriver.event.ServerMonitorListener;
import com.docdriver.event.ServerOpeningEvent;

import static com.docdriver.assertions.Assertions.isTrueArgument;
import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Writes topology, server and heartbeat events to the {@code com.docdriver.sdam} logger at debug level.  Heartbeat replies are
 * rendered as JSON and truncated to the configured maximum document length.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public final class SdamLoggingListener implements ClusterListener, ServerListener, ServerMonitorListener {
    private static final Logger LOGGER = Loggers.getLogger("sdam");

    private final int maxDocumentLength;

    public SdamLoggingListener(final int maxDocumentLength) {
        isTrueArgument("maxDocumentLength > 0", maxDocumentLength > 0);
        this.maxDocumentLength = maxDocumentLength;
    }

    @Override
    public void clusterOpening(final ClusterOpeningEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Topology opening: %s", topology(event.getClusterId())));
        }
    }

    @Override
    public void clusterClosed(final ClusterClosedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Topology closed: %s", topology(event.getClusterId())));
        }
    }

    @Override
    public void clusterDescriptionChanged(final ClusterDescriptionChangedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Topology description changed: %s, previousDescription=%s, newDescription=%s",
                    topology(event.getClusterId()), event.getPreviousDescription().getShortDescription(),
                    event.getNewDescription().getShortDescription()));
        }
    }

    @Override
    public void serverOpening(final ServerOpeningEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Server opening: %s", server(event.getServerId())));
        }
    }

    @Override
    public void serverClosed(final ServerClosedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Server closed: %s", server(event.getServerId())));
        }
    }

    @Override
    public void serverDescriptionChanged(final ServerDescriptionChangedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Server description changed: %s, previousDescription=%s, newDescription=%s",
                    server(event.getServerId()), event.getPreviousDescription().getShortDescription(),
                    event.getNewDescription().getShortDescription()));
        }
    }

    @Override
    public void serverHeartbeatStarted(final ServerHeartbeatStartedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Server heartbeat started: %s, awaited=%s", heartbeat(event.getConnectionId()), event.isAwaited()));
        }
    }

    @Override
    public void serverHeartbeatSucceeded(final ServerHeartbeatSucceededEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Server heartbeat succeeded: %s, awaited=%s, durationMS=%d, reply=%s",
                    heartbeat(event.getConnectionId()), event.isAwaited(), event.getElapsedTime(MILLISECONDS),
                    truncate(event.getReply().toJson(), maxDocumentLength)));
        }
    }

    @Override
    public void serverHeartbeatFailed(final ServerHeartbeatFailedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Server heartbeat failed: %s, awaited=%s, durationMS=%d, failure=%s",
                    heartbeat(event.getConnectionId()), event.isAwaited(), event.getElapsedTime(MILLISECONDS), event.getThrowable()));
        }
    }

    /**
     * Cuts the string down to at most {@code maxLength} characters, plus one if the cut would split a surrogate pair, and marks the
     * cut with a trailing ellipsis.
     */
    static String truncate(final String value, final int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        int end = maxLength;
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end++;
        }
        return value.substring(0, end) + "...";
    }

    private static String topology(final ClusterId clusterId) {
        return "topologyId=" + clusterId.getValue();
    }

    private static String server(final ServerId serverId) {
        return format("%s, %s", ConnectionPoolLoggingListener.server(serverId.getAddress()), topology(serverId.getClusterId()));
    }

    private static String heartbeat(final ConnectionId connectionId) {
        return format("%s, driverConnectionId=%d", ConnectionPoolLoggingListener.server(connectionId.getServerId().getAddress()),
                connectionId.getLocalValue());
    }
}
