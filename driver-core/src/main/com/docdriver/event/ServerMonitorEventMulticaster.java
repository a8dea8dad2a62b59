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

package com.docdriver.event;

import com.docdriver.annotations.Immutable;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;

import java.util.ArrayList;
import java.util.List;

import static com.docdriver.assertions.Assertions.isTrue;
import static com.docdriver.assertions.Assertions.notNull;
import static java.lang.String.format;
import static java.util.Collections.unmodifiableList;

/**
 * A multicaster for server monitor events. Any exception thrown by one of the listeners will be caught and not re-thrown, but may be
 * logged.
 */
@Immutable
public final class ServerMonitorEventMulticaster implements ServerMonitorListener {
    private static final Logger LOGGER = Loggers.getLogger("protocol.event");

    private final List<ServerMonitorListener> serverMonitorListeners;

    /**
     * Construct an instance with the given list of server monitor listeners
     *
     * @param serverMonitorListeners the non-null list of server monitor listeners, none of which may be null
     */
    public ServerMonitorEventMulticaster(final List<ServerMonitorListener> serverMonitorListeners) {
        notNull("serverMonitorListeners", serverMonitorListeners);
        isTrue("All ServerMonitorListener instances are non-null", !serverMonitorListeners.contains(null));
        this.serverMonitorListeners = new ArrayList<ServerMonitorListener>(serverMonitorListeners);
    }

    /**
     * Gets the server monitor listeners.
     *
     * @return the unmodifiable list of server monitor listeners
     */
    public List<ServerMonitorListener> getServerMonitorListeners() {
        return unmodifiableList(serverMonitorListeners);
    }

    @Override
    public void serverHeartbeatStarted(final ServerHeartbeatStartedEvent event) {
        for (ServerMonitorListener cur : serverMonitorListeners) {
            try {
                cur.serverHeartbeatStarted(event);
            } catch (Exception e) {
                if (LOGGER.isWarnEnabled()) {
                    LOGGER.warn(format("Exception thrown raising server heartbeat started event to listener %s", cur), e);
                }
            }
        }
    }

    @Override
    public void serverHeartbeatSucceeded(final ServerHeartbeatSucceededEvent event) {
        for (ServerMonitorListener cur : serverMonitorListeners) {
            try {
                cur.serverHeartbeatSucceeded(event);
            } catch (Exception e) {
                if (LOGGER.isWarnEnabled()) {
                    LOGGER.warn(format("Exception thrown raising server heartbeat succeeded event to listener %s", cur), e);
                }
            }
        }
    }

    @Override
    public void serverHeartbeatFailed(final ServerHeartbeatFailedEvent event) {
        for (ServerMonitorListener cur : serverMonitorListeners) {
            try {
                cur.serverHeartbeatFailed(event);
            } catch (Exception e) {
                if (LOGGER.isWarnEnabled()) {
                    LOGGER.warn(format("Exception thrown raising server heartbeat failed event to listener %s", cur), e);
                }
            }
        }
    }
}
