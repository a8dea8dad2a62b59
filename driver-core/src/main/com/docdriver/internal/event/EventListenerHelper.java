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

import com.docdriver.event.ClusterEventMulticaster;
import com.docdriver.event.ClusterListener;
import com.docdriver.event.ConnectionPoolEventMulticaster;
import com.docdriver.event.ConnectionPoolListener;
import com.docdriver.event.ServerEventMulticaster;
import com.docdriver.event.ServerListener;
import com.docdriver.event.ServerMonitorEventMulticaster;
import com.docdriver.event.ServerMonitorListener;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Builds the listener each component raises its events to.  The debug logging listener always comes first, followed by the
 * application's listeners in registration order.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public final class EventListenerHelper {

    public static ClusterListener clusterListener(final List<ClusterListener> clusterListeners, final int maxDocumentLength) {
        return withLogging(new SdamLoggingListener(maxDocumentLength), clusterListeners, ClusterEventMulticaster::new);
    }

    public static ServerListener serverListener(final List<ServerListener> serverListeners, final int maxDocumentLength) {
        return withLogging(new SdamLoggingListener(maxDocumentLength), serverListeners, ServerEventMulticaster::new);
    }

    public static ServerMonitorListener serverMonitorListener(final List<ServerMonitorListener> serverMonitorListeners,
                                                              final int maxDocumentLength) {
        return withLogging(new SdamLoggingListener(maxDocumentLength), serverMonitorListeners, ServerMonitorEventMulticaster::new);
    }

    public static ConnectionPoolListener connectionPoolListener(final List<ConnectionPoolListener> connectionPoolListeners) {
        return withLogging(new ConnectionPoolLoggingListener(), connectionPoolListeners, ConnectionPoolEventMulticaster::new);
    }

    // the multicaster isolates the logging listener from exceptions thrown by application listeners
    private static <T> T withLogging(final T loggingListener, final List<T> listeners, final Function<List<T>, T> multicaster) {
        if (listeners.isEmpty()) {
            return loggingListener;
        }
        List<T> merged = new ArrayList<T>(listeners.size() + 1);
        merged.add(loggingListener);
        merged.addAll(listeners);
        return multicaster.apply(merged);
    }

    private EventListenerHelper() {
    }
}
