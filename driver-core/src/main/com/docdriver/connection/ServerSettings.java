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

package com.docdriver.connection;

import com.docdriver.ConnectionString;
import com.docdriver.annotations.Immutable;
import com.docdriver.annotations.NotThreadSafe;
import com.docdriver.event.ServerListener;
import com.docdriver.event.ServerMonitorListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.docdriver.assertions.Assertions.isTrueArgument;
import static com.docdriver.assertions.Assertions.notNull;
import static java.util.Collections.unmodifiableList;

/**
 * Settings relating to monitoring of each server.
 */
@Immutable
public final class ServerSettings {
    /**
     * The default maximum number of characters of a document included in a debug log entry.
     */
    public static final int DEFAULT_MAX_DOCUMENT_LENGTH = 1000;

    private final long heartbeatFrequencyMS;
    private final long minHeartbeatFrequencyMS;
    private final ServerMonitoringMode serverMonitoringMode;
    private final int maxDocumentLength;
    private final List<ServerListener> serverListeners;
    private final List<ServerMonitorListener> serverMonitorListeners;

    /**
     * Creates a builder for ServerSettings.
     *
     * @return a new Builder for creating ServerSettings.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder instance.
     *
     * @param serverSettings existing ServerSettings to default the builder settings on.
     * @return a builder
     */
    public static Builder builder(final ServerSettings serverSettings) {
        return builder().applySettings(serverSettings);
    }

    /**
     * A builder for the settings.
     */
    @NotThreadSafe
    public static final class Builder {
        private long heartbeatFrequencyMS = 10000;
        private long minHeartbeatFrequencyMS = 500;
        private ServerMonitoringMode serverMonitoringMode = ServerMonitoringMode.AUTO;
        private int maxDocumentLength = DEFAULT_MAX_DOCUMENT_LENGTH;
        private List<ServerListener> serverListeners = new ArrayList<ServerListener>();
        private List<ServerMonitorListener> serverMonitorListeners = new ArrayList<ServerMonitorListener>();

        private Builder() {
        }

        /**
         * Applies the serverSettings to the builder
         *
         * <p>Note: Overwrites all existing settings</p>
         *
         * @param serverSettings the serverSettings
         * @return this
         */
        public Builder applySettings(final ServerSettings serverSettings) {
            notNull("serverSettings", serverSettings);
            heartbeatFrequencyMS = serverSettings.heartbeatFrequencyMS;
            minHeartbeatFrequencyMS = serverSettings.minHeartbeatFrequencyMS;
            serverMonitoringMode = serverSettings.serverMonitoringMode;
            maxDocumentLength = serverSettings.maxDocumentLength;
            serverListeners = new ArrayList<ServerListener>(serverSettings.serverListeners);
            serverMonitorListeners = new ArrayList<ServerMonitorListener>(serverSettings.serverMonitorListeners);
            return this;
        }

        /**
         * Sets the frequency that the cluster monitor attempts to reach each server. The default value is 10 seconds.
         *
         * @param heartbeatFrequency the heartbeat frequency
         * @param timeUnit           the time unit
         * @return this
         */
        public Builder heartbeatFrequency(final long heartbeatFrequency, final TimeUnit timeUnit) {
            this.heartbeatFrequencyMS = TimeUnit.MILLISECONDS.convert(heartbeatFrequency, timeUnit);
            isTrueArgument("heartbeatFrequencyMS must be > 0", heartbeatFrequencyMS > 0);
            return this;
        }

        /**
         * Sets the minimum heartbeat frequency.  In the event that the driver has to frequently re-check a server's availability,
         * it will wait at least this long since the previous check to avoid wasted effort.  The default value is 500 milliseconds.
         *
         * @param minHeartbeatFrequency the minimum heartbeat frequency
         * @param timeUnit              the time unit
         * @return this
         */
        public Builder minHeartbeatFrequency(final long minHeartbeatFrequency, final TimeUnit timeUnit) {
            this.minHeartbeatFrequencyMS = TimeUnit.MILLISECONDS.convert(minHeartbeatFrequency, timeUnit);
            isTrueArgument("minHeartbeatFrequencyMS must be > 0", minHeartbeatFrequencyMS > 0);
            return this;
        }

        /**
         * Sets the server monitoring mode, which defines the monitoring protocol to use. The default value is
         * {@link ServerMonitoringMode#AUTO}.
         *
         * @param serverMonitoringMode the server monitoring mode
         * @return this
         */
        public Builder serverMonitoringMode(final ServerMonitoringMode serverMonitoringMode) {
            this.serverMonitoringMode = notNull("serverMonitoringMode", serverMonitoringMode);
            return this;
        }

        /**
         * Sets the maximum number of characters of a document, such as a heartbeat reply, included in a debug log entry.  Longer
         * documents are truncated.  The default value is 1000.
         *
         * @param maxDocumentLength the maximum document length, which must be positive
         * @return this
         */
        public Builder maxDocumentLength(final int maxDocumentLength) {
            isTrueArgument("maxDocumentLength must be > 0", maxDocumentLength > 0);
            this.maxDocumentLength = maxDocumentLength;
            return this;
        }

        /**
         * Add a server listener.
         *
         * @param serverListener the non-null server listener
         * @return this
         */
        public Builder addServerListener(final ServerListener serverListener) {
            notNull("serverListener", serverListener);
            serverListeners.add(serverListener);
            return this;
        }

        /**
         * Adds a server monitor listener.
         *
         * @param serverMonitorListener the non-null server monitor listener
         * @return this
         */
        public Builder addServerMonitorListener(final ServerMonitorListener serverMonitorListener) {
            notNull("serverMonitorListener", serverMonitorListener);
            serverMonitorListeners.add(serverMonitorListener);
            return this;
        }

        /**
         * Takes the settings from the given {@code ConnectionString} and applies them to the builder
         *
         * @param connectionString the connection string containing details of how to connect to MongoDB
         * @return this
         */
        public Builder applyConnectionString(final ConnectionString connectionString) {
            Integer heartbeatFrequency = connectionString.getHeartbeatFrequency();
            if (heartbeatFrequency != null) {
                heartbeatFrequency(heartbeatFrequency, TimeUnit.MILLISECONDS);
            }
            ServerMonitoringMode monitoringMode = connectionString.getServerMonitoringMode();
            if (monitoringMode != null) {
                serverMonitoringMode(monitoringMode);
            }
            return this;
        }

        /**
         * Create a new ServerSettings from the settings applied to this builder.
         *
         * @return a ServerSettings with the given settings.
         */
        public ServerSettings build() {
            return new ServerSettings(this);
        }
    }

    /**
     * Gets the frequency that the cluster monitor attempts to reach each server. The default value is 10 seconds.
     *
     * @param timeUnit the time unit
     * @return the heartbeat frequency
     */
    public long getHeartbeatFrequency(final TimeUnit timeUnit) {
        return timeUnit.convert(heartbeatFrequencyMS, TimeUnit.MILLISECONDS);
    }

    /**
     * Gets the minimum heartbeat frequency.  In the event that the driver has to frequently re-check a server's availability,
     * it will wait at least this long since the previous check to avoid wasted effort.  The default value is 500 milliseconds.
     *
     * @param timeUnit the time unit
     * @return the heartbeat reconnect retry frequency
     */
    public long getMinHeartbeatFrequency(final TimeUnit timeUnit) {
        return timeUnit.convert(minHeartbeatFrequencyMS, TimeUnit.MILLISECONDS);
    }

    /**
     * Gets the server monitoring mode.
     *
     * @return the server monitoring mode
     */
    public ServerMonitoringMode getServerMonitoringMode() {
        return serverMonitoringMode;
    }

    /**
     * Gets the maximum number of characters of a document included in a debug log entry.
     *
     * @return the maximum document length
     */
    public int getMaxDocumentLength() {
        return maxDocumentLength;
    }

    /**
     * Gets the server listeners.  The default value is an empty list.
     *
     * @return the server listeners
     */
    public List<ServerListener> getServerListeners() {
        return serverListeners;
    }

    /**
     * Gets the server monitor listeners.  The default value is an empty list.
     *
     * @return the server monitor listeners
     */
    public List<ServerMonitorListener> getServerMonitorListeners() {
        return serverMonitorListeners;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        ServerSettings that = (ServerSettings) o;

        if (heartbeatFrequencyMS != that.heartbeatFrequencyMS) {
            return false;
        }
        if (minHeartbeatFrequencyMS != that.minHeartbeatFrequencyMS) {
            return false;
        }
        if (serverMonitoringMode != that.serverMonitoringMode) {
            return false;
        }
        if (maxDocumentLength != that.maxDocumentLength) {
            return false;
        }
        if (!serverListeners.equals(that.serverListeners)) {
            return false;
        }
        return serverMonitorListeners.equals(that.serverMonitorListeners);
    }

    @Override
    public int hashCode() {
        int result = (int) (heartbeatFrequencyMS ^ (heartbeatFrequencyMS >>> 32));
        result = 31 * result + (int) (minHeartbeatFrequencyMS ^ (minHeartbeatFrequencyMS >>> 32));
        result = 31 * result + serverMonitoringMode.hashCode();
        result = 31 * result + maxDocumentLength;
        result = 31 * result + serverListeners.hashCode();
        result = 31 * result + serverMonitorListeners.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "ServerSettings{"
               + "heartbeatFrequencyMS=" + heartbeatFrequencyMS
               + ", minHeartbeatFrequencyMS=" + minHeartbeatFrequencyMS
               + ", serverMonitoringMode=" + serverMonitoringMode
               + ", maxDocumentLength=" + maxDocumentLength
               + ", serverListeners='" + serverListeners + '\''
               + ", serverMonitorListeners='" + serverMonitorListeners + '\''
               + '}';
    }

    ServerSettings(final Builder builder) {
        heartbeatFrequencyMS = builder.heartbeatFrequencyMS;
        minHeartbeatFrequencyMS = builder.minHeartbeatFrequencyMS;
        serverMonitoringMode = builder.serverMonitoringMode;
        maxDocumentLength = builder.maxDocumentLength;
        serverListeners = unmodifiableList(builder.serverListeners);
        serverMonitorListeners = unmodifiableList(builder.serverMonitorListeners);
    }
}
