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

/**
 * The server monitoring mode, which defines the monitoring protocol to use.
 *
 * @see ServerSettings#getServerMonitoringMode()
 */
public enum ServerMonitoringMode {
    /**
     * Use the streaming protocol when the server supports it, that is when it reports a topology version, or fall back to the polling
     * protocol otherwise.
     */
    STREAM,

    /**
     * Use the polling protocol.
     */
    POLL,

    /**
     * Behave the same as {@link #STREAM}.  This is the default.
     */
    AUTO;

    /**
     * Parses the mode from its connection string spelling, case-insensitively.
     *
     * @param value the value, e.g. {@code "stream"}
     * @return the mode
     * @throws IllegalArgumentException if the value does not name a mode
     */
    public static ServerMonitoringMode fromString(final String value) {
        for (ServerMonitoringMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("'" + value + "' is not a valid ServerMonitoringMode");
    }
}
