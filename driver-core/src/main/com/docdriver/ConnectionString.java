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

package com.docdriver;

import com.docdriver.connection.ServerMonitoringMode;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;
import com.docdriver.lang.Nullable;

import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static java.lang.String.format;
import static java.util.Arrays.asList;

/**
 * <p>Represents a <a href="https://www.mongodb.com/docs/manual/reference/connection-string/">Connection String</a>.</p>
 *
 * <p>The format of the connection string is:</p>
 * <pre>
 *   mongodb://host1[:port1][,...hostN[:portN]][/[defaultauthdb][?options]]
 * </pre>
 *
 * <p>The following options relating to topology discovery, monitoring, connection pooling and server selection are supported:</p>
 * <ul>
 * <li>{@code replicaSet=name}: Implies that the hosts given are a seed list, and the driver will attempt to find all members of
 * the set.</li>
 * <li>{@code directConnection=true|false}: Whether to connect directly to the single host given.</li>
 * <li>{@code loadBalanced=true|false}: Whether the host given is a load balancer.</li>
 * <li>{@code serverSelectionTimeoutMS=ms}: How long the driver will wait for server selection to succeed before throwing an
 * exception.</li>
 * <li>{@code localThresholdMS=ms}: The size of the latency window for selecting among multiple suitable servers.</li>
 * <li>{@code heartbeatFrequencyMS=ms}: The frequency that the driver will attempt to determine the current state of each server.</li>
 * <li>{@code serverMonitoringMode=stream|poll|auto}: The server monitoring protocol.</li>
 * <li>{@code maxPoolSize=n}, {@code minPoolSize=n}, {@code maxIdleTimeMS=ms}, {@code maxLifeTimeMS=ms},
 * {@code waitQueueTimeoutMS=ms}: Connection pool sizing and expiry.</li>
 * <li>{@code connectTimeoutMS=ms}, {@code socketTimeoutMS=ms}: Socket timeouts.</li>
 * <li>{@code readPreference=mode}, {@code readPreferenceTags=dc:ny,rack:1} (repeatable), {@code maxStalenessSeconds=s}: The read
 * preference.</li>
 * </ul>
 */
public class ConnectionString {
    private static final Logger LOGGER = Loggers.getLogger("uri");
    private static final String MONGODB_PREFIX = "mongodb://";
    private static final Set<String> GENERAL_OPTIONS_KEYS = new HashSet<String>(asList(
            "replicaset", "directconnection", "loadbalanced", "serverselectiontimeoutms", "localthresholdms",
            "heartbeatfrequencyms", "servermonitoringmode", "maxpoolsize", "minpoolsize", "maxidletimems", "maxlifetimems",
            "waitqueuetimeoutms", "connecttimeoutms", "sockettimeoutms", "readpreference", "readpreferencetags",
            "maxstalenessseconds", "appname"));

    private final String connectionString;
    private final List<String> hosts;
    private final String database;

    private String requiredReplicaSetName;
    private Boolean directConnection;
    private Boolean loadBalanced;
    private Integer serverSelectionTimeout;
    private Integer localThreshold;
    private Integer heartbeatFrequency;
    private ServerMonitoringMode serverMonitoringMode;
    private Integer maxConnectionPoolSize;
    private Integer minConnectionPoolSize;
    private Integer maxWaitTime;
    private Integer maxConnectionIdleTime;
    private Integer maxConnectionLifeTime;
    private Integer connectTimeout;
    private Integer socketTimeout;
    private ReadPreference readPreference;
    private String applicationName;

    /**
     * Creates a ConnectionString from the given string.
     *
     * @param connectionString the connection string
     * @throws IllegalArgumentException if the connection string is not valid
     */
    public ConnectionString(final String connectionString) {
        this.connectionString = connectionString;
        if (!connectionString.startsWith(MONGODB_PREFIX)) {
            throw new IllegalArgumentException(format("The connection string is invalid. "
                    + "Connection strings must start with '%s'", MONGODB_PREFIX));
        }

        String unprocessedConnectionString = connectionString.substring(MONGODB_PREFIX.length());

        // Split out the user and host information
        String userAndHostInformation;
        int idx = unprocessedConnectionString.indexOf("/");
        if (idx == -1) {
            if (unprocessedConnectionString.contains("?")) {
                throw new IllegalArgumentException("The connection string contains options without trailing slash");
            }
            userAndHostInformation = unprocessedConnectionString;
            unprocessedConnectionString = "";
        } else {
            userAndHostInformation = unprocessedConnectionString.substring(0, idx);
            unprocessedConnectionString = unprocessedConnectionString.substring(idx + 1);
        }

        // Credentials are consumed by the authentication layer, which lives outside this library
        idx = userAndHostInformation.lastIndexOf("@");
        String hostIdentifier = idx > 0 ? userAndHostInformation.substring(idx + 1) : userAndHostInformation;
        if (hostIdentifier.isEmpty()) {
            throw new IllegalArgumentException("The connection string must contain at least one host");
        }
        hosts = Collections.unmodifiableList(parseHosts(asList(hostIdentifier.split(","))));

        // Process the authDB section
        String nsPart;
        idx = unprocessedConnectionString.indexOf("?");
        if (idx == -1) {
            nsPart = unprocessedConnectionString;
            unprocessedConnectionString = "";
        } else {
            nsPart = unprocessedConnectionString.substring(0, idx);
            unprocessedConnectionString = unprocessedConnectionString.substring(idx + 1);
        }
        database = nsPart.isEmpty() ? null : urldecode(nsPart);

        Map<String, List<String>> optionsMap = parseOptions(unprocessedConnectionString);
        translateOptions(optionsMap);
        readPreference = buildReadPreference(optionsMap);
        validate();
    }

    private void translateOptions(final Map<String, List<String>> optionsMap) {
        for (final String key : GENERAL_OPTIONS_KEYS) {
            String value = getLastValue(optionsMap, key);
            if (value == null) {
                continue;
            }
            switch (key) {
                case "replicaset":
                    requiredReplicaSetName = value;
                    break;
                case "directconnection":
                    directConnection = parseBoolean(value, "directConnection");
                    break;
                case "loadbalanced":
                    loadBalanced = parseBoolean(value, "loadBalanced");
                    break;
                case "serverselectiontimeoutms":
                    serverSelectionTimeout = parseInteger(value, "serverSelectionTimeoutMS");
                    break;
                case "localthresholdms":
                    localThreshold = parseInteger(value, "localThresholdMS");
                    break;
                case "heartbeatfrequencyms":
                    heartbeatFrequency = parseInteger(value, "heartbeatFrequencyMS");
                    break;
                case "servermonitoringmode":
                    serverMonitoringMode = ServerMonitoringMode.fromString(value);
                    break;
                case "maxpoolsize":
                    maxConnectionPoolSize = parseInteger(value, "maxPoolSize");
                    break;
                case "minpoolsize":
                    minConnectionPoolSize = parseInteger(value, "minPoolSize");
                    break;
                case "maxidletimems":
                    maxConnectionIdleTime = parseInteger(value, "maxIdleTimeMS");
                    break;
                case "maxlifetimems":
                    maxConnectionLifeTime = parseInteger(value, "maxLifeTimeMS");
                    break;
                case "waitqueuetimeoutms":
                    maxWaitTime = parseInteger(value, "waitQueueTimeoutMS");
                    break;
                case "connecttimeoutms":
                    connectTimeout = parseInteger(value, "connectTimeoutMS");
                    break;
                case "sockettimeoutms":
                    socketTimeout = parseInteger(value, "socketTimeoutMS");
                    break;
                case "appname":
                    applicationName = value;
                    break;
                default:
                    break;
            }
        }
    }

    private void validate() {
        if (directConnection != null && directConnection && hosts.size() > 1) {
            throw new IllegalArgumentException("Multiple hosts cannot be specified when using directConnection=true");
        }
        if (loadBalanced != null && loadBalanced) {
            if (directConnection != null && directConnection) {
                throw new IllegalArgumentException("directConnection=true cannot be specified with loadBalanced=true");
            }
            if (requiredReplicaSetName != null) {
                throw new IllegalArgumentException("replicaSet cannot be specified with loadBalanced=true");
            }
            if (hosts.size() > 1) {
                throw new IllegalArgumentException("Only one host can be specified with loadBalanced=true");
            }
        }
    }

    @Nullable
    private ReadPreference buildReadPreference(final Map<String, List<String>> optionsMap) {
        String readPreferenceType = getLastValue(optionsMap, "readpreference");
        List<TagSet> tagSetList = new ArrayList<TagSet>();
        List<String> tagValues = optionsMap.get("readpreferencetags");
        if (tagValues != null) {
            for (String tagValue : tagValues) {
                tagSetList.add(getTags(tagValue.trim()));
            }
        }
        String maxStalenessValue = getLastValue(optionsMap, "maxstalenessseconds");
        long maxStalenessSeconds = maxStalenessValue == null ? -1 : parseInteger(maxStalenessValue, "maxStalenessSeconds");

        if (readPreferenceType != null) {
            if (tagSetList.isEmpty() && maxStalenessSeconds == -1) {
                return ReadPreference.valueOf(readPreferenceType);
            } else if (maxStalenessSeconds == -1) {
                return ReadPreference.valueOf(readPreferenceType, tagSetList);
            } else {
                return ReadPreference.valueOf(readPreferenceType, tagSetList, maxStalenessSeconds, TimeUnit.SECONDS);
            }
        } else if (!tagSetList.isEmpty() || maxStalenessSeconds != -1) {
            throw new IllegalArgumentException("Read preference mode must be specified if either read preference tags or max "
                                               + "staleness is specified");
        }
        return null;
    }

    private TagSet getTags(final String tagSetString) {
        List<Tag> tagList = new ArrayList<Tag>();
        if (tagSetString.length() > 0) {
            for (final String tag : tagSetString.split(",")) {
                String[] tagKeyValuePair = tag.split(":");
                if (tagKeyValuePair.length != 2) {
                    throw new IllegalArgumentException(format("The connection string contains an invalid read preference tag. "
                            + "%s is not a key value pair", tagSetString));
                }
                tagList.add(new Tag(tagKeyValuePair[0].trim(), tagKeyValuePair[1].trim()));
            }
        }
        return new TagSet(tagList);
    }

    private Map<String, List<String>> parseOptions(final String optionsPart) {
        Map<String, List<String>> optionsMap = new HashMap<String, List<String>>();
        if (optionsPart.isEmpty()) {
            return optionsMap;
        }

        for (final String part : optionsPart.split("&|;")) {
            if (part.isEmpty()) {
                continue;
            }
            int idx = part.indexOf("=");
            if (idx >= 0) {
                String key = part.substring(0, idx).toLowerCase();
                String value = urldecode(part.substring(idx + 1));
                List<String> valueList = optionsMap.get(key);
                if (valueList == null) {
                    valueList = new ArrayList<String>(1);
                }
                valueList.add(value);
                optionsMap.put(key, valueList);
                if (!GENERAL_OPTIONS_KEYS.contains(key)) {
                    LOGGER.warn(format("Connection string contains unsupported option '%s'.", key));
                }
            } else {
                throw new IllegalArgumentException(format("The connection string contains an invalid option '%s'. "
                        + "'%s' is missing the value delimiter eg '%s=value'", optionsPart, part, part));
            }
        }
        return optionsMap;
    }

    @Nullable
    private String getLastValue(final Map<String, List<String>> optionsMap, final String key) {
        List<String> valueList = optionsMap.get(key);
        if (valueList == null) {
            return null;
        }
        return valueList.get(valueList.size() - 1);
    }

    private boolean parseBoolean(final String input, final String key) {
        String trimmedInput = input.trim().toLowerCase();
        if (trimmedInput.equals("true")) {
            return true;
        } else if (trimmedInput.equals("false")) {
            return false;
        }
        throw new IllegalArgumentException(format("The connection string contains an invalid value for '%s'. "
                + "'%s' is not a valid boolean", key, input));
    }

    private int parseInteger(final String input, final String key) {
        try {
            return Integer.parseInt(input);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(format("The connection string contains an invalid value for '%s'. "
                    + "'%s' is not a valid integer", key, input));
        }
    }

    private List<String> parseHosts(final List<String> rawHosts) {
        List<String> hosts = new ArrayList<String>();
        for (String host : rawHosts) {
            if (host.length() == 0) {
                throw new IllegalArgumentException(format("The connection string contains an empty host '%s'. ", rawHosts));
            } else if (host.endsWith(".sock")) {
                throw new IllegalArgumentException(format("The connection string contains an unsupported unix domain socket '%s'. ",
                        host));
            } else if (host.startsWith("[")) {
                if (!host.contains("]")) {
                    throw new IllegalArgumentException(format("The connection string contains an invalid host '%s'. "
                            + "IPv6 address literals must be enclosed in '[' and ']' according to RFC 2732", host));
                }
                int idx = host.indexOf("]:");
                if (idx != -1) {
                    validatePort(host, host.substring(idx + 2));
                }
            } else {
                int colonCount = countOccurrences(host, ":");
                if (colonCount > 1) {
                    throw new IllegalArgumentException(format("The connection string contains an invalid host '%s'. "
                            + "Reserved characters such as ':' must be escaped according RFC 2396. "
                            + "Any IPv6 address literal must be enclosed in '[' and ']' according to RFC 2732.", host));
                } else if (colonCount == 1) {
                    validatePort(host, host.substring(host.indexOf(":") + 1));
                }
            }
            hosts.add(host);
        }
        return hosts;
    }

    private void validatePort(final String host, final String port) {
        boolean invalidPort = false;
        try {
            int portInt = Integer.parseInt(port);
            if (portInt <= 0 || portInt > 65535) {
                invalidPort = true;
            }
        } catch (NumberFormatException e) {
            invalidPort = true;
        }
        if (invalidPort) {
            throw new IllegalArgumentException(format("The connection string contains an invalid host '%s'. "
                    + "The port '%s' is not a valid, it must be an integer between 0 and 65535", host, port));
        }
    }

    private int countOccurrences(final String haystack, final String needle) {
        return haystack.length() - haystack.replace(needle, "").length();
    }

    private String urldecode(final String input) {
        try {
            return URLDecoder.decode(input, "UTF-8");
        } catch (UnsupportedEncodingException e) {
            throw new IllegalArgumentException(format("The connection string contained unsupported characters: '%s'."
                    + "Decoding produced the following error: %s", input, e.getMessage()));
        }
    }

    /**
     * Gets the list of hosts
     *
     * @return the host list
     */
    public List<String> getHosts() {
        return hosts;
    }

    /**
     * Gets the hosts parsed as server addresses.
     *
     * @return the server addresses, in the order given
     */
    public List<ServerAddress> getServerAddresses() {
        List<ServerAddress> serverAddresses = new ArrayList<ServerAddress>(hosts.size());
        for (String host : hosts) {
            serverAddresses.add(new ServerAddress(host));
        }
        return serverAddresses;
    }

    /**
     * Gets the database name
     *
     * @return the database name
     */
    @Nullable
    public String getDatabase() {
        return database;
    }

    /**
     * Gets the required replica set name specified in the connection string.
     *
     * @return the required replica set name
     */
    @Nullable
    public String getRequiredReplicaSetName() {
        return requiredReplicaSetName;
    }

    /**
     * Gets whether to connect directly to the single host given.
     *
     * @return the direct connection value, or null if unset
     */
    @Nullable
    public Boolean isDirectConnection() {
        return directConnection;
    }

    /**
     * Gets whether the host is a load balancer.
     *
     * @return the load balanced value, or null if unset
     */
    @Nullable
    public Boolean isLoadBalanced() {
        return loadBalanced;
    }

    /**
     * Gets the server selection timeout specified in the connection string
     *
     * @return the server selection timeout in milliseconds, or null if unset
     */
    @Nullable
    public Integer getServerSelectionTimeout() {
        return serverSelectionTimeout;
    }

    /**
     * Gets the local threshold specified in the connection string
     *
     * @return the local threshold in milliseconds, or null if unset
     */
    @Nullable
    public Integer getLocalThreshold() {
        return localThreshold;
    }

    /**
     * Gets the heartbeat frequency specified in the connection string
     *
     * @return the heartbeat frequency in milliseconds, or null if unset
     */
    @Nullable
    public Integer getHeartbeatFrequency() {
        return heartbeatFrequency;
    }

    /**
     * Gets the server monitoring mode specified in the connection string
     *
     * @return the server monitoring mode, or null if unset
     */
    @Nullable
    public ServerMonitoringMode getServerMonitoringMode() {
        return serverMonitoringMode;
    }

    /**
     * Gets the maximum connection pool size specified in the connection string.
     *
     * @return the maximum connection pool size, or null if unset
     */
    @Nullable
    public Integer getMaxConnectionPoolSize() {
        return maxConnectionPoolSize;
    }

    /**
     * Gets the minimum connection pool size specified in the connection string.
     *
     * @return the minimum connection pool size, or null if unset
     */
    @Nullable
    public Integer getMinConnectionPoolSize() {
        return minConnectionPoolSize;
    }

    /**
     * Gets the maximum wait time for a connection from the pool, in milliseconds.
     *
     * @return the maximum wait time, or null if unset
     */
    @Nullable
    public Integer getMaxWaitTime() {
        return maxWaitTime;
    }

    /**
     * Gets the maximum connection idle time specified in the connection string.
     *
     * @return the maximum connection idle time in milliseconds, or null if unset
     */
    @Nullable
    public Integer getMaxConnectionIdleTime() {
        return maxConnectionIdleTime;
    }

    /**
     * Gets the maximum connection life time specified in the connection string.
     *
     * @return the maximum connection life time in milliseconds, or null if unset
     */
    @Nullable
    public Integer getMaxConnectionLifeTime() {
        return maxConnectionLifeTime;
    }

    /**
     * Gets the socket connect timeout specified in the connection string.
     *
     * @return the socket connect timeout in milliseconds, or null if unset
     */
    @Nullable
    public Integer getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Gets the socket timeout specified in the connection string.
     *
     * @return the socket timeout in milliseconds, or null if unset
     */
    @Nullable
    public Integer getSocketTimeout() {
        return socketTimeout;
    }

    /**
     * Gets the read preference specified in the connection string.
     *
     * @return the read preference, or null if unset
     */
    @Nullable
    public ReadPreference getReadPreference() {
        return readPreference;
    }

    /**
     * Gets the logical name of the application.
     *
     * @return the application name, which may be null
     */
    @Nullable
    public String getApplicationName() {
        return applicationName;
    }

    /**
     * Get the unparsed connection string.
     *
     * @return the connection string
     */
    public String getConnectionString() {
        return connectionString;
    }

    @Override
    public String toString() {
        return connectionString;
    }
}
