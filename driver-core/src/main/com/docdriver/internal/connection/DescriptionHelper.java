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
import com.docdriver.Tag;
import com.docdriver.TagSet;
import com.docdriver.connection.ConnectionDescription;
import com.docdriver.connection.ConnectionId;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerType;
import com.docdriver.connection.TopologyVersion;
import com.docdriver.lang.Nullable;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.docdriver.connection.ServerConnectionState.CONNECTED;
import static com.docdriver.connection.ServerType.LOAD_BALANCER;
import static com.docdriver.connection.ServerType.REPLICA_SET_ARBITER;
import static com.docdriver.connection.ServerType.REPLICA_SET_GHOST;
import static com.docdriver.connection.ServerType.REPLICA_SET_OTHER;
import static com.docdriver.connection.ServerType.REPLICA_SET_PRIMARY;
import static com.docdriver.connection.ServerType.REPLICA_SET_SECONDARY;
import static com.docdriver.connection.ServerType.SHARD_ROUTER;
import static com.docdriver.connection.ServerType.STANDALONE;
import static com.docdriver.connection.ServerType.UNKNOWN;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Builds descriptions from the reply to a {@code hello} command.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public final class DescriptionHelper {

    static ConnectionDescription createConnectionDescription(final ConnectionId connectionId, final BsonDocument helloResult) {
        ConnectionId connectionIdWithServerValue = connectionId;
        if (helloResult.containsKey("connectionId")) {
            connectionIdWithServerValue = connectionId.withServerValue(helloResult.getNumber("connectionId").longValue());
        }
        return new ConnectionDescription(connectionIdWithServerValue, getMaxWireVersion(helloResult), getServerType(helloResult),
                getMaxDocumentSize(helloResult), getMaxMessageSize(helloResult), getServiceId(helloResult));
    }

    /**
     * Create a server description from the reply to a {@code hello} command.
     *
     * @param serverAddress      the address of the server that replied
     * @param helloResult        the reply
     * @param roundTripTimeNanos the round trip time to assign to the description
     * @return the server description
     */
    public static ServerDescription createServerDescription(final ServerAddress serverAddress, final BsonDocument helloResult,
                                                            final long roundTripTimeNanos) {
        return ServerDescription.builder()
                .state(CONNECTED)
                .address(serverAddress)
                .type(getServerType(helloResult))
                .canonicalAddress(helloResult.containsKey("me") ? helloResult.getString("me").getValue().toLowerCase() : null)
                .hosts(listToSet(helloResult.getArray("hosts", null)))
                .passives(listToSet(helloResult.getArray("passives", null)))
                .arbiters(listToSet(helloResult.getArray("arbiters", null)))
                .primary(getString(helloResult, "primary"))
                .maxDocumentSize(getMaxDocumentSize(helloResult))
                .tagSet(getTagSetFromDocument(helloResult.getDocument("tags", new BsonDocument())))
                .setName(getString(helloResult, "setName"))
                .minWireVersion(getMinWireVersion(helloResult))
                .maxWireVersion(getMaxWireVersion(helloResult))
                .electionId(getElectionId(helloResult))
                .setVersion(getSetVersion(helloResult))
                .topologyVersion(getTopologyVersion(helloResult))
                .lastWriteDate(getLastWriteDate(helloResult))
                .roundTripTime(roundTripTimeNanos, NANOSECONDS)
                .logicalSessionTimeoutMinutes(getLogicalSessionTimeoutMinutes(helloResult))
                .ok(isOk(helloResult))
                .build();
    }

    static ServerType getServerType(final BsonDocument helloResult) {
        if (!isOk(helloResult)) {
            return UNKNOWN;
        }

        if (isReplicaSetMember(helloResult)) {
            if (helloResult.getBoolean("hidden", BsonBoolean.FALSE).getValue()) {
                return REPLICA_SET_OTHER;
            }

            if (helloResult.getBoolean("isWritablePrimary", BsonBoolean.FALSE).getValue()
                    || helloResult.getBoolean("ismaster", BsonBoolean.FALSE).getValue()) {
                return REPLICA_SET_PRIMARY;
            }

            if (helloResult.getBoolean("secondary", BsonBoolean.FALSE).getValue()) {
                return REPLICA_SET_SECONDARY;
            }

            if (helloResult.getBoolean("arbiterOnly", BsonBoolean.FALSE).getValue()) {
                return REPLICA_SET_ARBITER;
            }

            if (helloResult.containsKey("setName") && helloResult.containsKey("hosts")) {
                return REPLICA_SET_OTHER;
            }

            return REPLICA_SET_GHOST;
        }

        if (helloResult.containsKey("msg") && helloResult.get("msg").equals(new BsonString("isdbgrid"))) {
            return SHARD_ROUTER;
        }

        if (helloResult.containsKey("serviceId")) {
            return LOAD_BALANCER;
        }

        return STANDALONE;
    }

    private static boolean isReplicaSetMember(final BsonDocument helloResult) {
        return helloResult.containsKey("setName") || helloResult.getBoolean("isreplicaset", BsonBoolean.FALSE).getValue();
    }

    private static boolean isOk(final BsonDocument helloResult) {
        return helloResult.getNumber("ok", new BsonInt32(0)).intValue() == 1;
    }

    @Nullable
    private static String getString(final BsonDocument document, final String key) {
        if (document.isString(key)) {
            return document.getString(key).getValue();
        } else {
            return null;
        }
    }

    private static int getMinWireVersion(final BsonDocument helloResult) {
        return helloResult.getInt32("minWireVersion", new BsonInt32(0)).getValue();
    }

    private static int getMaxWireVersion(final BsonDocument helloResult) {
        return helloResult.getInt32("maxWireVersion", new BsonInt32(0)).getValue();
    }

    private static int getMaxDocumentSize(final BsonDocument helloResult) {
        return helloResult.getInt32("maxBsonObjectSize", new BsonInt32(ServerDescription.getDefaultMaxDocumentSize())).getValue();
    }

    private static int getMaxMessageSize(final BsonDocument helloResult) {
        return helloResult.getInt32("maxMessageSizeBytes", new BsonInt32(ConnectionDescription.getDefaultMaxMessageSize())).getValue();
    }

    @Nullable
    private static ObjectId getServiceId(final BsonDocument helloResult) {
        return helloResult.isObjectId("serviceId") ? helloResult.getObjectId("serviceId").getValue() : null;
    }

    @Nullable
    private static ObjectId getElectionId(final BsonDocument helloResult) {
        return helloResult.isObjectId("electionId") ? helloResult.getObjectId("electionId").getValue() : null;
    }

    @Nullable
    private static Integer getSetVersion(final BsonDocument helloResult) {
        return helloResult.isNumber("setVersion") ? helloResult.getNumber("setVersion").intValue() : null;
    }

    @Nullable
    private static TopologyVersion getTopologyVersion(final BsonDocument helloResult) {
        return helloResult.isDocument("topologyVersion") ? new TopologyVersion(helloResult.getDocument("topologyVersion")) : null;
    }

    @Nullable
    private static Date getLastWriteDate(final BsonDocument helloResult) {
        if (!helloResult.isDocument("lastWrite")) {
            return null;
        }
        BsonDocument lastWrite = helloResult.getDocument("lastWrite");
        return lastWrite.isDateTime("lastWriteDate") ? new Date(lastWrite.getDateTime("lastWriteDate").getValue()) : null;
    }

    @Nullable
    private static Integer getLogicalSessionTimeoutMinutes(final BsonDocument helloResult) {
        return helloResult.isNumber("logicalSessionTimeoutMinutes")
                ? helloResult.getNumber("logicalSessionTimeoutMinutes").intValue() : null;
    }

    private static Set<String> listToSet(@Nullable final BsonArray array) {
        if (array == null || array.isEmpty()) {
            return Collections.emptySet();
        } else {
            Set<String> set = new HashSet<String>();
            for (BsonValue value : array) {
                set.add(value.asString().getValue().toLowerCase());
            }
            return set;
        }
    }

    private static TagSet getTagSetFromDocument(final BsonDocument tagsDocuments) {
        List<Tag> tagList = new ArrayList<Tag>();
        for (final Map.Entry<String, BsonValue> curEntry : tagsDocuments.entrySet()) {
            tagList.add(new Tag(curEntry.getKey(), curEntry.getValue().asString().getValue()));
        }
        return new TagSet(tagList);
    }

    private DescriptionHelper() {
    }
}
