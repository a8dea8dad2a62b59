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
import com.docdriver.connection.ConnectionDescription;
import com.docdriver.connection.ServerDescription;
import com.docdriver.lang.Nullable;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;

import static com.docdriver.internal.connection.DescriptionHelper.createConnectionDescription;
import static com.docdriver.internal.connection.DescriptionHelper.createServerDescription;

/**
 * Runs the {@code hello} handshake on a newly opened connection.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public class InternalConnectionInitializer {
    static final String DRIVER_NAME = "docdriver";

    private final ClusterConnectionMode clusterConnectionMode;
    private final BsonDocument clientMetadataDocument;

    public InternalConnectionInitializer(final ClusterConnectionMode clusterConnectionMode, @Nullable final String applicationName) {
        this.clusterConnectionMode = clusterConnectionMode;
        this.clientMetadataDocument = createClientMetadataDocument(applicationName);
    }

    InternalConnectionInitializationDescription initialize(final InternalConnection internalConnection) {
        long start = System.nanoTime();
        BsonDocument helloResult = internalConnection.sendAndReceive(new CommandMessage("admin", createHelloCommand()));
        long roundTripTimeNanos = System.nanoTime() - start;

        ConnectionDescription connectionDescription =
                createConnectionDescription(internalConnection.getDescription().getConnectionId(), helloResult);
        ServerDescription serverDescription =
                createServerDescription(internalConnection.getDescription().getServerId().getAddress(), helloResult, roundTripTimeNanos);
        return new InternalConnectionInitializationDescription(connectionDescription, serverDescription);
    }

    BsonDocument createHelloCommand() {
        BsonDocument helloCommand = new BsonDocument("hello", new BsonInt32(1))
                .append("helloOk", BsonBoolean.TRUE)
                .append("client", clientMetadataDocument);
        if (clusterConnectionMode == ClusterConnectionMode.LOAD_BALANCED) {
            helloCommand.append("loadBalanced", BsonBoolean.TRUE);
        }
        return helloCommand;
    }

    static BsonDocument createClientMetadataDocument(@Nullable final String applicationName) {
        BsonDocument clientMetadata = new BsonDocument();
        if (applicationName != null) {
            clientMetadata.append("application", new BsonDocument("name", new BsonString(applicationName)));
        }
        String driverVersion = InternalConnectionInitializer.class.getPackage().getImplementationVersion();
        clientMetadata.append("driver", new BsonDocument("name", new BsonString(DRIVER_NAME))
                .append("version", new BsonString(driverVersion == null ? "unknown" : driverVersion)));
        clientMetadata.append("os", new BsonDocument("type", new BsonString(getOperatingSystemType()))
                .append("name", new BsonString(System.getProperty("os.name", "unknown")))
                .append("architecture", new BsonString(System.getProperty("os.arch", "unknown")))
                .append("version", new BsonString(System.getProperty("os.version", "unknown"))));
        clientMetadata.append("platform", new BsonString("Java/" + System.getProperty("java.vendor", "unknown") + "/"
                + System.getProperty("java.runtime.version", "unknown")));
        return clientMetadata;
    }

    private static String getOperatingSystemType() {
        String osName = System.getProperty("os.name", "unknown").toLowerCase();
        if (osName.startsWith("linux")) {
            return "Linux";
        } else if (osName.startsWith("mac")) {
            return "Darwin";
        } else if (osName.startsWith("windows")) {
            return "Windows";
        } else {
            return "unknown";
        }
    }
}
