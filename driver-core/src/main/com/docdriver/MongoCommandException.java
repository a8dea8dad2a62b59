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

import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;

import static java.lang.String.format;

/**
 * An exception indicating that a command sent to a server returned a failure.
 */
public class MongoCommandException extends MongoException {
    private static final long serialVersionUID = 8160676451944215078L;

    private final transient BsonDocument response;
    private final ServerAddress serverAddress;

    /**
     * Construct a new instance with the BsonDocument response from the server
     *
     * @param response the command response
     * @param address the address of the server that generated the response
     */
    public MongoCommandException(final BsonDocument response, final ServerAddress address) {
        super(extractErrorCode(response), format("Command failed with error %s: '%s' on server %s. The full response is %s",
                extractErrorCodeAndName(response), extractErrorMessage(response), address, response.toJson()));
        this.response = response;
        this.serverAddress = address;
    }

    /**
     * Gets the error code associated with the command failure.
     *
     * @return the error code
     */
    public int getErrorCode() {
        return getCode();
    }

    /**
     * Gets the name associated with the error code.
     *
     * @return the error code name, which may be the empty string
     */
    public String getErrorCodeName() {
        return extractErrorCodeName(response);
    }

    /**
     * Gets the error message associated with the command failure.
     *
     * @return the error message
     */
    public String getErrorMessage() {
        return extractErrorMessage(response);
    }

    /**
     * @return the address of the server that generated the response
     */
    public ServerAddress getServerAddress() {
        return serverAddress;
    }

    /**
     * For internal use only.
     *
     * @return the full response to the command failure.
     */
    public BsonDocument getResponse() {
        return response;
    }

    private static String extractErrorCodeAndName(final BsonDocument response) {
        int errorCode = extractErrorCode(response);
        String errorCodeName = extractErrorCodeName(response);
        if (errorCodeName.isEmpty()) {
            return Integer.toString(errorCode);
        } else {
            return format("%d (%s)", errorCode, errorCodeName);
        }
    }

    private static int extractErrorCode(final BsonDocument response) {
        return response.getNumber("code", new BsonInt32(-1)).intValue();
    }

    private static String extractErrorCodeName(final BsonDocument response) {
        return response.getString("codeName", new BsonString("")).getValue();
    }

    private static String extractErrorMessage(final BsonDocument response) {
        return response.getString("errmsg", new BsonString("")).getValue();
    }
}
