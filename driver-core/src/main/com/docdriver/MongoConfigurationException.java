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

/**
 * An exception indicating a configuration error in the client, such as a seed list that contradicts the requested connection mode.
 */
public class MongoConfigurationException extends MongoClientException {

    private static final long serialVersionUID = -2343119787572378157L;

    /**
     * Construct an instance
     *
     * @param message the message
     */
    public MongoConfigurationException(final String message) {
        super(message);
    }

    /**
     * Construct an instance
     *
     * @param message the message
     * @param cause the cause
     */
    public MongoConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
