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

import com.docdriver.MongoInternalException;
import org.bson.io.BsonInput;

import static java.lang.String.format;

/**
 * The header of a reply message.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public final class ReplyHeader {
    /**
     * The length of the reply header.
     */
    public static final int REPLY_HEADER_LENGTH = 16;

    private final int messageLength;
    private final int requestId;
    private final int responseTo;
    private final int opCode;

    ReplyHeader(final BsonInput header, final int maxMessageSize) {
        messageLength = header.readInt32();
        requestId = header.readInt32();
        responseTo = header.readInt32();
        opCode = header.readInt32();

        if (opCode != CommandMessage.OP_MSG) {
            throw new MongoInternalException(format("Unexpected reply message opCode %d", opCode));
        }
        if (messageLength < REPLY_HEADER_LENGTH + 5) {
            throw new MongoInternalException(format("The reply message length %d is less than the minimum message length %d",
                    messageLength, REPLY_HEADER_LENGTH + 5));
        }
        if (messageLength > maxMessageSize) {
            throw new MongoInternalException(format("The reply message length %d is greater than the maximum message length %d",
                    messageLength, maxMessageSize));
        }
    }

    public int getMessageLength() {
        return messageLength;
    }

    public int getRequestId() {
        return requestId;
    }

    public int getResponseTo() {
        return responseTo;
    }

    public int getOpCode() {
        return opCode;
    }
}
