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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ServerAddressTest {

    @Test
    public void testDefaults() {
        ServerAddress serverAddress = new ServerAddress();

        assertEquals(ServerAddress.defaultHost(), serverAddress.getHost());
        assertEquals(ServerAddress.defaultPort(), serverAddress.getPort());
        assertEquals(new ServerAddress(), new ServerAddress((String) null));
        assertEquals(new ServerAddress(), new ServerAddress("  "));
    }

    @Test
    public void testHostAndPortParsing() {
        assertEquals(new ServerAddress("somewhere", 27018), new ServerAddress("somewhere:27018"));
        assertEquals(27017, new ServerAddress("somewhere").getPort());
        assertEquals("somewhere", new ServerAddress("SomeWhere:27018").getHost());
    }

    @Test
    public void testIpv6Parsing() {
        ServerAddress serverAddress = new ServerAddress("[2010:836b:4179::836b:4179]:27018");

        assertEquals("2010:836b:4179::836b:4179", serverAddress.getHost());
        assertEquals(27018, serverAddress.getPort());
        assertEquals(27017, new ServerAddress("[::1]").getPort());
        assertThrows(IllegalArgumentException.class, () -> new ServerAddress("[::1"));
    }

    @Test
    public void testInvalidPorts() {
        assertThrows(MongoException.class, () -> new ServerAddress("somewhere:port"));
        assertThrows(IllegalArgumentException.class, () -> new ServerAddress("somewhere:27018", 27019));
    }

    @Test
    public void testEquality() {
        assertEquals(new ServerAddress("a", 1).hashCode(), new ServerAddress("A", 1).hashCode());
        assertNotEquals(new ServerAddress("a", 1), new ServerAddress("a", 2));
        assertEquals("a:1", new ServerAddress("a", 1).toString());
    }
}
