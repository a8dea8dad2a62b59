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

import com.docdriver.ServerAddress;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ClusterSettingsTest {

    @Test
    public void testDefaults() {
        ClusterSettings settings = ClusterSettings.builder().build();

        assertEquals(Collections.singletonList(new ServerAddress()), settings.getHosts());
        assertEquals(ClusterConnectionMode.SINGLE, settings.getMode());
        assertEquals(ClusterType.UNKNOWN, settings.getRequiredClusterType());
        assertNull(settings.getRequiredReplicaSetName());
        assertNull(settings.getServerSelector());
        assertEquals(30, settings.getServerSelectionTimeout(SECONDS));
        assertEquals(15, settings.getLocalThreshold(MILLISECONDS));
    }

    @Test
    public void testModeDefaultsToMultipleForSeveralHostsOrAReplicaSet() {
        assertEquals(ClusterConnectionMode.MULTIPLE, ClusterSettings.builder()
                .hosts(Arrays.asList(new ServerAddress("a"), new ServerAddress("b"))).build().getMode());
        assertEquals(ClusterConnectionMode.MULTIPLE, ClusterSettings.builder().requiredReplicaSetName("rs0").build().getMode());
    }

    @Test
    public void testRequiredReplicaSetNameImpliesAReplicaSet() {
        ClusterSettings settings = ClusterSettings.builder().requiredReplicaSetName("rs0").build();

        assertEquals(ClusterType.REPLICA_SET_NO_PRIMARY, settings.getRequiredClusterType());
    }

    @Test
    public void testDuplicateHostsAreRemoved() {
        ClusterSettings settings = ClusterSettings.builder()
                .hosts(Arrays.asList(new ServerAddress("a"), new ServerAddress("A:27017"), new ServerAddress("b")))
                .build();

        assertEquals(Arrays.asList(new ServerAddress("a"), new ServerAddress("b")), settings.getHosts());
    }

    @Test
    public void testCopy() {
        ClusterSettings settings = ClusterSettings.builder()
                .hosts(Arrays.asList(new ServerAddress("a"), new ServerAddress("b")))
                .requiredReplicaSetName("rs0")
                .serverSelectionTimeout(5, SECONDS)
                .localThreshold(20, MILLISECONDS)
                .build();

        assertEquals(settings, ClusterSettings.builder(settings).build());
    }

    @Test
    public void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> ClusterSettings.builder().localThreshold(-1, MILLISECONDS));
    }
}
