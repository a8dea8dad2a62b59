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

import com.docdriver.connection.ClusterDescription;
import com.docdriver.event.ClusterClosedEvent;
import com.docdriver.event.ClusterDescriptionChangedEvent;
import com.docdriver.event.ClusterListener;
import com.docdriver.event.ClusterOpeningEvent;

import java.util.ArrayList;
import java.util.List;

class TestClusterListener implements ClusterListener {
    private final List<ClusterDescription> descriptions = new ArrayList<ClusterDescription>();
    private volatile ClusterOpeningEvent openingEvent;
    private volatile ClusterClosedEvent closedEvent;

    @Override
    public void clusterOpening(final ClusterOpeningEvent event) {
        openingEvent = event;
    }

    @Override
    public void clusterClosed(final ClusterClosedEvent event) {
        closedEvent = event;
    }

    @Override
    public void clusterDescriptionChanged(final ClusterDescriptionChangedEvent event) {
        synchronized (descriptions) {
            descriptions.add(event.getNewDescription());
        }
    }

    List<ClusterDescription> getDescriptions() {
        synchronized (descriptions) {
            return new ArrayList<ClusterDescription>(descriptions);
        }
    }

    ClusterOpeningEvent getOpeningEvent() {
        return openingEvent;
    }

    ClusterClosedEvent getClosedEvent() {
        return closedEvent;
    }
}
