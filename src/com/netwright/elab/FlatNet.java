/*
 *
 * Copyright (c) 2026, NetWright contributors.
 * All rights reserved.
 *
 * This file is part of NetWright.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.netwright.elab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Endpoints joined into one wire by port maps and signal assignments across
 * all hierarchy levels.
 */
public class FlatNet {

    private final String name;

    private final List<FlatEndpoint> endpoints;

    /** True if a port map left a port of this net open */
    private final boolean open;

    public FlatNet(String name, List<FlatEndpoint> endpoints, boolean open) {
        this.name = name;
        this.endpoints = Collections.unmodifiableList(new ArrayList<>(endpoints));
        this.open = open;
    }

    public FlatNet(String name, List<FlatEndpoint> endpoints) {
        this(name, endpoints, false);
    }

    /**
     * @return Hierarchical name of the shallowest signal or port on the net.
     */
    public String getName() {
        return name;
    }

    /**
     * @return True if the net reaches a composite instance port that was
     *         associated with {@code open}. Such a net is undriven on purpose.
     */
    public boolean isOpen() {
        return open;
    }

    public List<FlatEndpoint> getEndpoints() {
        return endpoints;
    }

    public List<FlatEndpoint> getDrivers() {
        List<FlatEndpoint> drivers = new ArrayList<>();
        for (FlatEndpoint e : endpoints) {
            if (e.isDriver()) {
                drivers.add(e);
            }
        }
        return drivers;
    }

    public List<FlatEndpoint> getReceivers() {
        List<FlatEndpoint> receivers = new ArrayList<>();
        for (FlatEndpoint e : endpoints) {
            if (e.isReceiver()) {
                receivers.add(e);
            }
        }
        return receivers;
    }

    @Override
    public String toString() {
        return name + " " + endpoints;
    }
}
