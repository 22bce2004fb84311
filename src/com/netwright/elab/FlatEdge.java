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
 * One driver endpoint and the endpoints it reaches.
 */
public class FlatEdge {

    private final FlatEndpoint driver;

    private final List<FlatEndpoint> receivers;

    private final String netName;

    public FlatEdge(FlatEndpoint driver, List<FlatEndpoint> receivers, String netName) {
        this.driver = driver;
        this.receivers = Collections.unmodifiableList(new ArrayList<>(receivers));
        this.netName = netName;
    }

    public FlatEndpoint getDriver() {
        return driver;
    }

    public List<FlatEndpoint> getReceivers() {
        return receivers;
    }

    public String getNetName() {
        return netName;
    }

    @Override
    public String toString() {
        return driver + " -> " + receivers;
    }
}
