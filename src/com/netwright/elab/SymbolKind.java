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

/**
 * What a declared name stands for.
 */
public enum SymbolKind {
    GENERIC,
    PORT,
    SIGNAL,
    COMPONENT,
    INSTANCE;

    /**
     * @return True for names that can be wired: signals and ports.
     */
    public boolean isConnectable() {
        return this == PORT || this == SIGNAL;
    }

    public String getDescription() {
        return name().toLowerCase();
    }
}
