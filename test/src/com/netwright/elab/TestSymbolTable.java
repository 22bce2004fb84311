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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.netwright.qhdl.QHDLDirection;
import com.netwright.qhdl.QHDLDuplicateNameException;
import com.netwright.qhdl.QHDLLocation;
import com.netwright.qhdl.QHDLPort;
import com.netwright.qhdl.QHDLSignal;
import com.netwright.qhdl.QHDLUnknownNameException;

class TestSymbolTable {

    @Test
    void testDeclareAndLookup() {
        SymbolTable table = new SymbolTable();
        Scope entity = table.createScope("entity E", null);
        QHDLPort port = new QHDLPort("In1", QHDLDirection.IN, "fieldmode");
        Symbol s = table.declare(entity, "In1", SymbolKind.PORT, port, null);

        Assertions.assertSame(s, table.lookup(entity, "IN1"));
        Assertions.assertSame(port, s.getPayload(QHDLPort.class));
        Assertions.assertSame(entity, s.getScope());
        Assertions.assertEquals(0, s.getIndex());
        Assertions.assertEquals(1, table.getScopeCount());
    }

    @Test
    void testNestedScopeSeesParent() {
        SymbolTable table = new SymbolTable();
        Scope entity = table.createScope("entity E", null);
        Scope arch = table.createScope("architecture a of E", entity);
        table.declare(entity, "In1", SymbolKind.PORT, new QHDLPort("In1", QHDLDirection.IN, "t"), null);
        table.declare(arch, "s1", SymbolKind.SIGNAL, new QHDLSignal("s1", "t"), null);

        Assertions.assertNotNull(table.find(arch, "in1"));
        Assertions.assertNull(arch.getLocal("in1"));
        Assertions.assertNull(table.find(entity, "s1"));
        Assertions.assertEquals(1, arch.getSymbols(SymbolKind.SIGNAL).size());
        Assertions.assertTrue(arch.getSymbols(SymbolKind.PORT).isEmpty());
    }

    @Test
    void testDuplicateInSameScope() {
        SymbolTable table = new SymbolTable();
        Scope scope = table.createScope("architecture a of E", null);
        table.declare(scope, "s1", SymbolKind.SIGNAL, new QHDLSignal("s1", "t"), new QHDLLocation("x", 3, 5));
        QHDLDuplicateNameException e = Assertions.assertThrows(QHDLDuplicateNameException.class,
                () -> table.declare(scope, "S1", SymbolKind.INSTANCE, null, new QHDLLocation("x", 9, 1)));
        Assertions.assertEquals("S1", e.getName());
        Assertions.assertTrue(e.getMessage().contains("x:3:5"));
        Assertions.assertEquals(1, scope.getSymbols().size());
    }

    @Test
    void testShadowingEnclosingNameIsDuplicate() {
        SymbolTable table = new SymbolTable();
        Scope entity = table.createScope("entity E", null);
        Scope arch = table.createScope("architecture a of E", entity);
        table.declare(entity, "Out1", SymbolKind.PORT, new QHDLPort("Out1", QHDLDirection.OUT, "t"), null);
        Assertions.assertThrows(QHDLDuplicateNameException.class,
                () -> table.declare(arch, "out1", SymbolKind.SIGNAL, new QHDLSignal("out1", "t"), null));
    }

    @Test
    void testUnknownName() {
        SymbolTable table = new SymbolTable();
        Scope scope = table.createScope("architecture a of E", null);
        QHDLUnknownNameException e = Assertions.assertThrows(QHDLUnknownNameException.class,
                () -> table.lookup(scope, "nowhere"));
        Assertions.assertEquals("nowhere", e.getName());
        Assertions.assertNull(table.find(scope, "nowhere"));
    }
}
