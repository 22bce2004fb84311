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

package com.netwright.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TestParams {

    @ParameterizedTest
    @CsvSource({
        "1, true",
        "yes, true",
        "TRUE, true",
        "0, false",
        "false, false",
        "False, false",
        "'', false",
    })
    void testIsSet(String value, boolean expected) {
        Assertions.assertEquals(expected, Params.isSet(value));
    }

    @Test
    void testNullIsNotSet() {
        Assertions.assertFalse(Params.isSet(null));
    }

    @Test
    void testIntSettingFromProperty() {
        String key = "NW_TEST_INT_SETTING";
        try {
            Assertions.assertEquals(5, Params.getParamOrDefaultIntSetting(key, 5));
            System.setProperty(key, " 17 ");
            Assertions.assertEquals(17, Params.getParamOrDefaultIntSetting(key, 5));
            System.setProperty(key, "seventeen");
            Assertions.assertEquals(5, Params.getParamOrDefaultIntSetting(key, 5));
            Assertions.assertTrue(Params.isParamSet(key));
        } finally {
            System.clearProperty(key);
        }
        Assertions.assertFalse(Params.isParamSet(key));
    }
}
