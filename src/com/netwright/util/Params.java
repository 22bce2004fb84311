/*
 * Original work: Copyright (c) 2023, Advanced Micro Devices, Inc.
 *                Author: Chris Lavin, AMD AECG Research Labs.
 *                This file is derived from RapidWright.
 * Modified work: Copyright (c) 2026, NetWright contributors.
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

/**
 * Aims to be a centralized helper class to manage global NetWright settings.
 */
public class Params {

    public static String NW_ALLOW_MULTI_DRIVER_NAME = "NW_ALLOW_MULTI_DRIVER";

    public static String NW_UNCONNECTED_PORT_SEVERITY_NAME = "NW_UNCONNECTED_PORT_SEVERITY";

    public static String NW_MAX_EXPANSION_DEPTH_NAME = "NW_MAX_EXPANSION_DEPTH";

    public static String NW_VERBOSE_NAME = "NW_VERBOSE";

    public static int NW_DEFAULT_MAX_EXPANSION_DEPTH = 64;

    /**
     * Flag to let several drivers share one net during elaboration. Off by default, in which
     * case a second driver on a net is reported as an error.
     */
    public static boolean NW_ALLOW_MULTI_DRIVER = isParamSet(NW_ALLOW_MULTI_DRIVER_NAME);

    /**
     * Severity (warning or error) used for ports left unconnected. Null means the built-in
     * default (error).
     */
    public static String NW_UNCONNECTED_PORT_SEVERITY = getParamValue(NW_UNCONNECTED_PORT_SEVERITY_NAME);

    /**
     * Maximum depth of the instance hierarchy before elaboration gives up on a branch.
     */
    public static int NW_MAX_EXPANSION_DEPTH = getParamOrDefaultIntSetting(NW_MAX_EXPANSION_DEPTH_NAME,
            NW_DEFAULT_MAX_EXPANSION_DEPTH);

    /**
     * Prints phase runtimes of parsing and elaboration to standard out.
     */
    public static boolean NW_VERBOSE = isParamSet(NW_VERBOSE_NAME);

    /**
     * Checks if the named NetWright parameter is set via an environment variable
     * or by a JVM parameter of the same name.
     *
     * @param key Name of the global NetWright parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * Checks if a parameter is set by examining the provided value.
     *
     * @param value An environment variable or JVM parameter value
     * @return True if (1) value is not null, (2) is not an empty string, (3) is not
     *         0 and (4) is not false (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !( value == null
               || value.length() == 0
               || value.equals("0")
               || value.toLowerCase().equals("false")
               );
    }

    /**
     * Gets the integer value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set integer value of the parameter, or null if none was set. If
     *         the property is set to a value that is not a parsable integer, a
     *         warning message is produced and returns null.
     */
    public static Integer getParamIntValue(String key) {
        String envValue = getParamValue(key);
        if (envValue != null) {
            try {
                return Integer.parseInt(envValue.trim());
            } catch (NumberFormatException e) {
                MessageGenerator.briefError("WARNING: Couldn't interpret the value '" + envValue
                        + "' from the parameter '" + key + "' as an integer.");
            }
        }
        return null;
    }

    /**
     * Gets the string value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    /**
     * Checks the parameter value of the provided key. If it is set, it returns the
     * set value. Otherwise it will return the default value.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The default value to return if the paramter is not set.
     * @return The system parameter value if is set, otherwise it returns
     *         defaultValue.
     */
    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer setValue = getParamIntValue(key);
        return setValue == null ? defaultValue : setValue;
    }

}
