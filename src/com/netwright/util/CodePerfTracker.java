/*
 * Original work: Copyright (c) 2017-2022, Xilinx, Inc.
 *                Copyright (c) 2022, Advanced Micro Devices, Inc.
 *                Author: Chris Lavin, Xilinx Research Labs.
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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Simple tool for measuring code runtime of named segments and reporting.
 */
public class CodePerfTracker {

    private String name;

    private List<Long> runtimes;

    private List<String> segmentNames;

    private Map<String,Long> inflightTimes;

    private int maxSegmentNameSize = 24;

    private boolean printProgress = true;

    private boolean verbose = true;

    public static final CodePerfTracker SILENT;

    static {
        SILENT = new CodePerfTracker("",false);
        SILENT.setVerbose(false);
    }

    public CodePerfTracker(String name) {
        init(name,true);
    }

    public CodePerfTracker(String name, boolean printProgress) {
        init(name,printProgress);
    }

    /**
     * Creates a tracker that prints only when {@link Params#NW_VERBOSE} is set.
     * @param name Title of the tracked operation.
     * @return A verbose tracker or {@link #SILENT}.
     */
    public static CodePerfTracker fromParams(String name) {
        return Params.NW_VERBOSE ? new CodePerfTracker(name, true) : SILENT;
    }

    public void init(String name, boolean printProgress) {
        this.name = name;
        this.printProgress = printProgress;
        runtimes = new ArrayList<>();
        segmentNames = new ArrayList<>();
        inflightTimes = new HashMap<>();
        if (this.printProgress && isVerbose() && name != null) {
            MessageGenerator.printHeader(name);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public String getName() {
        return name;
    }

    public CodePerfTracker start(String segmentName) {
        if (!verbose) return this;
        inflightTimes.put(segmentName, System.nanoTime());
        return this;
    }

    public CodePerfTracker stop() {
        if (!verbose) return this;
        if (inflightTimes.isEmpty()) {
            throw new IllegalStateException("No segment was started on tracker " + name);
        }
        String segmentName = null;
        long start = Long.MIN_VALUE;
        for (Map.Entry<String, Long> e : inflightTimes.entrySet()) {
            if (e.getValue() > start) {
                start = e.getValue();
                segmentName = e.getKey();
            }
        }
        return stop(segmentName);
    }

    public CodePerfTracker stop(String segmentName) {
        if (!verbose) return this;
        Long start = inflightTimes.remove(segmentName);
        if (start == null) {
            throw new IllegalStateException("Segment " + segmentName + " was never started");
        }
        long elapsed = System.nanoTime() - start;
        runtimes.add(elapsed);
        segmentNames.add(segmentName);
        maxSegmentNameSize = Math.max(maxSegmentNameSize, segmentName.length());
        if (printProgress) {
            print(segmentName, elapsed);
        }
        return this;
    }

    /**
     * @return Total of all completed segment runtimes in nanoseconds.
     */
    public long getTotalRuntime() {
        long total = 0;
        for (Long l : runtimes) {
            total += l;
        }
        return total;
    }

    private void print(String segmentName, long nanos) {
        MessageGenerator.briefMessage(String.format("%" + maxSegmentNameSize + "s: %10.3fs",
                segmentName, nanos / 1e9));
    }

    public void printSummary() {
        if (!verbose) return;
        if (!printProgress) {
            for (int i = 0; i < runtimes.size(); i++) {
                print(segmentNames.get(i), runtimes.get(i));
            }
        }
        MessageGenerator.briefMessage("------------------------------------------------------------------------------");
        print("*Total*", getTotalRuntime());
    }
}
