package me.golemcore.toolrouter.domain.costmodel;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.List;

/**
 * Verifies that a cost expression never decreases as {@code N} grows, by
 * sampling a fixed grid of item counts. Used at catalog import time only.
 */
public final class MonotonicityCheck {

    static final double[] SAMPLE_GRID = {
            0, 1, 2, 5, 10, 50, 100, 500, 1_000, 10_000, 100_000, 1_000_000
    };

    private static final double TOLERANCE = 1e-9;

    private MonotonicityCheck() {
    }

    /**
     * Returns a human-readable description of every decrease found between
     * consecutive grid points; empty when the expression is non-decreasing.
     */
    public static List<String> findDecreases(CostExpression expression) {
        List<String> violations = new ArrayList<>();
        double previousN = SAMPLE_GRID[0];
        double previous = expression.evaluate(previousN);
        for (int i = 1; i < SAMPLE_GRID.length; i++) {
            double n = SAMPLE_GRID[i];
            double value = expression.evaluate(n);
            if (value < previous - TOLERANCE * Math.max(1.0, Math.abs(previous))) {
                violations.add(String.format("'%s' decreases from %.4f at N=%.0f to %.4f at N=%.0f",
                        expression.getSource(), previous, previousN, value, n));
            }
            previous = value;
            previousN = n;
        }
        return violations;
    }

    public static boolean isNonDecreasing(CostExpression expression) {
        return findDecreases(expression).isEmpty();
    }
}
