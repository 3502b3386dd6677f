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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiled arithmetic expression over the scale parameter {@code N}, used for
 * pattern time and cost estimates such as {@code 2000 + 0.5 * N} or
 * {@code ceil(N / 100)}.
 *
 * <p>
 * Compiled trees are immutable and cached by source text, so evaluating the
 * same pattern on every request does not re-parse it.
 *
 * @see CostExpressionParser
 */
public final class CostExpression {

    private static final int MAX_CACHED = 4096;
    private static final Map<String, CostExpression> COMPILED = new ConcurrentHashMap<>();

    private final String source;
    private final Node root;

    CostExpression(String source, Node root) {
        this.source = source;
        this.root = root;
    }

    /**
     * Parses {@code source}, reusing a previously compiled tree when available.
     *
     * @throws CostExpressionException
     *             if the expression is malformed
     */
    public static CostExpression compile(String source) {
        if (source == null || source.isBlank()) {
            throw new CostExpressionException("Expression is empty", -1);
        }
        String key = source.trim();
        CostExpression cached = COMPILED.get(key);
        if (cached != null) {
            return cached;
        }
        CostExpression compiled = new CostExpressionParser(key).parse();
        if (COMPILED.size() < MAX_CACHED) {
            COMPILED.putIfAbsent(key, compiled);
        }
        return compiled;
    }

    /**
     * Evaluates the expression for the given item count.
     *
     * @throws CostExpressionException
     *             if the result is not a finite number
     */
    public double evaluate(double n) {
        double value = root.eval(n);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new CostExpressionException("Expression '" + source + "' is not finite for N=" + n, -1);
        }
        return value;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }

    /**
     * Node of the compiled expression tree.
     */
    interface Node {
        double eval(double n);
    }
}
