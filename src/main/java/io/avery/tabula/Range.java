/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.tabula;

import java.util.Objects;

/**
 * The bounds of an ascending traversal over a {@link Frame frame}: an optional inclusive lower bound and an optional
 * exclusive upper bound. Bounds are probe rows, indexed through the frame's {@link Indexer indexer} when the range is
 * used. For example:
 *
 * <pre>{@code
 *     frame.range(Range.greaterOrEqual(Row.of("id", 10)).lessThan(Row.of("id", 20)));
 * }</pre>
 */
public final class Range {
    private static final Range ALL = new Range(null, null);
    
    final Row lower;
    final Row upper;
    
    private Range(Row lower, Row upper) {
        this.lower = lower;
        this.upper = upper;
    }
    
    /**
     * Returns the unbounded range, which visits every row.
     *
     * @return the unbounded range
     */
    public static Range all() {
        return ALL;
    }
    
    /**
     * Returns a range of the rows whose key is greater than or equal to the key of the given probe.
     *
     * @param probe the inclusive lower bound
     * @return a range with the given lower bound
     */
    public static Range greaterOrEqual(Row probe) {
        return ALL.andGreaterOrEqual(probe);
    }
    
    /**
     * Returns a range of the rows whose key is less than the key of the given probe.
     *
     * @param probe the exclusive upper bound
     * @return a range with the given upper bound
     */
    public static Range lessThan(Row probe) {
        return ALL.andLessThan(probe);
    }
    
    /**
     * Returns a range with the same upper bound as this range, and the given inclusive lower bound.
     *
     * @param probe the inclusive lower bound
     * @return a range with the given lower bound
     */
    public Range andGreaterOrEqual(Row probe) {
        return new Range(Objects.requireNonNull(probe), upper);
    }
    
    /**
     * Returns a range with the same lower bound as this range, and the given exclusive upper bound.
     *
     * @param probe the exclusive upper bound
     * @return a range with the given upper bound
     */
    public Range andLessThan(Row probe) {
        return new Range(lower, Objects.requireNonNull(probe));
    }
    
    @Override
    public String toString() {
        return "Range[" + (lower == null ? "*" : lower) + ", " + (upper == null ? "*" : upper) + ")";
    }
}
