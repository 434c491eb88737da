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
 * The value of every column of a joined {@link Frame frame}: the column's value in the left frame, paired with its
 * value in the right frame. A side is absent ({@code null}) if that frame had no row for the key, or its row lacked the
 * column.
 *
 * @see Frame#join(Frame)
 */
public final class JoinResult {
    private final Object left;
    private final Object right;
    
    private JoinResult(Object left, Object right) {
        this.left = left;
        this.right = right;
    }
    
    /**
     * Returns a join-result with the given left and right values.
     *
     * @param left the left value, or {@code null} if absent
     * @param right the right value, or {@code null} if absent
     * @return a join-result
     */
    public static JoinResult of(Object left, Object right) {
        return new JoinResult(left, right);
    }
    
    /**
     * Returns a join-result with the given left value and an absent right value.
     *
     * @param value the left value
     * @return a join-result
     */
    public static JoinResult left(Object value) {
        return new JoinResult(value, null);
    }
    
    /**
     * Returns a join-result with an absent left value and the given right value.
     *
     * @param value the right value
     * @return a join-result
     */
    public static JoinResult right(Object value) {
        return new JoinResult(null, value);
    }
    
    /**
     * Returns the left value, or {@code null} if absent.
     *
     * @return the left value
     */
    public Object left() {
        return left;
    }
    
    /**
     * Returns the right value, or {@code null} if absent.
     *
     * @return the right value
     */
    public Object right() {
        return right;
    }
    
    /**
     * Returns {@code true} if the left value is present.
     *
     * @return {@code true} if the left value is present
     */
    public boolean hasLeft() {
        return left != null;
    }
    
    /**
     * Returns {@code true} if the right value is present.
     *
     * @return {@code true} if the right value is present
     */
    public boolean hasRight() {
        return right != null;
    }
    
    /**
     * Returns a join-result with this result's left value and the given right value.
     *
     * @param value the right value
     * @return a join-result
     */
    public JoinResult withRight(Object value) {
        return new JoinResult(left, value);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JoinResult))
            return false;
        JoinResult other = (JoinResult) o;
        return Objects.equals(left, other.left) && Objects.equals(right, other.right);
    }
    
    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(left) + Objects.hashCode(right);
    }
    
    /**
     * Returns a string representation of this join-result, such as {@code "JoinResult{Left: a, Right: b}"}. Absent
     * sides are omitted.
     *
     * @return a string representation of this join-result
     */
    @Override
    public String toString() {
        if (left != null && right != null)
            return "JoinResult{Left: " + left + ", Right: " + right + "}";
        if (left != null)
            return "JoinResult{Left: " + left + "}";
        if (right != null)
            return "JoinResult{Right: " + right + "}";
        return "JoinResult{}";
    }
}
