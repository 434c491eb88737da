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

/**
 * Thrown when two {@link Key keys} of incompatible shapes or kinds are compared, for instance a text key against an
 * integer key. This usually means that rows or probes presented to the same frame were indexed into different key
 * representations.
 */
public class KeyTypeMismatchException extends FrameException {
    private final Key left;
    private final Key right;
    
    KeyTypeMismatchException(Key left, Key right) {
        super("Cannot compare key " + left + " " + describe(left) + " with key " + right + " " + describe(right));
        this.left = left;
        this.right = right;
    }
    
    private static String describe(Key key) {
        if (key instanceof Key.Scalar)
            return "(" + ((Key.Scalar) key).kind() + ")";
        return "(" + key.getClass().getSimpleName() + ")";
    }
    
    /**
     * Returns the key on which the comparison was invoked.
     *
     * @return the left-hand key
     */
    public Key left() {
        return left;
    }
    
    /**
     * Returns the key passed to the comparison.
     *
     * @return the right-hand key
     */
    public Key right() {
        return right;
    }
}
