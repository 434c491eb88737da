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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The {@link Indexer indexer} of a joined {@link Frame frame}. It projects each {@link JoinResult} column to its left
 * value if present, else its right value, and indexes the projected row with the wrapped indexer. Columns that do not
 * hold a join-result are passed through unchanged, so plain probe rows can be used to look up joined rows.
 *
 * @see Frame#join(Frame)
 */
public class JoinResultIndexer implements Indexer {
    private final Indexer delegate;
    
    /**
     * Creates a new join-result-indexer that wraps the given indexer.
     *
     * @param delegate the indexer of the left and right contents
     */
    public JoinResultIndexer(Indexer delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }
    
    /**
     * Returns the wrapped indexer.
     *
     * @return the wrapped indexer
     */
    public Indexer delegate() {
        return delegate;
    }
    
    @Override
    public Key index(Row row) {
        Map<String, Object> projection = new LinkedHashMap<>(row.values.size());
        row.values.forEach((column, value) -> {
            if (value instanceof JoinResult) {
                JoinResult result = (JoinResult) value;
                projection.put(column, result.hasLeft() ? result.left() : result.right());
            } else {
                projection.put(column, value);
            }
        });
        return delegate.index(Row.of(projection));
    }
    
    @Override
    public String toString() {
        return "JoinResultIndexer[" + delegate + "]";
    }
}
