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

import java.util.*;

/**
 * An {@link Indexer indexer} that projects a fixed, ordered list of columns. A row is indexed to {@link Key#none()}
 * if no columns are configured, to a {@link Key.Scalar scalar} key if one column is configured, and otherwise to a
 * {@link Key.Composite composite} of scalar keys in column order.
 *
 * <p>A column-indexer remembers the type of the first non-null value it sees for each column, and rejects later rows
 * presenting a value of a different type for that column with {@link TypeDriftException}. The remembered types are
 * only updated by rows that index successfully.
 *
 * <p>Because indexing updates the remembered types, a column-indexer is not safe for concurrent use.
 */
public class ColumnIndexer implements Indexer {
    private final List<String> columns;
    private final Map<String, Class<?>> types = new HashMap<>();
    
    /**
     * Creates a new column-indexer for the given columns.
     *
     * @param columns the columns to project, in key order
     */
    public ColumnIndexer(String... columns) {
        this(Arrays.asList(columns));
    }
    
    /**
     * Creates a new column-indexer for the given columns.
     *
     * @param columns the columns to project, in key order
     */
    public ColumnIndexer(List<String> columns) {
        List<String> copy = new ArrayList<>(columns.size());
        for (String column : columns)
            copy.add(Objects.requireNonNull(column));
        this.columns = Collections.unmodifiableList(copy);
    }
    
    /**
     * Returns the projected columns, in key order.
     *
     * @return the projected columns
     */
    public List<String> columns() {
        return columns;
    }
    
    /**
     * Returns the type fixed for the given column by an earlier row, or {@code null} if no row has fixed it yet.
     *
     * @param column the column name
     * @return the type fixed for the column, or {@code null}
     */
    public Class<?> expectedType(String column) {
        return types.get(column);
    }
    
    /**
     * Returns the key of the given row.
     *
     * @param row the row to index
     * @return the key of the row
     * @throws MissingColumnException if the row lacks a projected column
     * @throws TypeDriftException if a projected value's type differs from the type fixed for its column
     * @throws UnsupportedKeyTypeException if a projected value cannot be converted to a key
     */
    @Override
    public Key index(Row row) {
        Object[] vals = new Object[columns.size()];
        Class<?>[] seen = new Class<?>[columns.size()];
        for (int i = 0; i < vals.length; i++) {
            String column = columns.get(i);
            if (!row.contains(column))
                throw new MissingColumnException(column, row);
            Object val = row.getOrNull(column);
            if (val != null) {
                Class<?> expected = types.get(column);
                if (expected != null && expected != val.getClass())
                    throw new TypeDriftException(column, expected, val);
                seen[i] = val.getClass();
            }
            vals[i] = val;
        }
        Key key = Key.of(vals);
        for (int i = 0; i < seen.length; i++)
            if (seen[i] != null)
                types.putIfAbsent(columns.get(i), seen[i]);
        return key;
    }
    
    @Override
    public String toString() {
        return "ColumnIndexer" + columns;
    }
}
