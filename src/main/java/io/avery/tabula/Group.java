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
 * An immutable, ordered list of {@link Row rows} that share a grouping key. Each row of a frame produced by
 * {@link Frame#groupBy(Indexer)} holds exactly one column, {@link #COLUMN}, whose value is a group.
 */
public final class Group extends AbstractList<Row> implements RandomAccess {
    /**
     * The column in which a grouped frame stores each group.
     */
    public static final String COLUMN = "Group";
    
    private final Row[] rows;
    
    Group(Row[] rows) {
        this.rows = rows;
    }
    
    /**
     * Returns a group of the given rows, in order.
     *
     * @param rows the rows
     * @return a group of the rows
     */
    public static Group of(Row... rows) {
        return of(Arrays.asList(rows));
    }
    
    /**
     * Returns a group of the given rows, in order.
     *
     * @param rows the rows
     * @return a group of the rows
     */
    public static Group of(Collection<Row> rows) {
        Row[] arr = rows.toArray(new Row[0]);
        for (Row row : arr)
            Objects.requireNonNull(row);
        return new Group(arr);
    }
    
    /**
     * Returns an unmodifiable view of the rows of this group, in order.
     *
     * @return the rows of this group
     */
    public List<Row> rows() {
        return Collections.unmodifiableList(Arrays.asList(rows));
    }
    
    @Override
    public Row get(int index) {
        return rows[index];
    }
    
    @Override
    public int size() {
        return rows.length;
    }
    
    @Override
    public String toString() {
        return "Group" + super.toString();
    }
}
