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
 * An immutable mapping from column names to values. Rows are the payload stored in a {@link Frame frame}, and also
 * serve as lookup probes and range bounds, in which case they need only contain the columns that the frame's
 * {@link Indexer indexer} projects.
 *
 * <p>Because rows are immutable, a row may be shared by any number of frames, such as a frame and the frames derived
 * from it by {@link Frame#withIndexer(Indexer)} or {@link Frame#groupBy(Indexer)}. "Updating" a row means building a
 * new row with {@link #with(String, Object)} or {@link #without(String)}, and {@link Frame#put(Row) putting} it.
 *
 * <p>Column values may be {@code null}. The column order of a row is its insertion order, which only affects
 * {@code toString()}; two rows are equal if they map the same columns to equal values.
 */
public final class Row {
    private static final Row EMPTY = new Row(new LinkedHashMap<>());
    
    final Map<String, Object> values;
    
    private Row(LinkedHashMap<String, Object> values) {
        this.values = values;
    }
    
    /**
     * Returns a row with no columns.
     *
     * @return a row with no columns
     */
    public static Row empty() {
        return EMPTY;
    }
    
    /**
     * Returns a row of the given alternating column names and values, for example
     * {@code Row.of("id", 1, "name", "foo")}. Later associations for the same column replace earlier ones.
     *
     * @param columnsAndValues column names on even positions, each followed by its value
     * @return a row of the given columns and values
     * @throws IllegalArgumentException if an odd number of arguments is given, or a column name is not a string
     */
    public static Row of(Object... columnsAndValues) {
        if (columnsAndValues.length % 2 == 1)
            throw new IllegalArgumentException("Expected column-value pairs, but got an odd number of arguments: "
                                                   + Arrays.toString(columnsAndValues));
        LinkedHashMap<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            if (!(columnsAndValues[i] instanceof String))
                throw new IllegalArgumentException("Expected a column name at position " + i + ", but got: "
                                                       + columnsAndValues[i]);
            values.put((String) columnsAndValues[i], columnsAndValues[i+1]);
        }
        return new Row(values);
    }
    
    /**
     * Returns a row containing the associations of the given map, in the map's iteration order.
     *
     * @param values the column values
     * @return a row containing the given associations
     */
    public static Row of(Map<String, ?> values) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values.size());
        values.forEach((column, value) -> copy.put(Objects.requireNonNull(column), value));
        return new Row(copy);
    }
    
    /**
     * Returns the value of the given column, or throws {@link NoSuchElementException} if this row does not contain the
     * column.
     *
     * @param column the column name
     * @return the value of the column, possibly {@code null}
     * @throws NoSuchElementException if this row does not contain the column
     */
    public Object get(String column) {
        Object value = values.get(column);
        if (value == null && !values.containsKey(column))
            throw new NoSuchElementException("Invalid column: " + column);
        return value;
    }
    
    /**
     * Returns the value of the given column, or {@code null} if this row does not contain the column.
     *
     * @param column the column name
     * @return the value of the column, or {@code null}
     */
    public Object getOrNull(String column) {
        return values.get(column);
    }
    
    /**
     * Returns {@code true} if this row contains the given column.
     *
     * @param column the column name
     * @return {@code true} if this row contains the column
     */
    public boolean contains(String column) {
        return values.containsKey(column);
    }
    
    /**
     * Returns an unmodifiable view of the column names of this row, in insertion order.
     *
     * @return the column names
     */
    public Set<String> columns() {
        return Collections.unmodifiableSet(values.keySet());
    }
    
    /**
     * Returns the number of columns in this row.
     *
     * @return the number of columns
     */
    public int size() {
        return values.size();
    }
    
    /**
     * Returns an unmodifiable view of this row as a map from column names to values.
     *
     * @return this row as a map
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
    
    /**
     * Returns a row with the same associations as this row, except that the given column is associated with the given
     * value. If this row already contains the column, the column keeps its position.
     *
     * @param column the column name
     * @param value the value
     * @return a row with the given association
     */
    public Row with(String column, Object value) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(Objects.requireNonNull(column), value);
        return new Row(copy);
    }
    
    /**
     * Returns a row with the same associations as this row, except for the given column.
     *
     * @param column the column name
     * @return a row without the given column
     */
    public Row without(String column) {
        if (!values.containsKey(column))
            return this;
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove(column);
        return new Row(copy);
    }
    
    /**
     * Returns {@code true} if and only if the given object is a row that maps the same columns to equal values.
     *
     * @param o the object to be compared for equality with this row
     * @return {@code true} if the given object is equal to this row
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Row))
            return false;
        return values.equals(((Row) o).values);
    }
    
    /**
     * Returns the hash code value for this row, derived from its column names and values.
     *
     * @return the hash code value for this row
     */
    @Override
    public int hashCode() {
        return values.hashCode();
    }
    
    /**
     * Returns a string representation of this row. The string representation consists of a list of column-value
     * associations, in insertion order, enclosed in the braces of {@code "Row{}"}. Adjacent associations are separated
     * by the characters {@code ", "} (comma and space).
     *
     * @return a string representation of this row
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Row{");
        String delimiter = "";
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            sb.append(delimiter).append(entry.getKey()).append('=').append(entry.getValue());
            delimiter = ", ";
        }
        return sb.append('}').toString();
    }
}
