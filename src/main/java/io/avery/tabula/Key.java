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
 * A totally-ordered value that determines the position of a {@link Row row} in a {@link Frame frame}. Keys are
 * computed from rows by an {@link Indexer indexer}, and are never stored redundantly with the row.
 *
 * <p>There are three shapes of key:
 * <ul>
 *     <li>{@link NoKey} - the key of an indexer that projects no columns. It compares less than every other key.
 *     <li>{@link Scalar} - wraps a single value of one of the supported {@link Kind kinds}. A scalar is only
 *     comparable to another scalar of the same kind.
 *     <li>{@link Composite} - an ordered tuple of keys, compared element-wise. If all shared positions are equal, the
 *     shorter composite is less than the longer one.
 * </ul>
 *
 * <p>Comparing keys of incompatible shapes or kinds throws {@link KeyTypeMismatchException}, which propagates to the
 * caller of the frame operation that triggered the comparison. {@code equals()} never throws; keys of different
 * shapes or kinds are simply unequal.
 */
public abstract class Key implements Comparable<Key> {
    Key() {} // Prevent subclassing outside this package
    
    /**
     * The kind of value wrapped by a {@link Scalar scalar} key. Scalars of different kinds are not comparable.
     */
    public enum Kind {
        /** {@code Byte}, {@code Short}, {@code Integer} and {@code Long} values, compared as {@code long}. */
        INTEGER,
        /** {@code Float} and {@code Double} values, compared as by {@link Double#compare}. */
        FLOAT,
        /** {@code String} and {@code Character} values, compared lexicographically. */
        TEXT,
        /** {@code Boolean} values, {@code false} before {@code true}. */
        BOOLEAN
    }
    
    /**
     * Returns the key that compares less than every other key.
     *
     * @return the no-key sentinel
     */
    public static Key none() {
        return NoKey.INSTANCE;
    }
    
    /**
     * Returns a scalar key wrapping the given value, or throws {@link UnsupportedKeyTypeException} if the value is not
     * of a supported {@link Kind kind}.
     *
     * @param value the value to wrap
     * @return a scalar key
     * @throws UnsupportedKeyTypeException if the value cannot be converted to a key
     */
    public static Scalar scalar(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)
            return new Scalar(Kind.INTEGER, ((Number) value).longValue());
        if (value instanceof Double || value instanceof Float)
            return new Scalar(Kind.FLOAT, ((Number) value).doubleValue());
        if (value instanceof String)
            return new Scalar(Kind.TEXT, value);
        if (value instanceof Character)
            return new Scalar(Kind.TEXT, value.toString());
        if (value instanceof Boolean)
            return new Scalar(Kind.BOOLEAN, value);
        throw new UnsupportedKeyTypeException(value);
    }
    
    /**
     * Returns a composite key of the given keys, in order.
     *
     * @param keys the constituent keys
     * @return a composite key
     */
    public static Composite composite(Key... keys) {
        return composite(Arrays.asList(keys));
    }
    
    /**
     * Returns a composite key of the given keys, in order.
     *
     * @param keys the constituent keys
     * @return a composite key
     */
    public static Composite composite(List<? extends Key> keys) {
        List<Key> copy = new ArrayList<>(keys.size());
        for (Key key : keys)
            copy.add(Objects.requireNonNull(key));
        return new Composite(copy);
    }
    
    /**
     * Returns the key for the given values: {@link #none()} if there are no values, a {@link Scalar scalar} if there
     * is one value, and otherwise a {@link Composite composite} of scalars.
     *
     * @param values the values
     * @return the key for the values
     * @throws UnsupportedKeyTypeException if any value cannot be converted to a key
     */
    public static Key of(Object... values) {
        return of(Arrays.asList(values));
    }
    
    /**
     * Returns the key for the given values, as by {@link #of(Object...)}.
     *
     * @param values the values
     * @return the key for the values
     * @throws UnsupportedKeyTypeException if any value cannot be converted to a key
     */
    public static Key of(List<?> values) {
        switch (values.size()) {
            case 0: return none();
            case 1: return scalar(values.get(0));
            default:
                List<Key> keys = new ArrayList<>(values.size());
                for (Object value : values)
                    keys.add(scalar(value));
                return new Composite(keys);
        }
    }
    
    /**
     * Compares this key with the given key for order.
     *
     * @param other the key to be compared
     * @return a negative integer, zero, or a positive integer as this key is less than, equal to, or greater than
     * the given key
     * @throws KeyTypeMismatchException if the keys are of incompatible shapes or kinds
     */
    @Override
    public abstract int compareTo(Key other);
    
    /**
     * The key of an indexer that projects no columns.
     */
    public static final class NoKey extends Key {
        static final NoKey INSTANCE = new NoKey();
        
        private NoKey() {}
        
        @Override
        public int compareTo(Key other) {
            return other instanceof NoKey ? 0 : -1;
        }
        
        @Override
        public boolean equals(Object o) {
            return o instanceof NoKey;
        }
        
        @Override
        public int hashCode() {
            return 0;
        }
        
        @Override
        public String toString() {
            return "()";
        }
    }
    
    /**
     * A key wrapping a single value.
     */
    public static final class Scalar extends Key {
        final Kind kind;
        final Object value;
        
        Scalar(Kind kind, Object value) {
            this.kind = kind;
            this.value = value;
        }
        
        /**
         * Returns the kind of this scalar's value.
         *
         * @return the kind of this scalar's value
         */
        public Kind kind() {
            return kind;
        }
        
        /**
         * Returns this scalar's value, in its normalized form: {@code Long} for {@link Kind#INTEGER}, {@code Double}
         * for {@link Kind#FLOAT}, {@code String} for {@link Kind#TEXT}, and {@code Boolean} for {@link Kind#BOOLEAN}.
         *
         * @return this scalar's value
         */
        public Object value() {
            return value;
        }
        
        @Override
        public int compareTo(Key other) {
            if (other instanceof NoKey)
                return 1;
            if (!(other instanceof Scalar) || ((Scalar) other).kind != kind)
                throw new KeyTypeMismatchException(this, other);
            Object otherValue = ((Scalar) other).value;
            switch (kind) {
                case INTEGER: return Long.compare((Long) value, (Long) otherValue);
                case FLOAT:   return Double.compare((Double) value, (Double) otherValue);
                case TEXT:    return ((String) value).compareTo((String) otherValue);
                case BOOLEAN: return Boolean.compare((Boolean) value, (Boolean) otherValue);
                default: throw new AssertionError(); // unreachable
            }
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Scalar))
                return false;
            Scalar other = (Scalar) o;
            return kind == other.kind && value.equals(other.value);
        }
        
        @Override
        public int hashCode() {
            return 31 * kind.hashCode() + value.hashCode();
        }
        
        /**
         * Returns the value of this scalar as a string. {@link Kind#TEXT TEXT} values are enclosed in double quotes,
         * so that {@code "1"} is distinguishable from {@code 1}.
         *
         * @return a string representation of this scalar
         */
        @Override
        public String toString() {
            return kind == Kind.TEXT ? "\"" + value + "\"" : String.valueOf(value);
        }
    }
    
    /**
     * An ordered tuple of keys, compared lexicographically. A composite that agrees with a longer composite on all of
     * its positions sorts before it.
     */
    public static final class Composite extends Key {
        final List<Key> keys;
        
        Composite(List<Key> keys) {
            this.keys = keys;
        }
        
        /**
         * Returns an unmodifiable view of the constituent keys.
         *
         * @return the constituent keys
         */
        public List<Key> keys() {
            return Collections.unmodifiableList(keys);
        }
        
        @Override
        public int compareTo(Key other) {
            if (other instanceof NoKey)
                return 1;
            if (!(other instanceof Composite))
                throw new KeyTypeMismatchException(this, other);
            List<Key> otherKeys = ((Composite) other).keys;
            int shared = Math.min(keys.size(), otherKeys.size());
            for (int i = 0; i < shared; i++) {
                int cmp = keys.get(i).compareTo(otherKeys.get(i));
                if (cmp != 0)
                    return cmp;
            }
            return Integer.compare(keys.size(), otherKeys.size());
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Composite))
                return false;
            return keys.equals(((Composite) o).keys);
        }
        
        @Override
        public int hashCode() {
            return keys.hashCode();
        }
        
        @Override
        public String toString() {
            StringJoiner sj = new StringJoiner(", ", "(", ")");
            for (Key key : keys)
                sj.add(key.toString());
            return sj.toString();
        }
    }
}
