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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collector;
import java.util.stream.Stream;

/**
 * An ordered store of {@link Row rows}, keyed by the {@link Key keys} that the frame's {@link Indexer indexer} computes
 * from them. Each key holds at most one row, and rows are always visited in ascending key order.
 *
 * <p>Rows are looked up, removed, and bounded by "probe" rows, which are indexed by the same indexer as stored rows.
 * For example, a frame indexed by {@code new ColumnIndexer("year", "month")} can be probed by
 * {@code Row.of("year", 2014, "month", 3)}, regardless of what other columns the stored row contains.
 *
 * <p>Operations that cannot compute or compare a key throw a {@link FrameException}, and leave the frame unchanged.
 * Operations that derive a new frame ({@link #withIndexer}, {@link #join}, {@link #groupBy}) never modify their
 * inputs. Since rows are immutable, derived frames share row instances with their source.
 *
 * <p>Frames are not safe for concurrent use. Callers sharing a frame (or an indexer) across threads must serialize
 * access to it. Modifying a frame from inside a traversal callback on the same frame fails with
 * {@link ConcurrentModificationException}.
 */
public class Frame {
    private static final Logger logger = LoggerFactory.getLogger(Frame.class);
    
    final TreeMap<Key, Row> tree = new TreeMap<>();
    final Indexer indexer;
    
    /**
     * Creates a new, empty frame indexed by the given indexer.
     *
     * @param indexer the indexer that computes the key of each row
     */
    public Frame(Indexer indexer) {
        this.indexer = Objects.requireNonNull(indexer);
    }
    
    /**
     * Returns a {@code Collector} that accumulates the input rows into a new frame indexed by the given indexer, as if
     * by {@link #put(Row) putting} each row in encounter order.
     *
     * @param indexer the indexer of the new frame
     * @return a {@code Collector} which collects all the input rows into a frame
     */
    public static Collector<Row, ?, Frame> collector(Indexer indexer) {
        Objects.requireNonNull(indexer);
        return Collector.of(
            () -> new Frame(indexer),
            Frame::put,
            (a, b) -> {
                a.putAll(b.tree.values());
                return a;
            }
        );
    }
    
    /**
     * Returns the indexer of this frame.
     *
     * @return the indexer of this frame
     */
    public Indexer indexer() {
        return indexer;
    }
    
    /**
     * Returns the number of rows in this frame.
     *
     * @return the number of rows in this frame
     */
    public int size() {
        return tree.size();
    }
    
    /**
     * Returns {@code true} if this frame contains no rows.
     *
     * @return {@code true} if this frame contains no rows
     */
    public boolean isEmpty() {
        return tree.isEmpty();
    }
    
    /**
     * Inserts the given row, replacing and returning the row previously stored under the same key, if any.
     *
     * @param row the row to insert
     * @return the replaced row, or {@code null} if there was no row for the key
     * @throws FrameException if the row cannot be indexed, or its key cannot be compared to stored keys
     */
    public Row put(Row row) {
        Objects.requireNonNull(row);
        return tree.put(indexer.index(row), row);
    }
    
    /**
     * Inserts each of the given rows in order, as if by {@link #put(Row)}. If a row cannot be inserted, the rows before
     * it remain inserted.
     *
     * @param rows the rows to insert
     * @throws FrameException if a row cannot be indexed, or its key cannot be compared to stored keys
     */
    public void putAll(Iterable<Row> rows) {
        for (Row row : rows)
            put(row);
    }
    
    /**
     * Returns the row stored under the key of the given probe, or {@code null} if there is none.
     *
     * <p>Probes are indexed like stored rows, so an indexer that remembers column types (such as a
     * {@link ColumnIndexer}) fixes those types from a probe too, even when the frame is empty.
     *
     * @param probe a row containing (at least) the columns read by this frame's indexer
     * @return the matching row, or {@code null}
     * @throws FrameException if the probe cannot be indexed, or its key cannot be compared to stored keys
     */
    public Row get(Row probe) {
        Objects.requireNonNull(probe);
        return tree.get(indexer.index(probe));
    }
    
    /**
     * Removes and returns the row stored under the key of the given probe, or returns {@code null} if there is none.
     *
     * @param probe a row containing (at least) the columns read by this frame's indexer
     * @return the removed row, or {@code null}
     * @throws FrameException if the probe cannot be indexed, or its key cannot be compared to stored keys
     */
    public Row pop(Row probe) {
        Objects.requireNonNull(probe);
        return tree.remove(indexer.index(probe));
    }
    
    /**
     * Returns all rows of this frame, in ascending key order.
     *
     * @return all rows of this frame
     */
    public List<Row> range() {
        return new ArrayList<>(tree.values());
    }
    
    /**
     * Returns the rows of this frame within the given range, in ascending key order.
     *
     * @param range the range of rows to return
     * @return the rows within the range
     * @throws FrameException if a bound cannot be indexed, or its key cannot be compared to stored keys
     */
    public List<Row> range(Range range) {
        return new ArrayList<>(select(range).values());
    }
    
    /**
     * Applies the given action to each row within the given range, in ascending key order, and returns the results.
     * If the action throws, the traversal is abandoned and the exception propagates to the caller.
     *
     * @param range the range of rows to visit
     * @param action the action to apply to each row
     * @return the results of the action, one for each visited row
     * @throws FrameException if a bound cannot be indexed, or its key cannot be compared to stored keys
     * @param <R> the result type of the action
     */
    public <R> List<R> forRange(Range range, Function<? super Row, ? extends R> action) {
        Objects.requireNonNull(action);
        List<R> results = new ArrayList<>();
        for (Row row : select(range).values())
            results.add(action.apply(row));
        return results;
    }
    
    /**
     * Passes each row within the given range to the given visitor, in ascending key order, until the visitor returns
     * {@code false}.
     *
     * @param range the range of rows to visit
     * @param visitor a predicate that returns {@code false} to stop the traversal
     * @return {@code true} if every row within the range was visited
     * @throws FrameException if a bound cannot be indexed, or its key cannot be compared to stored keys
     */
    public boolean scan(Range range, Predicate<? super Row> visitor) {
        Objects.requireNonNull(visitor);
        for (Row row : select(range).values())
            if (!visitor.test(row))
                return false;
        return true;
    }
    
    /**
     * Removes and returns the rows of this frame within the given range, in ascending key order. All rows within the
     * range are selected before any are removed.
     *
     * @param range the range of rows to remove
     * @return the removed rows
     * @throws FrameException if a bound cannot be indexed, or its key cannot be compared to stored keys
     */
    public List<Row> popRange(Range range) {
        List<Key> keys = new ArrayList<>();
        List<Row> rows = new ArrayList<>();
        for (Map.Entry<Key, Row> entry : select(range).entrySet()) {
            keys.add(entry.getKey());
            rows.add(entry.getValue());
        }
        for (Key key : keys)
            tree.remove(key);
        return rows;
    }
    
    /**
     * Returns a sequential {@code Stream} over the rows of this frame, in ascending key order.
     *
     * @return a sequential {@code Stream} over the rows of this frame
     */
    public Stream<Row> stream() {
        return tree.values().stream();
    }
    
    /**
     * Returns a new frame containing the rows of this frame, indexed by the given indexer. Rows are inserted into the
     * new frame in ascending key order of this frame.
     *
     * <p>The given indexer should compute a distinct key for each row. Otherwise, for each set of colliding rows only
     * one row is kept; currently the last one inserted, although callers should not depend on which.
     *
     * @param indexer the indexer of the new frame
     * @return a new frame indexed by the given indexer
     * @throws FrameException if a row cannot be indexed by the given indexer
     */
    public Frame withIndexer(Indexer indexer) {
        Frame next = new Frame(indexer);
        int collisions = 0;
        for (Row row : tree.values())
            if (next.put(row) != null)
                collisions++;
        if (collisions > 0)
            logger.debug("Re-indexing {} rows with {} dropped {} colliding rows", tree.size(), indexer, collisions);
        return next;
    }
    
    /**
     * Returns a new frame that outer-joins this (left) frame with the given (right) frame. The new frame holds one row
     * for each key of either frame, where each column of the row holds a {@link JoinResult} pairing the column's value
     * in the left row with its value in the right row. A side is absent if that frame has no row for the key, or its
     * row lacks the column.
     *
     * <p>The new frame is indexed by a {@link JoinResultIndexer} wrapping this frame's indexer. Right rows are keyed by
     * this frame's indexer too, so both frames should be indexed alike.
     *
     * @param right the right frame
     * @return a new, joined frame
     * @throws FrameException if a right row cannot be indexed by this frame's indexer, or a column of the joined frame
     * does not hold a join-result
     */
    public Frame join(Frame right) {
        Objects.requireNonNull(right);
        Frame joined = new Frame(new JoinResultIndexer(indexer));
        for (Row row : tree.values()) {
            Map<String, Object> projected = new LinkedHashMap<>(row.values.size());
            row.values.forEach((column, value) -> projected.put(column, JoinResult.left(value)));
            joined.put(Row.of(projected));
        }
        for (Row row : right.tree.values()) {
            Row existing = joined.get(row);
            Map<String, Object> projected = existing == null
                ? new LinkedHashMap<>(row.values.size())
                : new LinkedHashMap<>(existing.values);
            for (Map.Entry<String, Object> entry : row.values.entrySet()) {
                String column = entry.getKey();
                if (projected.containsKey(column)) {
                    Object current = projected.get(column);
                    if (!(current instanceof JoinResult))
                        throw new JoinStructureException(column, current);
                    projected.put(column, ((JoinResult) current).withRight(entry.getValue()));
                } else {
                    projected.put(column, JoinResult.right(entry.getValue()));
                }
            }
            joined.put(Row.of(projected));
        }
        logger.debug("Joined {} left rows with {} right rows into {} rows",
                     tree.size(), right.tree.size(), joined.tree.size());
        return joined;
    }
    
    /**
     * Returns a new frame that groups the rows of this frame by the keys the given indexer computes for them. The new
     * frame holds one row for each distinct key, with the single column {@link Group#COLUMN}, holding a {@link Group}
     * of the rows with that key in ascending key order of this frame.
     *
     * <p>The new frame is indexed by a {@link GroupIndexer} wrapping the given indexer, so it can be probed with the
     * same rows as the given indexer accepts.
     *
     * @param indexer the grouping indexer
     * @return a new, grouped frame
     * @throws FrameException if a row cannot be indexed by the given indexer
     */
    public Frame groupBy(Indexer indexer) {
        Frame grouped = new Frame(new GroupIndexer(indexer));
        TreeMap<Key, List<Row>> groups = new TreeMap<>();
        for (Row row : tree.values())
            groups.computeIfAbsent(indexer.index(row), k -> new ArrayList<>()).add(row);
        for (List<Row> rows : groups.values())
            grouped.put(Row.of(Group.COLUMN, Group.of(rows)));
        logger.debug("Grouped {} rows into {} groups", tree.size(), grouped.tree.size());
        return grouped;
    }
    
    private NavigableMap<Key, Row> select(Range range) {
        Objects.requireNonNull(range);
        Key lower = range.lower == null ? null : indexer.index(range.lower);
        Key upper = range.upper == null ? null : indexer.index(range.upper);
        if (lower == null && upper == null)
            return tree;
        if (upper == null)
            return tree.tailMap(lower, true);
        if (lower == null)
            return tree.headMap(upper, false);
        if (lower.compareTo(upper) >= 0)
            return Collections.emptyNavigableMap();
        return tree.subMap(lower, true, upper, false);
    }
    
    /**
     * Returns a string representation of this frame. The string representation consists of the characters
     * {@code "Frame"}, followed by a bracketed list of the rows in ascending key order, each preceded by its position.
     * The rows are separated by a comma, newline, and tab. For example:
     *
     * <pre>{@code
     * Frame[
     *     0: Row{id=1, name=foo},
     *     1: Row{id=2, name=bar}
     * ]
     * }</pre>
     *
     * @return a string representation of this frame
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Frame[");
        String delimiter = "\n\t";
        int i = 0;
        for (Row row : tree.values()) {
            sb.append(delimiter).append(i++).append(": ").append(row);
            delimiter = ",\n\t";
        }
        return sb.append(i == 0 ? "]" : "\n]").toString();
    }
}
