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

/**
 * An embeddable, in-memory store of tabular data. Rows of named, dynamically-typed values are kept in a
 * {@link io.avery.tabula.Frame frame}, ordered by the {@link io.avery.tabula.Key key} that an
 * {@link io.avery.tabula.Indexer indexer} derives from each row. For example:
 *
 * <pre>{@code
 *     Frame sales = new Frame(new ColumnIndexer("year", "month"));
 *     sales.put(Row.of("year", 2014, "month", 1, "total", 120));
 *     sales.put(Row.of("year", 2014, "month", 2, "total", 95));
 *     sales.put(Row.of("year", 2015, "month", 1, "total", 140));
 *
 *     Row february = sales.get(Row.of("year", 2014, "month", 2));
 *     List<Row> year2014 = sales.range(Range.greaterOrEqual(Row.of("year", 2014, "month", 1))
 *                                           .andLessThan(Row.of("year", 2015, "month", 1)));
 *     Frame byYear = sales.groupBy(new ColumnIndexer("year"));
 * }</pre>
 *
 * <h2><a id="Keys">Keys and Indexers</a></h2>
 *
 * <p>A key is either the {@link io.avery.tabula.Key#none() no-key} sentinel, a
 * {@link io.avery.tabula.Key.Scalar scalar} wrapping one integer, floating-point, text or boolean value, or a
 * {@link io.avery.tabula.Key.Composite composite} of keys compared element-wise. Keys are only comparable to keys of the
 * same shape and kind; comparing, say, a text key with an integer key throws
 * {@link io.avery.tabula.KeyTypeMismatchException}.
 *
 * <p>The built-in {@link io.avery.tabula.ColumnIndexer column-indexer} projects a fixed list of columns. It remembers
 * the type of the values it sees in each column, and rejects rows whose values drift to another type. An indexer
 * computes the keys of lookup probes and range bounds as well as of stored rows, so probes only need the projected
 * columns.
 *
 * <h2><a id="Derived">Derived Frames</a></h2>
 *
 * <p>{@link io.avery.tabula.Frame#withIndexer Re-indexing}, {@link io.avery.tabula.Frame#join joining} and
 * {@link io.avery.tabula.Frame#groupBy grouping} produce new frames, and never modify their inputs. A joined frame
 * holds a {@link io.avery.tabula.JoinResult} in every column, and a grouped frame holds a
 * {@link io.avery.tabula.Group} in its single {@link io.avery.tabula.Group#COLUMN} column. Derived frames are ordinary
 * frames, so they can be looked up, ranged over, joined, or grouped again.
 *
 * <p>{@link io.avery.tabula.Row Rows} are immutable, so derived frames safely share row instances with their sources.
 * Neither frames nor indexers are safe for concurrent use.
 */
package io.avery.tabula;
