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
 * A function from a {@link Row row} to the {@link Key key} that positions it in a {@link Frame frame}. The same
 * indexer computes the keys of stored rows and of lookup probes, so a probe need only contain the columns that the
 * indexer reads.
 *
 * <p>Implementations signal rows they cannot index by throwing a {@link FrameException}, such as
 * {@link MissingColumnException} or {@link UnsupportedKeyTypeException}.
 *
 * @see ColumnIndexer
 */
@FunctionalInterface
public interface Indexer {
    /**
     * Returns the key of the given row.
     *
     * @param row the row to index
     * @return the key of the row
     * @throws FrameException if the row cannot be indexed
     */
    Key index(Row row);
}
