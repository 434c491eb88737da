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
 * The {@link Indexer indexer} of a grouped {@link Frame frame}. A row holding a {@link Group} under
 * {@link Group#COLUMN} is indexed by applying the grouping indexer to the first row of the group. Any other row is
 * treated as a lookup probe, and indexed directly by the grouping indexer.
 *
 * @see Frame#groupBy(Indexer)
 */
public class GroupIndexer implements Indexer {
    private final Indexer grouping;
    
    /**
     * Creates a new group-indexer for the given grouping indexer.
     *
     * @param grouping the indexer that computes the grouping key of each source row
     */
    public GroupIndexer(Indexer grouping) {
        this.grouping = Objects.requireNonNull(grouping);
    }
    
    /**
     * Returns the grouping indexer.
     *
     * @return the grouping indexer
     */
    public Indexer grouping() {
        return grouping;
    }
    
    /**
     * Returns the key of the given group row or probe row.
     *
     * @param row the row to index
     * @return the key of the row
     * @throws IllegalArgumentException if the row holds an empty group
     * @throws FrameException if the grouping indexer cannot index the row
     */
    @Override
    public Key index(Row row) {
        Object value = row.getOrNull(Group.COLUMN);
        if (value instanceof Group) {
            Group group = (Group) value;
            if (group.isEmpty())
                throw new IllegalArgumentException("Cannot index an empty group");
            return grouping.index(group.get(0));
        }
        return grouping.index(row);
    }
    
    @Override
    public String toString() {
        return "GroupIndexer[" + grouping + "]";
    }
}
