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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class FrameGroupByTest {
    private static final Row R00 = Row.of("i1", 0, "i2", 0, "data", "a");
    private static final Row R01 = Row.of("i1", 0, "i2", 1, "data", "b");
    private static final Row R10 = Row.of("i1", 1, "i2", 0, "data", "c");
    private static final Row R11 = Row.of("i1", 1, "i2", 1, "data", "d");
    
    private static Frame source() {
        Frame frame = new Frame(new ColumnIndexer("i1", "i2"));
        // Inserted out of order; groups follow the frame order, not insertion order.
        frame.putAll(Arrays.asList(R11, R01, R10, R00));
        return frame;
    }
    
    @Test
    void testGroupBy() {
        Frame grouped = source().groupBy(new ColumnIndexer("i1"));
        
        assertEquals(2, grouped.size());
        assertEquals(Row.of(Group.COLUMN, Group.of(R00, R01)), grouped.get(Row.of("i1", 0)));
        assertEquals(Row.of(Group.COLUMN, Group.of(R10, R11)), grouped.get(Row.of("i1", 1)));
        assertNull(grouped.get(Row.of("i1", 2)));
    }
    
    @Test
    void testGroupsShareSourceRows() {
        Frame source = source();
        Frame grouped = source.groupBy(new ColumnIndexer("i2"));
        Group group = (Group) grouped.get(Row.of("i2", 1)).get(Group.COLUMN);
        
        assertEquals(Arrays.asList(R01, R11), group);
        assertSame(source.get(Row.of("i1", 0, "i2", 1)), group.get(0));
        assertEquals(4, source.size());
    }
    
    @Test
    void testGroupRowsHaveOneColumn() {
        for (Row row : source().groupBy(new ColumnIndexer("i1")).range())
            assertEquals(Collections.singleton(Group.COLUMN), row.columns());
    }
    
    @Test
    void testGroupOrder() {
        Frame grouped = source().groupBy(new ColumnIndexer("data"));
        assertEquals(4, grouped.size());
        
        Frame single = source().groupBy(new ColumnIndexer());
        assertEquals(Collections.singletonList(Row.of(Group.COLUMN, Group.of(R00, R01, R10, R11))), single.range());
    }
    
    @Test
    void testPutIntoGroupedFrame() {
        Frame grouped = source().groupBy(new ColumnIndexer("i1"));
        Row extra = Row.of("i1", 5, "i2", 0, "data", "e");
        grouped.put(Row.of(Group.COLUMN, Group.of(extra)));
        
        assertEquals(Row.of(Group.COLUMN, Group.of(extra)), grouped.get(Row.of("i1", 5)));
        assertThrows(IllegalArgumentException.class, () -> grouped.put(Row.of(Group.COLUMN, Group.of())));
        assertEquals(3, grouped.size());
    }
    
    @Test
    void testGroupsAreStoredThroughResultIndexer() {
        AtomicInteger calls = new AtomicInteger();
        ColumnIndexer byI1 = new ColumnIndexer("i1");
        Frame grouped = source().groupBy(row -> {
            calls.incrementAndGet();
            return byI1.index(row);
        });
        
        // Once per source row, then once per group as it is put into the result.
        assertEquals(6, calls.get());
        assertEquals(Arrays.asList(Group.of(R00, R01), Group.of(R10, R11)),
                     grouped.forRange(Range.all(), row -> row.get(Group.COLUMN)));
    }
    
    @Test
    void testGroupByFailure() {
        Frame source = source();
        assertThrows(MissingColumnException.class, () -> source.groupBy(new ColumnIndexer("missing")));
        assertEquals(4, source.size());
    }
    
    @Test
    void testGroupJoinedFrame() {
        Frame right = new Frame(new ColumnIndexer("i1", "i2"));
        right.put(Row.of("i1", 2, "i2", 0, "data", "z"));
        
        Frame grouped = source().join(right).groupBy(new JoinResultIndexer(new ColumnIndexer("i1")));
        assertEquals(3, grouped.size());
        
        Group ones = (Group) grouped.get(Row.of("i1", 1)).get(Group.COLUMN);
        assertEquals(2, ones.size());
        assertEquals(JoinResult.left("c"), ones.get(0).get("data"));
        
        Group twos = (Group) grouped.get(Row.of("i1", 2)).get(Group.COLUMN);
        assertEquals(JoinResult.right("z"), twos.get(0).get("data"));
    }
    
    @Test
    void testGroup() {
        Group group = Group.of(R00, R01);
        assertEquals(2, group.size());
        assertEquals(R01, group.get(1));
        List<Row> rows = group.rows();
        assertEquals(Arrays.asList(R00, R01), rows);
        assertThrows(UnsupportedOperationException.class, () -> rows.set(0, R10));
        assertThrows(UnsupportedOperationException.class, () -> group.add(R10));
        assertEquals("Group[" + R00 + ", " + R01 + "]", group.toString());
    }
}
