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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KeyTest {
    @Test
    void testIntegerOrder() {
        assertTrue(Key.of(1).compareTo(Key.of(2)) < 0);
        assertTrue(Key.of(2).compareTo(Key.of(1)) > 0);
        assertEquals(0, Key.of(1).compareTo(Key.of(1)));
        assertTrue(Key.of(-5L).compareTo(Key.of((short) 3)) < 0);
    }
    
    @Test
    void testTextOrder() {
        assertTrue(Key.of("abc").compareTo(Key.of("def")) < 0);
        assertTrue(Key.of("def").compareTo(Key.of("abc")) > 0);
        assertEquals(0, Key.of("abc").compareTo(Key.of("abc")));
        assertEquals(Key.of("x"), Key.of('x'));
    }
    
    @Test
    void testScalarKinds() {
        assertEquals(Key.Kind.INTEGER, Key.scalar(7).kind());
        assertEquals(Key.Kind.INTEGER, Key.scalar((byte) 7).kind());
        assertEquals(Key.Kind.FLOAT, Key.scalar(7.5f).kind());
        assertEquals(Key.Kind.TEXT, Key.scalar("7").kind());
        assertEquals(Key.Kind.BOOLEAN, Key.scalar(true).kind());
        assertEquals(7L, Key.scalar(7).value());
        assertEquals(Key.of(7), Key.of(7L));
        assertTrue(Key.of(false).compareTo(Key.of(true)) < 0);
        assertTrue(Key.of(1.5).compareTo(Key.of(2.5)) < 0);
    }
    
    @Test
    void testShapes() {
        assertSame(Key.none(), Key.of());
        assertTrue(Key.of(1) instanceof Key.Scalar);
        assertTrue(Key.of(1, "a") instanceof Key.Composite);
        assertEquals(Arrays.asList(Key.of(1), Key.of("a")), ((Key.Composite) Key.of(1, "a")).keys());
        assertEquals(Key.of(1, "a"), Key.of(Arrays.asList(1, "a")));
    }
    
    @Test
    void testNoKeyIsLeast() {
        assertTrue(Key.none().compareTo(Key.of(Integer.MIN_VALUE)) < 0);
        assertTrue(Key.none().compareTo(Key.of("")) < 0);
        assertTrue(Key.none().compareTo(Key.of("a", 1)) < 0);
        assertTrue(Key.of(Integer.MIN_VALUE).compareTo(Key.none()) > 0);
        assertTrue(Key.of("a", 1).compareTo(Key.none()) > 0);
        assertEquals(0, Key.none().compareTo(Key.none()));
    }
    
    @Test
    void testCompositeOrder() {
        assertTrue(Key.of("a", 1).compareTo(Key.of("b", 2)) < 0);
        assertTrue(Key.of("b", 1).compareTo(Key.of("a", 2)) > 0);
        assertTrue(Key.of("a", 1).compareTo(Key.of("a", 2)) < 0);
        assertTrue(Key.of("a", 2).compareTo(Key.of("a", 1)) > 0);
        assertEquals(0, Key.of("a", 1).compareTo(Key.of("a", 1)));
        assertEquals(Key.of("a", 1), Key.of("a", 1));
        assertEquals(Key.of("a", 1).hashCode(), Key.of("a", 1).hashCode());
    }
    
    @Test
    void testCompositePrefixRule() {
        Key a = Key.composite(Key.of("a"));
        Key ab = Key.of("a", "b");
        assertTrue(a.compareTo(ab) < 0);
        assertTrue(ab.compareTo(a) > 0);
        
        // A longer composite that differs on a shared position is ordered by that position alone.
        assertTrue(Key.of("a", 1).compareTo(Key.composite(Key.of("b"))) < 0);
        assertTrue(Key.of("b", 1).compareTo(Key.composite(Key.of("a"))) > 0);
    }
    
    @Test
    void testSortMixedCompositeLengths() {
        List<Key> keys = new ArrayList<>(Arrays.asList(
            Key.of("b", 1),
            Key.composite(Key.of("b")),
            Key.of("a", 2),
            Key.none(),
            Key.of("a", 1),
            Key.composite(Key.of("a"))
        ));
        Collections.sort(keys);
        
        List<Key> expected = Arrays.asList(
            Key.none(),
            Key.composite(Key.of("a")),
            Key.of("a", 1),
            Key.of("a", 2),
            Key.composite(Key.of("b")),
            Key.of("b", 1)
        );
        assertEquals(expected, keys);
    }
    
    @Test
    void testKindMismatch() {
        KeyTypeMismatchException e = assertThrows(KeyTypeMismatchException.class, () -> Key.of("a").compareTo(Key.of(1)));
        assertEquals(Key.of("a"), e.left());
        assertEquals(Key.of(1), e.right());
        assertThrows(KeyTypeMismatchException.class, () -> Key.of(1).compareTo(Key.of(1.0)));
        assertThrows(KeyTypeMismatchException.class, () -> Key.of("a", 1).compareTo(Key.of("a", "b")));
    }
    
    @Test
    void testShapeMismatch() {
        assertThrows(KeyTypeMismatchException.class, () -> Key.of("a").compareTo(Key.of("a", "b")));
        assertThrows(KeyTypeMismatchException.class, () -> Key.of("a", "b").compareTo(Key.of("a")));
        assertNotEquals(Key.of("a"), Key.composite(Key.of("a")));
        assertNotEquals(Key.of(1), Key.of(1.0));
    }
    
    @Test
    void testUnsupportedValues() {
        UnsupportedKeyTypeException e = assertThrows(UnsupportedKeyTypeException.class, () -> Key.of((Object) null));
        assertNull(e.value());
        Object value = new Object();
        e = assertThrows(UnsupportedKeyTypeException.class, () -> Key.of("a", value));
        assertSame(value, e.value());
    }
    
    @Test
    void testToString() {
        assertEquals("()", Key.none().toString());
        assertEquals("1", Key.of(1).toString());
        assertEquals("\"a\"", Key.of("a").toString());
        assertEquals("(\"a\", 1)", Key.of("a", 1).toString());
        assertEquals("\"1\"", Key.of("1").toString());
        assertNotEquals(Key.of(1).toString(), Key.of("1").toString());
    }
}
