/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.weakref.fst;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.util.Optional;
import java.util.OptionalInt;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestSymbolTable
{
    @Test
    public void testPartitions()
    {
        SymbolTable table = new SymbolTable.Builder()
                .add("0 @_EPSILON_SYMBOL_@", 1)
                .add("97 a", 2)
                .add("98 b", 3)
                .add("101 @U.x.a@", 4)
                .add("120 +Noun", 5)
                .build(ParserOptions.defaults());

        assertEquals(ImmutableMap.of(97, "a", 98, "b"), table.graphemes());
        assertEquals(ImmutableMap.of(101, "@U.x.a@", 120, "+Noun"), table.multicharSymbols());
        assertEquals(4, table.size());
    }

    @Test
    public void testEpsilonIsRemoved()
    {
        SymbolTable table = new SymbolTable.Builder()
                .add("0 x", 1)
                .add("97 a", 2)
                .build(ParserOptions.defaults());

        assertFalse(table.contains(Symbol.EPSILON));
        assertEquals(Optional.empty(), table.text(Symbol.EPSILON));
        assertFalse(table.graphemes().containsKey(Symbol.EPSILON));
        assertFalse(table.multicharSymbols().containsKey(Symbol.EPSILON));
        assertEquals(OptionalInt.empty(), table.id("x"));
    }

    @Test
    public void testDuplicateIdKeepsLast()
    {
        SymbolTable table = new SymbolTable.Builder()
                .add("0 @_EPSILON_SYMBOL_@", 1)
                .add("201 X", 2)
                .add("201 Y", 3)
                .build(ParserOptions.defaults());

        assertEquals(Optional.of("Y"), table.text(201));
        assertEquals(OptionalInt.empty(), table.id("X"));
        assertEquals(OptionalInt.of(201), table.id("Y"));
    }

    @Test
    public void testReverseLookupPrefersLowestId()
    {
        SymbolTable table = new SymbolTable.Builder()
                .add("12 a", 1)
                .add("7 a", 2)
                .build(ParserOptions.defaults());

        assertEquals(OptionalInt.of(7), table.id("a"));
    }

    @Test
    public void testSupplementaryCharacterIsGrapheme()
    {
        SymbolTable table = new SymbolTable.Builder()
                .add("300 😀", 1)
                .add("301 ✅", 2)
                .build(ParserOptions.defaults());

        assertEquals(ImmutableMap.of(300, "😀", 301, "✅"), table.graphemes());
        assertTrue(table.multicharSymbols().isEmpty());
    }

    @Test
    public void testExtraWhitespace()
    {
        SymbolTable table = new SymbolTable.Builder()
                .add("  97\t a  ", 1)
                .build(ParserOptions.defaults());

        assertEquals(Optional.of("a"), table.text(97));
    }

    @Test
    public void testMalformedLines()
    {
        assertMalformed("");
        assertMalformed("   ");
        assertMalformed("97");
        assertMalformed("97 a b");
        assertMalformed("a 97");
        assertMalformed("9.7 a");
        assertMalformed("99999999999 a");
    }

    @Test
    public void testMalformedLineReportsPosition()
    {
        MalformedSymbolException exception = assertThrows(
                MalformedSymbolException.class,
                () -> new SymbolTable.Builder().add("x y", 42));

        assertEquals(42, exception.getLineNumber());
        assertEquals("x y", exception.getLine());
        assertThat(exception.getMessage(), containsString("line 42"));
    }

    @Test
    public void testMissingEpsilon()
    {
        SymbolTable.Builder builder = new SymbolTable.Builder().add("97 a", 1);

        assertFalse(builder.definesEpsilon());
        assertEquals(ImmutableMap.of(97, "a"), builder.build(ParserOptions.defaults()).sigma());

        ParserOptions strict = ParserOptions.builder()
                .setRequireEpsilon(true)
                .build();
        assertThrows(MissingEpsilonException.class, () -> builder.build(strict));
    }

    @Test
    public void testSymbols()
    {
        SymbolTable table = SymbolTable.of(ImmutableMap.of(0, "@_EPSILON_SYMBOL_@", 98, "b", 97, "a", 102, "@P.x.b@"));

        assertEquals(3, table.symbols().size());
        assertEquals(new Symbol(97, "a"), table.symbols().get(0));
        assertTrue(table.symbols().get(0).isGrapheme());
        assertTrue(table.symbols().get(2).isMultichar());
    }

    private static void assertMalformed(String line)
    {
        assertThrows(MalformedSymbolException.class, () -> new SymbolTable.Builder().add(line, 1));
    }
}
