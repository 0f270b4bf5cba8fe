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

import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestSection
{
    @Test
    public void testHeaders()
    {
        assertEquals(Optional.of(Section.INITIAL), Section.forHeader("##foma-net 1.0##"));
        assertEquals(Optional.of(Section.PROPS), Section.forHeader("##props##"));
        assertEquals(Optional.of(Section.SIGMA), Section.forHeader("##sigma##"));
        assertEquals(Optional.of(Section.ARC), Section.forHeader("##states##"));
        assertEquals(Optional.of(Section.END), Section.forHeader("##end##"));
    }

    @Test
    public void testUnknownHeaders()
    {
        assertEquals(Optional.empty(), Section.forHeader("##arcs##"));
        assertEquals(Optional.empty(), Section.forHeader("##foma-net 2.0##"));
        assertEquals(Optional.empty(), Section.forHeader("##SIGMA##"));
        assertEquals(Optional.empty(), Section.forHeader("##sigma"));
        assertEquals(Optional.empty(), Section.forHeader("##sigma## "));
        assertEquals(Optional.empty(), Section.forHeader("####"));
        assertEquals(Optional.empty(), Section.forHeader("###"));
        assertEquals(Optional.empty(), Section.forHeader("##"));
    }

    @Test
    public void testIsHeader()
    {
        assertTrue(Section.isHeader("##end##"));
        assertTrue(Section.isHeader("##whatever"));
        assertFalse(Section.isHeader("97 a"));
        assertFalse(Section.isHeader(" ##end##"));
        assertFalse(Section.isHeader("#"));
    }
}
