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
package org.weakref.subset;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestStateSet
{
    @Test
    public void testOrderIndependence()
    {
        StateSet reversed = new StateSet(ImmutableSortedSet.copyOf(Ordering.<String>natural().reverse(), ImmutableSortedSet.of("A", "C", "B")));

        assertEquals(StateSet.of("A", "B", "C"), reversed);
        assertEquals(StateSet.of("C", "B", "A").hashCode(), reversed.hashCode());
        assertEquals("{A B C}", reversed.label());
        assertEquals("A", reversed.states().first());
    }

    @Test
    public void testContains()
    {
        StateSet set = StateSet.of("A", "B");

        assertTrue(set.contains("A"));
        assertFalse(set.contains("C"));
        assertTrue(set.intersects(ImmutableSortedSet.of("B", "Z")));
        assertFalse(set.intersects(ImmutableSortedSet.of("Z")));
    }

    @Test
    public void testEmpty()
    {
        assertThrows(IllegalArgumentException.class, () -> new StateSet(ImmutableSortedSet.of()));
    }
}
