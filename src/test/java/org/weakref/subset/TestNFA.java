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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;
import org.weakref.subset.InvalidAutomatonException.Problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestNFA
{
    @Test
    public void testAddTransitionIsIdempotent()
    {
        NFA nfa = new NFA.Builder()
                .addStates("A", "B")
                .addSymbol('a')
                .setStart("A")
                .addTransition("A", 'a', "B")
                .addTransition("A", 'a', "B")
                .build();

        assertEquals(ImmutableSet.of("B"), nfa.outgoing("A", 'a'));
    }

    @Test
    public void testOutgoingIsTotal()
    {
        NFA nfa = new NFA.Builder()
                .addStates("A", "B")
                .addSymbol('a')
                .setStart("A")
                .addTransition("A", 'a', "B")
                .build();

        assertTrue(nfa.outgoing("B", 'a').isEmpty());
        assertTrue(nfa.outgoing("A", 'b').isEmpty());
        assertTrue(nfa.outgoing("missing", 'a').isEmpty());
        assertTrue(nfa.epsilonSuccessors("A").isEmpty());
    }

    @Test
    public void testNonDeterministicTargets()
    {
        NFA nfa = new NFA.Builder()
                .addStates("A", "B", "C")
                .addSymbol('a')
                .setStart("A")
                .addTransition("A", 'a', "B")
                .addTransition("A", 'a', "C")
                .addEpsilon("B", "C")
                .build();

        assertEquals(ImmutableSet.of("B", "C"), nfa.outgoing("A", 'a'));
        assertEquals(ImmutableSet.of("C"), nfa.epsilonSuccessors("B"));
    }

    @Test
    public void testAlphabetIsSorted()
    {
        NFA nfa = new NFA.Builder()
                .addState("A")
                .addSymbols('c', 'a', 'b')
                .setStart("A")
                .build();

        assertEquals(ImmutableList.of('a', 'b', 'c'), nfa.alphabet().asList());
    }

    @Test
    public void testValidation()
    {
        assertProblem(new NFA.Builder(), Problem.NO_STATES);
        assertProblem(new NFA.Builder().addState("A"), Problem.NO_START_STATE);
        assertProblem(new NFA.Builder().addState("A").setStart("B"), Problem.UNKNOWN_START_STATE);
        assertProblem(new NFA.Builder().addState("A").setStart("A").addSymbol(NFA.EPSILON), Problem.EPSILON_IN_ALPHABET);
        assertProblem(new NFA.Builder().addState("A").setStart("A").addAccepting("B"), Problem.UNKNOWN_ACCEPTING_STATE);
        assertProblem(
                new NFA.Builder().addState("A").addSymbol('a').setStart("A").addTransition("B", 'a', "A"),
                Problem.UNKNOWN_TRANSITION_STATE);
        assertProblem(
                new NFA.Builder().addState("A").addSymbol('a').setStart("A").addTransition("A", 'a', "B"),
                Problem.UNKNOWN_TRANSITION_STATE);
        assertProblem(
                new NFA.Builder().addState("A").addSymbol('a').setStart("A").addTransition("A", 'b', "A"),
                Problem.UNKNOWN_TRANSITION_SYMBOL);
    }

    @Test
    public void testEpsilonTransitionsNeedNoDeclaredSymbol()
    {
        NFA nfa = new NFA.Builder()
                .addStates("A", "B")
                .setStart("A")
                .addEpsilon("A", "B")
                .build();

        assertTrue(nfa.alphabet().isEmpty());
        assertEquals(ImmutableSet.of("B"), nfa.epsilonSuccessors("A"));
    }

    @Test
    public void testBuildUnvalidatedKeepsUndeclaredReferences()
    {
        NFA nfa = new NFA.Builder()
                .addState("A")
                .addSymbol('a')
                .setStart("Z")
                .addTransition("A", 'z', "X")
                .buildUnvalidated();

        assertEquals("Z", nfa.start());
        assertEquals(ImmutableSet.of("X"), nfa.outgoing("A", 'z'));
    }

    @Test
    public void testAccepts()
    {
        // a*b with an epsilon hop on each side
        NFA nfa = new NFA.Builder()
                .addStates("0", "1", "2", "3")
                .addSymbols('a', 'b')
                .setStart("0")
                .addAccepting("3")
                .addEpsilon("0", "1")
                .addTransition("1", 'a', "1")
                .addTransition("1", 'b', "2")
                .addEpsilon("2", "3")
                .build();

        assertTrue(nfa.isAccepting("3"));
        assertFalse(nfa.isAccepting("2"));
        assertFalse(nfa.isAccepting("missing"));

        assertTrue(nfa.accepts("b"));
        assertTrue(nfa.accepts("aab"));
        assertFalse(nfa.accepts(""));
        assertFalse(nfa.accepts("ba"));
        assertFalse(nfa.accepts("c"));
    }

    @Test
    public void testToString()
    {
        NFA nfa = new NFA.Builder()
                .addStates("B", "A")
                .addSymbol('a')
                .setStart("A")
                .addAccepting("B")
                .addTransition("A", 'a', "A")
                .addTransition("A", 'a', "B")
                .build();

        assertEquals(
                """
                States: A B
                Symbols: a
                Start state: A
                Transitions:
                    A -[a]-> A B
                Accepting states: B
                """,
                nfa.toString());
    }

    private static void assertProblem(NFA.Builder builder, Problem problem)
    {
        InvalidAutomatonException exception = assertThrows(InvalidAutomatonException.class, builder::build);
        assertEquals(problem, exception.getProblem());
    }
}
