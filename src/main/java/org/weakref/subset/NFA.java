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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import org.weakref.subset.InvalidAutomatonException.Problem;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkState;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A non-deterministic finite automaton over single-character symbols.
 *
 * <p>Transitions labeled with {@link #EPSILON} consume no input. Instances are
 * immutable; use {@link Builder} to create them.
 */
public final class NFA
{
    public static final char EPSILON = '#';

    private final ImmutableSortedSet<String> states;
    private final ImmutableSortedSet<Character> alphabet;
    private final String start;
    private final ImmutableSortedSet<String> accepting;
    private final ImmutableSetMultimap<Move, String> transitions;

    private NFA(
            ImmutableSortedSet<String> states,
            ImmutableSortedSet<Character> alphabet,
            String start,
            ImmutableSortedSet<String> accepting,
            ImmutableSetMultimap<Move, String> transitions)
    {
        this.states = requireNonNull(states, "states is null");
        this.alphabet = requireNonNull(alphabet, "alphabet is null");
        this.start = requireNonNull(start, "start is null");
        this.accepting = requireNonNull(accepting, "accepting is null");
        this.transitions = requireNonNull(transitions, "transitions is null");
    }

    public ImmutableSortedSet<String> states()
    {
        return states;
    }

    /**
     * Input symbols in ascending order. This is the order in which the subset
     * construction visits symbols, so it also fixes the DFA state names.
     */
    public ImmutableSortedSet<Character> alphabet()
    {
        return alphabet;
    }

    public String start()
    {
        return start;
    }

    public ImmutableSortedSet<String> accepting()
    {
        return accepting;
    }

    public boolean isAccepting(String state)
    {
        return accepting.contains(state);
    }

    /**
     * Targets of the transitions leaving {@code state} on {@code symbol}.
     * Returns an empty set when there are none, including for states or
     * symbols the automaton does not declare.
     */
    public ImmutableSet<String> outgoing(String state, char symbol)
    {
        return transitions.get(new Move(state, symbol));
    }

    public ImmutableSet<String> epsilonSuccessors(String state)
    {
        return outgoing(state, EPSILON);
    }

    /**
     * Simulates the automaton on {@code input}, following epsilon transitions
     * between symbols.
     */
    public boolean accepts(String input)
    {
        Set<String> current = SubsetConstruction.epsilonClosure(this, ImmutableSet.of(start));
        for (int i = 0; i < input.length() && !current.isEmpty(); i++) {
            char symbol = input.charAt(i);
            Set<String> next = new HashSet<>();
            for (String state : current) {
                next.addAll(outgoing(state, symbol));
            }
            current = SubsetConstruction.epsilonClosure(this, next);
        }

        for (String state : current) {
            if (accepting.contains(state)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();
        builder.append("States: ").append(String.join(" ", states)).append('\n');

        builder.append("Symbols:");
        for (char symbol : alphabet) {
            builder.append(' ').append(symbol);
        }
        builder.append('\n');

        builder.append("Start state: ").append(start).append('\n');

        builder.append("Transitions:\n");
        for (Map.Entry<Move, Collection<String>> entry : transitions.asMap().entrySet()) {
            builder.append(format("    %s -[%s]-> %s\n",
                    entry.getKey().state(),
                    entry.getKey().symbol(),
                    String.join(" ", entry.getValue())));
        }

        builder.append("Accepting states: ").append(String.join(" ", accepting)).append('\n');
        return builder.toString();
    }

    record Move(String state, char symbol) {}

    public static class Builder
    {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<Character> alphabet = new LinkedHashSet<>();
        private final Set<String> accepting = new LinkedHashSet<>();
        private final SetMultimap<Move, String> transitions = LinkedHashMultimap.create();
        private String start;

        public Builder addState(String state)
        {
            states.add(requireNonNull(state, "state is null"));
            return this;
        }

        public Builder addStates(String... states)
        {
            Arrays.stream(states).forEach(this::addState);
            return this;
        }

        public Builder addSymbol(char symbol)
        {
            alphabet.add(symbol);
            return this;
        }

        public Builder addSymbols(char... symbols)
        {
            for (char symbol : symbols) {
                addSymbol(symbol);
            }
            return this;
        }

        public Builder setStart(String state)
        {
            start = requireNonNull(state, "state is null");
            return this;
        }

        public Builder addAccepting(String... states)
        {
            for (String state : states) {
                accepting.add(requireNonNull(state, "state is null"));
            }
            return this;
        }

        /**
         * Records {@code from --symbol--> to}. Adding the same triple again has
         * no effect.
         */
        public Builder addTransition(String from, char symbol, String to)
        {
            requireNonNull(from, "from is null");
            requireNonNull(to, "to is null");
            transitions.put(new Move(from, symbol), to);
            return this;
        }

        public Builder addEpsilon(String from, String to)
        {
            return addTransition(from, EPSILON, to);
        }

        public NFA build()
        {
            validate();
            return buildUnvalidated();
        }

        /**
         * Builds the automaton without checking that every reference is
         * declared. Undeclared states and symbols behave as having no
         * transitions.
         */
        public NFA buildUnvalidated()
        {
            checkState(start != null, "Start state not set");
            return new NFA(
                    ImmutableSortedSet.copyOf(states),
                    ImmutableSortedSet.copyOf(alphabet),
                    start,
                    ImmutableSortedSet.copyOf(accepting),
                    ImmutableSetMultimap.copyOf(transitions));
        }

        private void validate()
        {
            if (states.isEmpty()) {
                throw new InvalidAutomatonException(Problem.NO_STATES, "Automaton has no states");
            }
            if (start == null) {
                throw new InvalidAutomatonException(Problem.NO_START_STATE, "Start state not set");
            }
            if (!states.contains(start)) {
                throw new InvalidAutomatonException(Problem.UNKNOWN_START_STATE, format("Start state '%s' is not a declared state", start));
            }
            if (alphabet.contains(EPSILON)) {
                throw new InvalidAutomatonException(Problem.EPSILON_IN_ALPHABET, format("Epsilon marker '%s' cannot be an input symbol", EPSILON));
            }
            for (String state : accepting) {
                if (!states.contains(state)) {
                    throw new InvalidAutomatonException(Problem.UNKNOWN_ACCEPTING_STATE, format("Accepting state '%s' is not a declared state", state));
                }
            }
            for (Map.Entry<Move, String> entry : transitions.entries()) {
                Move move = entry.getKey();
                if (!states.contains(move.state())) {
                    throw new InvalidAutomatonException(Problem.UNKNOWN_TRANSITION_STATE, format("Transition source '%s' is not a declared state", move.state()));
                }
                if (!states.contains(entry.getValue())) {
                    throw new InvalidAutomatonException(Problem.UNKNOWN_TRANSITION_STATE, format("Transition target '%s' is not a declared state", entry.getValue()));
                }
                if (move.symbol() != EPSILON && !alphabet.contains(move.symbol())) {
                    throw new InvalidAutomatonException(Problem.UNKNOWN_TRANSITION_SYMBOL, format("Transition symbol '%s' is not in the alphabet", move.symbol()));
                }
            }
        }
    }
}
