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
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.lang.String.format;

/**
 * Result of the subset construction. States are listed in discovery order,
 * which is also the order of their names ({@code q0}, {@code q1}, ...).
 */
public record DFA(State start, List<State> states, List<Character> alphabet, Map<Integer, List<Transition>> transitions, Map<StateSet, State> index)
{
    public DFA
    {
        states = ImmutableList.copyOf(states);
        alphabet = ImmutableList.copyOf(alphabet);
        ImmutableMap.Builder<Integer, List<Transition>> copy = ImmutableMap.builder();
        transitions.forEach((id, outgoing) -> copy.put(id, ImmutableList.copyOf(outgoing)));
        transitions = copy.buildOrThrow();
        index = ImmutableMap.copyOf(index);
    }

    /**
     * Outgoing transitions of {@code state}, ordered by symbol.
     */
    public List<Transition> transitions(State state)
    {
        return transitions.getOrDefault(state.id(), ImmutableList.of());
    }

    public Optional<State> transition(State state, char symbol)
    {
        for (Transition transition : transitions(state)) {
            if (transition.symbol() == symbol) {
                return Optional.of(transition.target());
            }
        }
        return Optional.empty();
    }

    public Optional<State> state(StateSet nfaStates)
    {
        return Optional.ofNullable(index.get(nfaStates));
    }

    public List<State> accepting()
    {
        return states.stream()
                .filter(State::accept)
                .collect(toImmutableList());
    }

    public ImmutableMap<StateSet, String> names()
    {
        ImmutableMap.Builder<StateSet, String> names = ImmutableMap.builder();
        for (State state : states) {
            names.put(state.nfaStates(), state.name());
        }
        return names.buildOrThrow();
    }

    public int transitionCount()
    {
        return transitions.values().stream()
                .mapToInt(List::size)
                .sum();
    }

    /**
     * Runs the automaton on {@code input}. A symbol with no recorded
     * transition rejects the input.
     */
    public boolean accepts(String input)
    {
        State current = start;
        for (int i = 0; i < input.length(); i++) {
            Optional<State> next = transition(current, input.charAt(i));
            if (next.isEmpty()) {
                return false;
            }
            current = next.get();
        }
        return current.accept();
    }

    public record State(int id, String name, StateSet nfaStates, boolean accept)
    {
        @Override
        public String toString()
        {
            return format("%s:%s%s",
                    name,
                    accept ? "*" : "",
                    nfaStates.label());
        }
    }

    public record Transition(char symbol, State target)
    {
        @Override
        public String toString()
        {
            return format("-[%s]-> %s", symbol, target);
        }
    }

    public static class Builder
    {
        private int nextId;
        private State start;
        private final List<Character> alphabet;
        private final List<State> states = new ArrayList<>();
        private final Map<StateSet, State> index = new HashMap<>();
        private final Map<Integer, List<Transition>> transitions = new LinkedHashMap<>();

        public Builder(List<Character> alphabet)
        {
            this.alphabet = ImmutableList.copyOf(alphabet);
        }

        public State addState(StateSet nfaStates, boolean accept)
        {
            checkArgument(!index.containsKey(nfaStates), "State already exists: %s", nfaStates);
            int id = nextId++;
            State state = new State(id, "q" + id, nfaStates, accept);
            states.add(state);
            index.put(nfaStates, state);
            return state;
        }

        public State addStartState(StateSet nfaStates, boolean accept)
        {
            checkState(start == null, "Start state already set");
            State state = addState(nfaStates, accept);
            start = state;
            return state;
        }

        public Optional<State> getState(StateSet nfaStates)
        {
            return Optional.ofNullable(index.get(nfaStates));
        }

        public boolean hasTransition(State from, char symbol)
        {
            return transitions.getOrDefault(from.id(), ImmutableList.of()).stream()
                    .anyMatch(transition -> transition.symbol() == symbol);
        }

        public void addTransition(State from, char symbol, State to)
        {
            checkState(!hasTransition(from, symbol), "Transition already recorded for %s on '%s'", from, symbol);
            transitions.computeIfAbsent(from.id(), key -> new ArrayList<>())
                    .add(new Transition(symbol, to));
        }

        public DFA build()
        {
            checkState(start != null, "Start state not set");
            return new DFA(start, states, alphabet, transitions, index);
        }
    }
}
