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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Converts an {@link NFA} into a {@link DFA} whose states are sets of NFA
 * states.
 */
public final class SubsetConstruction
{
    private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);

    private SubsetConstruction() {}

    /**
     * States reachable from {@code state} through zero or more epsilon
     * transitions. Always contains {@code state}.
     */
    public static ImmutableSet<String> epsilonClosure(NFA nfa, String state)
    {
        return epsilonClosure(nfa, ImmutableSet.of(state));
    }

    public static ImmutableSet<String> epsilonClosure(NFA nfa, Set<String> states)
    {
        requireNonNull(nfa, "nfa is null");

        Set<String> closure = new LinkedHashSet<>(states);
        Deque<String> stack = new ArrayDeque<>(states);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            for (String next : nfa.epsilonSuccessors(current)) {
                if (closure.add(next)) {
                    stack.push(next);
                }
            }
        }

        return ImmutableSet.copyOf(closure);
    }

    public static DFA toDfa(NFA nfa)
    {
        return toDfa(nfa, ClosurePolicy.NONE);
    }

    public static DFA toDfa(NFA nfa, ClosurePolicy policy)
    {
        requireNonNull(nfa, "nfa is null");
        requireNonNull(policy, "policy is null");

        DFA.Builder builder = new DFA.Builder(nfa.alphabet().asList());

        StateSet initial = StateSet.copyOf(expand(nfa, ImmutableSet.of(nfa.start()), policy));
        builder.addStartState(initial, initial.intersects(nfa.accepting()));
        LOG.debug("Discovered start state {}", initial);

        Queue<StateSet> queue = new ArrayDeque<>();
        queue.add(initial);

        while (!queue.isEmpty()) {
            StateSet current = queue.poll();
            DFA.State from = builder.getState(current).orElseThrow();

            for (char symbol : nfa.alphabet()) {
                Set<String> targets = new LinkedHashSet<>();
                for (String nfaState : current.states()) {
                    targets.addAll(nfa.outgoing(nfaState, symbol));
                }

                if (targets.isEmpty() || builder.hasTransition(from, symbol)) {
                    continue;
                }

                StateSet next = StateSet.copyOf(expand(nfa, targets, policy));
                Optional<DFA.State> existing = builder.getState(next);
                DFA.State to;
                if (existing.isPresent()) {
                    to = existing.get();
                }
                else {
                    to = builder.addState(next, next.intersects(nfa.accepting()));
                    queue.add(next);
                    LOG.debug("Discovered state {} as {}", next, to.name());
                }

                builder.addTransition(from, symbol, to);
            }
        }

        DFA dfa = builder.build();
        LOG.info("Converted NFA with {} states into DFA with {} states and {} transitions",
                nfa.states().size(),
                dfa.states().size(),
                dfa.transitionCount());
        return dfa;
    }

    private static Set<String> expand(NFA nfa, Set<String> states, ClosurePolicy policy)
    {
        return switch (policy) {
            case NONE -> states;
            case EPSILON_CLOSURE -> epsilonClosure(nfa, states);
        };
    }
}
