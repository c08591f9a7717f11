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

import static java.util.Objects.requireNonNull;

/**
 * Thrown by {@link NFA.Builder#build()} when the automaton description breaks
 * one of its structural contracts.
 */
public class InvalidAutomatonException
        extends IllegalArgumentException
{
    public enum Problem
    {
        NO_STATES,
        NO_START_STATE,
        UNKNOWN_START_STATE,
        UNKNOWN_ACCEPTING_STATE,
        UNKNOWN_TRANSITION_STATE,
        UNKNOWN_TRANSITION_SYMBOL,
        EPSILON_IN_ALPHABET,
    }

    private final Problem problem;

    public InvalidAutomatonException(Problem problem, String message)
    {
        super(message);
        this.problem = requireNonNull(problem, "problem is null");
    }

    public Problem getProblem()
    {
        return problem;
    }
}
