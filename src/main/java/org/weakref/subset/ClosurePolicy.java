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

/**
 * Where the subset construction applies epsilon closure.
 */
public enum ClosurePolicy
{
    /**
     * The start subset is {@code {start}} and successors are the raw one-step
     * targets. Epsilon transitions are never followed while building the DFA.
     */
    NONE,

    /**
     * The start subset and every successor subset are replaced by their
     * epsilon closure, so the DFA accepts the same language as the NFA.
     */
    EPSILON_CLOSURE,
}
