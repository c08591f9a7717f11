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

import java.io.IOException;

import static java.lang.String.format;

/**
 * One block per DFA state, in name order:
 *
 * <pre>
 * State q0 {A}:
 *     On symbol 'a' -> q1 {A B}
 * </pre>
 */
public class TextRenderer
        implements DfaRenderer
{
    @Override
    public void render(DFA dfa, Appendable out)
            throws IOException
    {
        for (DFA.State state : dfa.states()) {
            out.append(format("State %s %s:\n", state.name(), state.nfaStates().label()));
            for (DFA.Transition transition : dfa.transitions(state)) {
                DFA.State target = transition.target();
                out.append(format("    On symbol '%s' -> %s %s\n", transition.symbol(), target.name(), target.nfaStates().label()));
            }
        }
    }
}
