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
import java.util.HashSet;
import java.util.Set;

import static java.lang.String.format;

/**
 * Graphviz description of a DFA. Accepting states are drawn as double
 * circles and a point-shaped {@code start} node marks the initial state.
 */
public class DotRenderer
        implements DfaRenderer
{
    static final String START_NODE = "start";

    @Override
    public void render(DFA dfa, Appendable out)
            throws IOException
    {
        out.append("digraph DFA {\n");
        out.append("    rankdir=LR;\n");

        for (DFA.State state : dfa.states()) {
            out.append(format("    %s [label=\"%s\", shape=%s];\n",
                    state.name(),
                    escape(state.nfaStates().label()),
                    state.accept() ? "doublecircle" : "circle"));
        }

        out.append(format("    %s [shape=point];\n", START_NODE));
        out.append(format("    %s -> %s;\n", START_NODE, dfa.start().name()));

        Set<Edge> emitted = new HashSet<>();
        for (DFA.State state : dfa.states()) {
            for (DFA.Transition transition : dfa.transitions(state)) {
                Edge edge = new Edge(state.name(), transition.symbol(), transition.target().name());
                if (emitted.add(edge)) {
                    out.append(format("    %s -> %s [label=\"%s\"];\n",
                            edge.from(),
                            edge.to(),
                            escape(String.valueOf(edge.symbol()))));
                }
            }
        }

        out.append("}\n");
    }

    static String escape(String value)
    {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private record Edge(String from, char symbol, String to) {}
}
