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
import java.io.UncheckedIOException;

/**
 * Renders a {@link DFA} into a textual form. Implementations only read the
 * automaton they are given.
 */
public interface DfaRenderer
{
    void render(DFA dfa, Appendable out)
            throws IOException;

    default String render(DFA dfa)
    {
        StringBuilder builder = new StringBuilder();
        try {
            render(dfa, builder);
        }
        catch (IOException e) {
            // StringBuilder does not throw
            throw new UncheckedIOException(e);
        }
        return builder.toString();
    }
}
