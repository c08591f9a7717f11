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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Writes a rendered {@link DFA} to a file. A failed write leaves the automaton
 * untouched, so the same instance can be written again.
 */
public final class DfaExporter
{
    private static final Logger LOG = LoggerFactory.getLogger(DfaExporter.class);

    private DfaExporter() {}

    public static void write(DFA dfa, DfaRenderer renderer, Path destination)
            throws ExportException
    {
        requireNonNull(dfa, "dfa is null");
        requireNonNull(renderer, "renderer is null");
        requireNonNull(destination, "destination is null");

        try (Writer writer = Files.newBufferedWriter(destination, UTF_8)) {
            renderer.render(dfa, writer);
        }
        catch (IOException e) {
            throw new ExportException(destination, e);
        }
        LOG.info("DFA written to {}", destination);
    }
}
