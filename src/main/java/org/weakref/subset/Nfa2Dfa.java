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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Command line entry point: reads an automaton description, prints the NFA and
 * the converted DFA, and writes the DFA as a Graphviz file.
 */
public class Nfa2Dfa
{
    private static final Logger LOG = LoggerFactory.getLogger(Nfa2Dfa.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_INVALID_INPUT = 2;
    static final int EXIT_EXPORT_FAILED = 3;

    @Parameter(names = "-input", description = "Automaton description file (defaults to standard input)")
    private String input;

    @Parameter(names = "-dot", description = "Graphviz output file")
    private String dot = "dfa.dot";

    @Parameter(names = "-policy", description = "Where to apply epsilon closure: NONE or EPSILON_CLOSURE")
    private ClosurePolicy policy = ClosurePolicy.NONE;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public static void main(String... args)
    {
        System.exit(run(args, System.in, System.out));
    }

    static int run(String[] args, InputStream in, PrintStream out)
    {
        Nfa2Dfa command = new Nfa2Dfa();
        JCommander commander = JCommander.newBuilder()
                .programName("nfa2dfa")
                .addObject(command)
                .build();
        try {
            commander.parse(args);
        }
        catch (ParameterException e) {
            LOG.error(e.getMessage());
            commander.usage();
            return EXIT_USAGE;
        }

        if (command.help) {
            commander.usage();
            return EXIT_OK;
        }

        return command.execute(in, out);
    }

    private int execute(InputStream in, PrintStream out)
    {
        NFA nfa;
        try {
            nfa = readNfa(in);
        }
        catch (NfaParseException e) {
            LOG.error("Invalid automaton description: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        out.println("NFA:");
        out.print(nfa);

        DFA dfa = SubsetConstruction.toDfa(nfa, policy);
        out.println();
        out.println("Converted DFA:");
        out.print(new TextRenderer().render(dfa));

        try {
            DfaExporter.write(dfa, new DotRenderer(), Paths.get(dot));
        }
        catch (ExportException e) {
            LOG.error(e.getMessage(), e.getCause());
            return EXIT_EXPORT_FAILED;
        }
        return EXIT_OK;
    }

    private NFA readNfa(InputStream in)
            throws NfaParseException
    {
        if (input == null) {
            return NfaDescriptionParser.parse(new InputStreamReader(in, UTF_8));
        }

        Path path = Paths.get(input);
        try (Reader reader = Files.newBufferedReader(path, UTF_8)) {
            return NfaDescriptionParser.parse(reader);
        }
        catch (IOException e) {
            throw new NfaParseException("Failed to read " + path, e);
        }
    }
}
