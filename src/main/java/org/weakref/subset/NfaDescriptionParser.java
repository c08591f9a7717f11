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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.io.CharStreams;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;

/**
 * Reads an automaton description, either as the answers to the interactive
 * prompts:
 *
 * <pre>
 * Enter number of states: 2
 * Enter states: A B
 * Enter number of symbols: 1
 * Enter symbols (separate by space): a
 * Enter start state: A
 * Enter number of accepting states: 1
 * Enter accepting states: B
 * Enter number of transitions: 1
 * Enter transition (fromState symbol toState): A a B
 * </pre>
 *
 * or as the same values without the prompts. A line that starts with an
 * {@code Enter ...:} prompt has the prompt skipped; any other line is read
 * as values, so labels may contain colons.
 */
public final class NfaDescriptionParser
{
    private static final Pattern PROMPT = Pattern.compile("^\\s*Enter [^:]*:");
    private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private NfaDescriptionParser() {}

    public static NFA parse(Reader reader)
            throws NfaParseException
    {
        try {
            return parse(CharStreams.toString(reader));
        }
        catch (IOException e) {
            throw new NfaParseException("Failed to read automaton description", e);
        }
    }

    public static NFA parse(String description)
            throws NfaParseException
    {
        Tokens tokens = new Tokens(tokenize(description));
        NFA.Builder builder = new NFA.Builder();

        int stateCount = tokens.nextCount("number of states");
        for (int i = 0; i < stateCount; i++) {
            builder.addState(tokens.next("state"));
        }

        int symbolCount = tokens.nextCount("number of symbols");
        for (int i = 0; i < symbolCount; i++) {
            builder.addSymbol(tokens.nextSymbol("symbol"));
        }

        builder.setStart(tokens.next("start state"));

        int acceptingCount = tokens.nextCount("number of accepting states");
        for (int i = 0; i < acceptingCount; i++) {
            builder.addAccepting(tokens.next("accepting state"));
        }

        int transitionCount = tokens.nextCount("number of transitions");
        for (int i = 0; i < transitionCount; i++) {
            String from = tokens.next("transition source");
            char symbol = tokens.nextSymbol("transition symbol");
            String to = tokens.next("transition target");
            builder.addTransition(from, symbol, to);
        }

        if (tokens.hasNext()) {
            throw new NfaParseException(format("Unexpected trailing input '%s'", tokens.next("trailing input")));
        }

        try {
            return builder.build();
        }
        catch (InvalidAutomatonException e) {
            throw new NfaParseException(e.getMessage(), e);
        }
    }

    private static List<String> tokenize(String description)
    {
        List<String> tokens = new ArrayList<>();
        for (String line : description.split("\\R")) {
            Matcher prompt = PROMPT.matcher(line);
            String values = prompt.lookingAt() ? line.substring(prompt.end()) : line;
            WHITESPACE.split(values).forEach(tokens::add);
        }
        return tokens;
    }

    private static class Tokens
    {
        private final List<String> tokens;
        private int position;

        Tokens(List<String> tokens)
        {
            this.tokens = tokens;
        }

        boolean hasNext()
        {
            return position < tokens.size();
        }

        String next(String field)
                throws NfaParseException
        {
            if (!hasNext()) {
                throw new NfaParseException(format("Unexpected end of input reading %s", field));
            }
            return tokens.get(position++);
        }

        int nextCount(String field)
                throws NfaParseException
        {
            String token = next(field);
            int count;
            try {
                count = Integer.parseInt(token);
            }
            catch (NumberFormatException e) {
                throw new NfaParseException(format("Expected a number for %s but found '%s'", field, token), e);
            }
            if (count < 0) {
                throw new NfaParseException(format("Negative %s: %s", field, count));
            }
            return count;
        }

        char nextSymbol(String field)
                throws NfaParseException
        {
            String token = next(field);
            if (token.length() != 1) {
                throw new NfaParseException(format("Expected a single character for %s but found '%s'", field, token));
            }
            return token.charAt(0);
        }
    }
}
