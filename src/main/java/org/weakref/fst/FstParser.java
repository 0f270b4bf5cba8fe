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
package org.weakref.fst;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.weakref.fst.TransitionDecoder.Step;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * Reads the plain-text form of a foma network:
 * <pre>
 * ##foma-net 1.0##
 * ##props##
 * 2 17 9 1 1 1 0 1 1 0 1 2 name
 * ##sigma##
 * 0 @_EPSILON_SYMBOL_@
 * 97 a
 * ##states##
 * 0 97 0 1 0
 * 1 -1 -1 1
 * -1 -1 -1 -1 -1
 * ##end##
 * </pre>
 * Parsing either returns a complete {@link FstGraph} or throws a
 * {@link FstFormatException}; nothing is shared between calls.
 */
public final class FstParser
{
    private static final Logger log = LoggerFactory.getLogger(FstParser.class);

    private FstParser() {}

    public static FstGraph parse(String text)
    {
        return parse(text, ParserOptions.defaults());
    }

    public static FstGraph parse(String text, ParserOptions options)
    {
        requireNonNull(text, "text is null");
        requireNonNull(options, "options is null");

        List<String> lines = text.lines().collect(toImmutableList());

        Section section = Section.INITIAL;
        SymbolTable.Builder sigma = new SymbolTable.Builder();
        FstGraph.Builder graph = new FstGraph.Builder();
        OptionalInt impliedState = OptionalInt.empty();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;

            if (Section.isHeader(line)) {
                section = Section.forHeader(line)
                        .orElseThrow(() -> new UnknownSectionException("Unknown section header", lineNumber, line));
                continue;
            }

            switch (section) {
                case SIGMA:
                    sigma.add(line, lineNumber);
                    break;
                case ARC:
                    Step step = TransitionDecoder.decode(line, lineNumber, impliedState);
                    step.arc().ifPresent(graph::addArc);
                    step.acceptingState().ifPresent(graph::addAcceptingState);
                    impliedState = step.impliedState();
                    break;
                case INITIAL:
                case PROPS:
                case END:
                    // compiler metadata, blank lines included
                    break;
                default:
                    throw new IllegalStateException("Unsupported section: " + section);
            }
        }

        if (section != Section.END) {
            throw new TruncatedInputException(section);
        }

        FstGraph result = graph.build(sigma.build(options));
        log.debug("Parsed network: {}", result);
        return result;
    }

    public static FstGraph parse(Path path)
            throws IOException
    {
        return parse(path, ParserOptions.defaults());
    }

    public static FstGraph parse(Path path, ParserOptions options)
            throws IOException
    {
        requireNonNull(path, "path is null");
        requireNonNull(options, "options is null");

        log.debug("Loading network from {}", path);
        return parse(Files.readString(path, options.charset()), options);
    }
}
