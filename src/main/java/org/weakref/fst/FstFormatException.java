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

import static java.lang.String.format;

/**
 * Raised when the text of a network cannot be turned into an {@link FstGraph}.
 * Subclasses identify the kind of problem; every instance records the line it
 * was raised on.
 */
public class FstFormatException
        extends IllegalArgumentException
{
    public static final int END_OF_INPUT = -1;

    private final int lineNumber;
    private final String line;

    protected FstFormatException(String message, int lineNumber, String line)
    {
        super(describe(message, lineNumber, line));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /**
     * 1-based line number, or {@link #END_OF_INPUT} when the problem was only
     * detected after the last line.
     */
    public int getLineNumber()
    {
        return lineNumber;
    }

    public String getLine()
    {
        return line;
    }

    private static String describe(String message, int lineNumber, String line)
    {
        if (lineNumber == END_OF_INPUT) {
            return format("%s (at end of input)", message);
        }
        return format("%s (line %s: \"%s\")", message, lineNumber, line);
    }
}
