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

import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.Optional;

import static com.google.common.collect.ImmutableMap.toImmutableMap;

/**
 * Sections of a textual foma network. Each {@code ##name##} header switches the
 * parser into one of these.
 */
public enum Section
{
    INITIAL("foma-net 1.0"),
    PROPS("props"),
    SIGMA("sigma"),
    ARC("states"),
    END("end");

    private static final String DELIMITER = "##";

    private static final ImmutableMap<String, Section> BY_HEADER = Arrays.stream(values())
            .collect(toImmutableMap(Section::header, section -> section));

    private final String header;

    Section(String header)
    {
        this.header = header;
    }

    /**
     * Text between the {@code ##} delimiters that selects this section
     */
    public String header()
    {
        return header;
    }

    public static boolean isHeader(String line)
    {
        return line.startsWith(DELIMITER);
    }

    /**
     * Maps a header line such as {@code ##sigma##} to its section. Empty when the
     * line is not properly delimited or names an unknown section.
     */
    public static Optional<Section> forHeader(String line)
    {
        if (line.length() < 2 * DELIMITER.length() || !line.startsWith(DELIMITER) || !line.endsWith(DELIMITER)) {
            return Optional.empty();
        }
        String payload = line.substring(DELIMITER.length(), line.length() - DELIMITER.length());
        return Optional.ofNullable(BY_HEADER.get(payload));
    }
}
