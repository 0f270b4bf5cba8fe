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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import com.google.common.primitives.Ints;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.lang.String.format;

/**
 * The visible alphabet of a network: symbol id to symbol text, without epsilon.
 */
public final class SymbolTable
{
    private static final Splitter FIELDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final ImmutableSortedMap<Integer, String> sigma;
    private final ImmutableMap<String, Integer> ids;

    private SymbolTable(Map<Integer, String> sigma)
    {
        this.sigma = ImmutableSortedMap.copyOf(sigma);

        Map<String, Integer> ids = new HashMap<>();
        // ascending id order, so the lowest id wins for a shared text
        this.sigma.forEach((id, text) -> ids.putIfAbsent(text, id));
        this.ids = ImmutableMap.copyOf(ids);
    }

    public static SymbolTable of(Map<Integer, String> sigma)
    {
        Map<Integer, String> visible = new TreeMap<>(sigma);
        visible.remove(Symbol.EPSILON);
        return new SymbolTable(visible);
    }

    public Optional<String> text(int id)
    {
        return Optional.ofNullable(sigma.get(id));
    }

    public OptionalInt id(String text)
    {
        Integer id = ids.get(text);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    public boolean contains(int id)
    {
        return sigma.containsKey(id);
    }

    public int size()
    {
        return sigma.size();
    }

    public ImmutableSortedMap<Integer, String> sigma()
    {
        return sigma;
    }

    public ImmutableSortedMap<Integer, String> multicharSymbols()
    {
        return ImmutableSortedMap.copyOfSorted(Maps.filterValues(sigma, text -> Symbol.isMultichar(text)));
    }

    public ImmutableSortedMap<Integer, String> graphemes()
    {
        return ImmutableSortedMap.copyOfSorted(Maps.filterValues(sigma, text -> !Symbol.isMultichar(text)));
    }

    public ImmutableList<Symbol> symbols()
    {
        return sigma.entrySet().stream()
                .map(entry -> new Symbol(entry.getKey(), entry.getValue()))
                .collect(toImmutableList());
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolTable other)) {
            return false;
        }
        return sigma.equals(other.sigma);
    }

    @Override
    public int hashCode()
    {
        return sigma.hashCode();
    }

    @Override
    public String toString()
    {
        return sigma.toString();
    }

    /**
     * Accumulates the lines of a {@code ##sigma##} section.
     */
    public static class Builder
    {
        private final Map<Integer, String> sigma = new TreeMap<>();

        /**
         * Adds an {@code <id> <text>} line. A repeated id replaces the earlier text.
         */
        public Builder add(String line, int lineNumber)
        {
            List<String> fields = FIELDS.splitToList(line);
            if (fields.size() != 2) {
                throw new MalformedSymbolException(
                        format("Expected <id> <symbol>, found %s field(s)", fields.size()),
                        lineNumber,
                        line);
            }

            Integer id = Ints.tryParse(fields.get(0));
            if (id == null) {
                throw new MalformedSymbolException(format("Symbol id '%s' is not an integer", fields.get(0)), lineNumber, line);
            }

            sigma.put(id, fields.get(1));
            return this;
        }

        public boolean definesEpsilon()
        {
            return sigma.containsKey(Symbol.EPSILON);
        }

        public SymbolTable build(ParserOptions options)
        {
            if (options.requireEpsilon() && !definesEpsilon()) {
                throw new MissingEpsilonException();
            }
            return of(sigma);
        }
    }
}
