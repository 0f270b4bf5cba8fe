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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Transition graph of a parsed network. Immutable once built.
 */
public final class FstGraph
{
    private static final String EPSILON_TEXT = "ε";

    private final SymbolTable symbols;
    private final ImmutableSet<Arc> arcs;
    private final ImmutableSetMultimap<Integer, Arc> arcsBySource;
    private final ImmutableSortedSet<Integer> states;
    private final ImmutableSortedSet<Integer> acceptingStates;

    private FstGraph(SymbolTable symbols, Set<Arc> arcs, Set<Integer> acceptingStates)
    {
        this.symbols = requireNonNull(symbols, "symbols is null");
        this.arcs = ImmutableSet.copyOf(arcs);
        this.acceptingStates = ImmutableSortedSet.copyOf(acceptingStates);

        ImmutableSetMultimap.Builder<Integer, Arc> bySource = ImmutableSetMultimap.builder();
        Set<Integer> states = new TreeSet<>(acceptingStates);
        for (Arc arc : this.arcs) {
            bySource.put(arc.state(), arc);
            states.add(arc.state());
        }
        this.arcsBySource = bySource.build();
        this.states = ImmutableSortedSet.copyOf(states);
    }

    public SymbolTable symbols()
    {
        return symbols;
    }

    /**
     * Every symbol except epsilon
     */
    public ImmutableSortedMap<Integer, String> sigma()
    {
        return symbols.sigma();
    }

    public ImmutableSortedMap<Integer, String> multicharSymbols()
    {
        return symbols.multicharSymbols();
    }

    public ImmutableSortedMap<Integer, String> graphemes()
    {
        return symbols.graphemes();
    }

    public Optional<String> symbol(int id)
    {
        return symbols.text(id);
    }

    public OptionalInt symbolId(String text)
    {
        return symbols.id(text);
    }

    public ImmutableSet<Arc> arcs()
    {
        return arcs;
    }

    public ImmutableSet<Arc> arcsFrom(int state)
    {
        return arcsBySource.get(state);
    }

    public ImmutableSetMultimap<Integer, Arc> arcsBySource()
    {
        return arcsBySource;
    }

    /**
     * Sources of all arcs plus all accepting states. Destinations that are neither
     * do not appear here.
     */
    public ImmutableSortedSet<Integer> states()
    {
        return states;
    }

    public ImmutableSortedSet<Integer> acceptingStates()
    {
        return acceptingStates;
    }

    public boolean isAccepting(int state)
    {
        return acceptingStates.contains(state);
    }

    /**
     * Renders an arc with symbol texts in place of ids.
     */
    public String describe(Arc arc)
    {
        return format("%s -%s:%s→ %s", arc.state(), label(arc.inLabel()), label(arc.outLabel()), arc.destination());
    }

    private String label(int id)
    {
        if (id == Symbol.EPSILON) {
            return EPSILON_TEXT;
        }
        return symbols.text(id).orElse(String.valueOf(id));
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FstGraph other)) {
            return false;
        }
        return symbols.equals(other.symbols) &&
                arcs.equals(other.arcs) &&
                acceptingStates.equals(other.acceptingStates);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(symbols, arcs, acceptingStates);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("symbols", symbols.size())
                .add("states", states.size())
                .add("arcs", arcs.size())
                .add("acceptingStates", acceptingStates)
                .toString();
    }

    public static class Builder
    {
        private final Set<Arc> arcs = new LinkedHashSet<>();
        private final Set<Integer> acceptingStates = new TreeSet<>();

        public Builder addArc(Arc arc)
        {
            arcs.add(requireNonNull(arc, "arc is null"));
            return this;
        }

        public Builder addAcceptingState(int state)
        {
            acceptingStates.add(state);
            return this;
        }

        public FstGraph build(SymbolTable symbols)
        {
            return new FstGraph(symbols, arcs, acceptingStates);
        }
    }
}
