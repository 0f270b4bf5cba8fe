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
import com.google.common.primitives.Ints;
import org.weakref.fst.ArcRecord.Accepting;
import org.weakref.fst.ArcRecord.Identity;
import org.weakref.fst.ArcRecord.ImpliedIdentity;
import org.weakref.fst.ArcRecord.ImpliedTransduction;
import org.weakref.fst.ArcRecord.Sentinel;
import org.weakref.fst.ArcRecord.Transduction;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Decodes lines of the {@code ##states##} section.
 * <p>
 * Consecutive transitions leaving the same state are written without the source
 * state after the first one, so decoding a line needs the source state of the
 * last line that named one. That value is passed in and handed back in each
 * {@link Step} instead of being kept here.
 */
final class TransitionDecoder
{
    private static final Splitter FIELDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private static final int NONE = -1;

    private TransitionDecoder() {}

    static Step decode(String line, int lineNumber, OptionalInt impliedState)
    {
        return apply(read(line, lineNumber), impliedState, line, lineNumber);
    }

    static ArcRecord read(String line, int lineNumber)
    {
        int[] fields = parseFields(line, lineNumber);

        switch (fields.length) {
            case 2:
                return new ImpliedIdentity(fields[0], fields[1]);
            case 3:
                return new ImpliedTransduction(fields[0], fields[1], fields[2]);
            case 4:
                if (fields[1] == NONE || fields[2] == NONE) {
                    return new Accepting(fields[0]);
                }
                return new Identity(fields[0], fields[1], fields[2]);
            case 5:
                if (Arrays.stream(fields).allMatch(field -> field == NONE)) {
                    return new Sentinel();
                }
                return new Transduction(fields[0], fields[1], fields[2], fields[3]);
            default:
                throw new MalformedTransitionException(
                        format("Expected 2 to 5 fields, found %s", fields.length),
                        lineNumber,
                        line);
        }
    }

    static Step apply(ArcRecord record, OptionalInt impliedState, String line, int lineNumber)
    {
        requireNonNull(impliedState, "impliedState is null");

        if (record instanceof Sentinel) {
            return new Step(record, Optional.empty(), OptionalInt.empty(), impliedState);
        }
        if (record instanceof Accepting accepting) {
            return new Step(record, Optional.empty(), OptionalInt.of(accepting.state()), impliedState);
        }
        if (record instanceof ImpliedIdentity implied) {
            int state = requireImpliedState(impliedState, line, lineNumber);
            return Step.of(record, Arc.identity(state, implied.label(), implied.destination()), impliedState);
        }
        if (record instanceof ImpliedTransduction implied) {
            int state = requireImpliedState(impliedState, line, lineNumber);
            return Step.of(record, new Arc(state, implied.inLabel(), implied.outLabel(), implied.destination()), impliedState);
        }
        if (record instanceof Identity identity) {
            Arc arc = Arc.identity(identity.state(), identity.label(), identity.destination());
            return Step.of(record, arc, OptionalInt.of(identity.state()));
        }
        if (record instanceof Transduction transduction) {
            Arc arc = new Arc(transduction.state(), transduction.inLabel(), transduction.outLabel(), transduction.destination());
            return Step.of(record, arc, OptionalInt.of(transduction.state()));
        }

        throw new IllegalStateException("Unsupported record: " + record);
    }

    private static int requireImpliedState(OptionalInt impliedState, String line, int lineNumber)
    {
        if (impliedState.isEmpty()) {
            throw new NoImpliedStateException("Transition has no source state and no earlier line named one", lineNumber, line);
        }
        return impliedState.getAsInt();
    }

    private static int[] parseFields(String line, int lineNumber)
    {
        List<String> tokens = FIELDS.splitToList(line);

        int[] fields = new int[tokens.size()];
        for (int i = 0; i < fields.length; i++) {
            Integer value = Ints.tryParse(tokens.get(i));
            if (value == null) {
                throw new MalformedTransitionException(format("Field '%s' is not an integer", tokens.get(i)), lineNumber, line);
            }
            fields[i] = value;
        }
        return fields;
    }

    /**
     * Effect of one decoded line.
     *
     * @param arc the transition the line defines, if any
     * @param acceptingState the state the line marks as accepting, if any
     * @param impliedState source state for the next line without one
     */
    record Step(ArcRecord record, Optional<Arc> arc, OptionalInt acceptingState, OptionalInt impliedState)
    {
        Step
        {
            requireNonNull(record, "record is null");
            requireNonNull(arc, "arc is null");
            requireNonNull(acceptingState, "acceptingState is null");
            requireNonNull(impliedState, "impliedState is null");
        }

        static Step of(ArcRecord record, Arc arc, OptionalInt impliedState)
        {
            return new Step(record, Optional.of(arc), OptionalInt.empty(), impliedState);
        }
    }
}
