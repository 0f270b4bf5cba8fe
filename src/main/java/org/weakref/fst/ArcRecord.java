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

/**
 * One line of the {@code ##states##} section. The shape is chosen by the number of
 * fields on the line; weights are read but not kept.
 */
sealed interface ArcRecord
{
    /**
     * {@code -1 -1 -1 -1 -1}
     */
    record Sentinel()
            implements ArcRecord {}

    /**
     * {@code label dest}, leaving the implied state
     */
    record ImpliedIdentity(int label, int destination)
            implements ArcRecord {}

    /**
     * {@code in out dest}, leaving the implied state
     */
    record ImpliedTransduction(int inLabel, int outLabel, int destination)
            implements ArcRecord {}

    /**
     * {@code src label dest weight}
     */
    record Identity(int state, int label, int destination)
            implements ArcRecord {}

    /**
     * {@code src -1 dest weight} or {@code src label -1 weight}
     */
    record Accepting(int state)
            implements ArcRecord {}

    /**
     * {@code src in out dest weight}
     */
    record Transduction(int state, int inLabel, int outLabel, int destination)
            implements ArcRecord {}
}
