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
 * A transition of the network. Labels are symbol ids; {@link Symbol#EPSILON} is the
 * empty string on that tape.
 */
public record Arc(int state, int inLabel, int outLabel, int destination)
{
    public static Arc identity(int state, int label, int destination)
    {
        return new Arc(state, label, label, destination);
    }

    public boolean isIdentity()
    {
        return inLabel == outLabel;
    }

    @Override
    public String toString()
    {
        return format("%s -%s:%s→ %s", state, inLabel, outLabel, destination);
    }
}
