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
 * The sigma section does not define the epsilon symbol (id 0). Only raised when
 * {@link ParserOptions#requireEpsilon()} is set.
 */
public class MissingEpsilonException
        extends FstFormatException
{
    public MissingEpsilonException()
    {
        super("Sigma does not define the epsilon symbol (id " + Symbol.EPSILON + ")", END_OF_INPUT, "");
    }
}
