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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * An alphabet entry. Texts longer than one code point (flag diacritics, tags such
 * as {@code +Noun}) are multichar symbols; everything else is a grapheme.
 */
public record Symbol(int id, String text)
{
    public static final int EPSILON = 0;

    public Symbol
    {
        requireNonNull(text, "text is null");
        checkArgument(!text.isEmpty(), "text is empty");
    }

    public boolean isMultichar()
    {
        return isMultichar(text);
    }

    public boolean isGrapheme()
    {
        return !isMultichar();
    }

    static boolean isMultichar(String text)
    {
        return text.codePointCount(0, text.length()) > 1;
    }

    @Override
    public String toString()
    {
        return id + ":" + text;
    }
}
