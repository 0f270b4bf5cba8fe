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

import java.nio.charset.Charset;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * @param requireEpsilon fail when the sigma section has no entry for id 0
 * @param charset encoding of network files read by {@link FstParser#parse(java.nio.file.Path, ParserOptions)}
 */
public record ParserOptions(boolean requireEpsilon, Charset charset)
{
    private static final ParserOptions DEFAULTS = builder().build();

    public ParserOptions
    {
        requireNonNull(charset, "charset is null");
    }

    public static ParserOptions defaults()
    {
        return DEFAULTS;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static class Builder
    {
        private boolean requireEpsilon;
        private Charset charset = UTF_8;

        public Builder setRequireEpsilon(boolean requireEpsilon)
        {
            this.requireEpsilon = requireEpsilon;
            return this;
        }

        public Builder setCharset(Charset charset)
        {
            this.charset = requireNonNull(charset, "charset is null");
            return this;
        }

        public ParserOptions build()
        {
            return new ParserOptions(requireEpsilon, charset);
        }
    }
}
