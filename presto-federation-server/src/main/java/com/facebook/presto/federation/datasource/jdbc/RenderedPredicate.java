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
package com.facebook.presto.federation.datasource.jdbc;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Result of rendering a select's predicate into a WHERE clause with {@code ?} placeholders.
 * Parts that could not be rendered are left out and described in {@link #getErrors()}.
 */
public class RenderedPredicate
{
    private final Optional<String> clause;
    private final List<Object> arguments;
    private final List<String> errors;

    public RenderedPredicate(Optional<String> clause, List<Object> arguments, List<String> errors)
    {
        this.clause = requireNonNull(clause, "clause is null");
        this.arguments = ImmutableList.copyOf(requireNonNull(arguments, "arguments is null"));
        this.errors = ImmutableList.copyOf(requireNonNull(errors, "errors is null"));
    }

    public Optional<String> getClause()
    {
        return clause;
    }

    public List<Object> getArguments()
    {
        return arguments;
    }

    public List<String> getErrors()
    {
        return errors;
    }
}
