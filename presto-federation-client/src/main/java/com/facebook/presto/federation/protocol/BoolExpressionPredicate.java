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
package com.facebook.presto.federation.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import static java.util.Objects.requireNonNull;

/**
 * A boolean column (or literal) used directly as a filter.
 */
public final class BoolExpressionPredicate
        extends Predicate
{
    private final Expression value;

    @JsonCreator
    public BoolExpressionPredicate(@JsonProperty("value") Expression value)
    {
        this.value = requireNonNull(value, "value is null");
    }

    @JsonProperty
    public Expression getValue()
    {
        return value;
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor)
    {
        return visitor.visitBoolExpression(this);
    }

    @Override
    public String toString()
    {
        return value.toString();
    }
}
