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
import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

public final class DisjunctionPredicate
        extends Predicate
{
    private final List<Predicate> operands;

    @JsonCreator
    public DisjunctionPredicate(@JsonProperty("operands") List<Predicate> operands)
    {
        this.operands = ImmutableList.copyOf(requireNonNull(operands, "operands is null"));
    }

    @JsonProperty
    public List<Predicate> getOperands()
    {
        return operands;
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor)
    {
        return visitor.visitDisjunction(this);
    }

    @Override
    public String toString()
    {
        return "OR" + operands;
    }
}
