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

public final class ComparisonPredicate
        extends Predicate
{
    public enum Operator
    {
        EQUAL("="),
        NOT_EQUAL("<>"),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">=");

        private final String symbol;

        Operator(String symbol)
        {
            this.symbol = symbol;
        }

        public String getSymbol()
        {
            return symbol;
        }
    }

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    @JsonCreator
    public ComparisonPredicate(
            @JsonProperty("operator") Operator operator,
            @JsonProperty("left") Expression left,
            @JsonProperty("right") Expression right)
    {
        this.operator = requireNonNull(operator, "operator is null");
        this.left = requireNonNull(left, "left is null");
        this.right = requireNonNull(right, "right is null");
    }

    @JsonProperty
    public Operator getOperator()
    {
        return operator;
    }

    @JsonProperty
    public Expression getLeft()
    {
        return left;
    }

    @JsonProperty
    public Expression getRight()
    {
        return right;
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor)
    {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString()
    {
        return left + " " + operator.getSymbol() + " " + right;
    }
}
