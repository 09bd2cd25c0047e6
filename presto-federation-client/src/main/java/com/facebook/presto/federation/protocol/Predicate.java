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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Filter attached to a {@link Select}; the data source may push it down into the backend query.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ComparisonPredicate.class, name = "comparison"),
        @JsonSubTypes.Type(value = ConjunctionPredicate.class, name = "conjunction"),
        @JsonSubTypes.Type(value = DisjunctionPredicate.class, name = "disjunction"),
        @JsonSubTypes.Type(value = NegationPredicate.class, name = "negation"),
        @JsonSubTypes.Type(value = IsNullPredicate.class, name = "isNull"),
        @JsonSubTypes.Type(value = IsNotNullPredicate.class, name = "isNotNull"),
        @JsonSubTypes.Type(value = InPredicate.class, name = "in"),
        @JsonSubTypes.Type(value = BetweenPredicate.class, name = "between"),
        @JsonSubTypes.Type(value = BoolExpressionPredicate.class, name = "boolExpression"),
        @JsonSubTypes.Type(value = RegexpPredicate.class, name = "regexp")})
public abstract class Predicate
{
    public abstract <R> R accept(PredicateVisitor<R> visitor);
}
