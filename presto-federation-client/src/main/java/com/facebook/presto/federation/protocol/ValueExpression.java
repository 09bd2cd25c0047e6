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
 * Literal value of a primitive type. Dates and timestamps are carried in their ISO-8601 text form.
 */
public final class ValueExpression
        extends Expression
{
    private final PrimitiveTypeId type;
    private final Object value;

    @JsonCreator
    public ValueExpression(
            @JsonProperty("type") PrimitiveTypeId type,
            @JsonProperty("value") Object value)
    {
        this.type = requireNonNull(type, "type is null");
        this.value = requireNonNull(value, "value is null");
    }

    @JsonProperty
    public PrimitiveTypeId getType()
    {
        return type;
    }

    @JsonProperty
    public Object getValue()
    {
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor)
    {
        return visitor.visitValue(this);
    }

    @Override
    public String toString()
    {
        return type + "'" + value + "'";
    }
}
