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

public final class PrimitiveWireType
        extends WireType
{
    private final PrimitiveTypeId typeId;

    @JsonCreator
    public PrimitiveWireType(@JsonProperty("typeId") PrimitiveTypeId typeId)
    {
        this.typeId = requireNonNull(typeId, "typeId is null");
    }

    @JsonProperty
    public PrimitiveTypeId getTypeId()
    {
        return typeId;
    }

    @Override
    public <R> R accept(WireTypeVisitor<R> visitor)
    {
        return visitor.visitPrimitive(this);
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof PrimitiveWireType && ((PrimitiveWireType) o).typeId == typeId;
    }

    @Override
    public int hashCode()
    {
        return typeId.hashCode();
    }

    @Override
    public String toString()
    {
        return typeId.name();
    }
}
