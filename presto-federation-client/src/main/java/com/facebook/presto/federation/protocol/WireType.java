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

import java.util.List;

/**
 * Closed set of column types understood by the callers of the connector.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PrimitiveWireType.class, name = "primitive"),
        @JsonSubTypes.Type(value = OptionalWireType.class, name = "optional"),
        @JsonSubTypes.Type(value = TaggedWireType.class, name = "tagged"),
        @JsonSubTypes.Type(value = StructWireType.class, name = "struct"),
        @JsonSubTypes.Type(value = DecimalWireType.class, name = "decimal")})
public abstract class WireType
{
    public static WireType primitive(PrimitiveTypeId typeId)
    {
        return new PrimitiveWireType(typeId);
    }

    public static WireType optional(WireType item)
    {
        return new OptionalWireType(item);
    }

    public static WireType optional(PrimitiveTypeId typeId)
    {
        return new OptionalWireType(new PrimitiveWireType(typeId));
    }

    public static WireType tagged(String tag, WireType type)
    {
        return new TaggedWireType(tag, type);
    }

    public static WireType struct(List<Column> members)
    {
        return new StructWireType(members);
    }

    public static WireType decimal(int precision, int scale)
    {
        return new DecimalWireType(precision, scale);
    }

    public boolean isOptional()
    {
        return false;
    }

    /**
     * Strips optional and tagged wrappers.
     */
    public WireType unwrap()
    {
        return this;
    }

    public abstract <R> R accept(WireTypeVisitor<R> visitor);
}
