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

public final class OptionalWireType
        extends WireType
{
    private final WireType item;

    @JsonCreator
    public OptionalWireType(@JsonProperty("item") WireType item)
    {
        this.item = requireNonNull(item, "item is null");
    }

    @JsonProperty
    public WireType getItem()
    {
        return item;
    }

    @Override
    public boolean isOptional()
    {
        return true;
    }

    @Override
    public WireType unwrap()
    {
        return item.unwrap();
    }

    @Override
    public <R> R accept(WireTypeVisitor<R> visitor)
    {
        return visitor.visitOptional(this);
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof OptionalWireType && ((OptionalWireType) o).item.equals(item);
    }

    @Override
    public int hashCode()
    {
        return 31 * item.hashCode() + 1;
    }

    @Override
    public String toString()
    {
        return "Optional<" + item + ">";
    }
}
