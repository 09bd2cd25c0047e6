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

public final class StructWireType
        extends WireType
{
    private final List<Column> members;

    @JsonCreator
    public StructWireType(@JsonProperty("members") List<Column> members)
    {
        this.members = ImmutableList.copyOf(requireNonNull(members, "members is null"));
    }

    @JsonProperty
    public List<Column> getMembers()
    {
        return members;
    }

    @Override
    public <R> R accept(WireTypeVisitor<R> visitor)
    {
        return visitor.visitStruct(this);
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof StructWireType && ((StructWireType) o).members.equals(members);
    }

    @Override
    public int hashCode()
    {
        return members.hashCode();
    }

    @Override
    public String toString()
    {
        return "Struct" + members;
    }
}
