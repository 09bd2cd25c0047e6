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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

public final class TaggedWireType
        extends WireType
{
    private final String tag;
    private final WireType type;

    @JsonCreator
    public TaggedWireType(
            @JsonProperty("tag") String tag,
            @JsonProperty("type") WireType type)
    {
        this.tag = requireNonNull(tag, "tag is null");
        this.type = requireNonNull(type, "type is null");
    }

    @JsonProperty
    public String getTag()
    {
        return tag;
    }

    @JsonProperty
    public WireType getType()
    {
        return type;
    }

    @Override
    public boolean isOptional()
    {
        return type.isOptional();
    }

    @Override
    public WireType unwrap()
    {
        return type.unwrap();
    }

    @Override
    public <R> R accept(WireTypeVisitor<R> visitor)
    {
        return visitor.visitTagged(this);
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof TaggedWireType)) {
            return false;
        }
        TaggedWireType that = (TaggedWireType) o;
        return tag.equals(that.tag) && type.equals(that.type);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(tag, type);
    }

    @Override
    public String toString()
    {
        return "Tagged<" + type + ", '" + tag + "'>";
    }
}
