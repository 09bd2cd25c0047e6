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

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public class Split
{
    private static final byte[] EMPTY_DESCRIPTION = new byte[0];

    private final long id;
    private final Select select;
    private final byte[] description;

    /**
     * @param description opaque backend-specific locator, interpreted only by the data source that produced the split
     */
    @JsonCreator
    public Split(
            @JsonProperty("id") long id,
            @JsonProperty("select") Select select,
            @JsonProperty("description") byte[] description)
    {
        this.id = id;
        this.select = requireNonNull(select, "select is null");
        this.description = description == null ? EMPTY_DESCRIPTION : description;
    }

    @JsonProperty
    public long getId()
    {
        return id;
    }

    @JsonProperty
    public Select getSelect()
    {
        return select;
    }

    @JsonProperty
    public byte[] getDescription()
    {
        return description;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("id", id)
                .add("select", select)
                .add("descriptionLength", description.length)
                .toString();
    }
}
