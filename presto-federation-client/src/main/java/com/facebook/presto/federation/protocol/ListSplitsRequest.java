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

import static com.google.common.base.MoreObjects.toStringHelper;

public class ListSplitsRequest
{
    private final List<Select> selects;
    private final long maxSplitCount;
    private final long splitSize;
    private final long splitNumberLimit;

    @JsonCreator
    public ListSplitsRequest(
            @JsonProperty("selects") List<Select> selects,
            @JsonProperty("maxSplitCount") long maxSplitCount,
            @JsonProperty("splitSize") long splitSize,
            @JsonProperty("splitNumberLimit") long splitNumberLimit)
    {
        this.selects = selects == null ? ImmutableList.of() : ImmutableList.copyOf(selects);
        this.maxSplitCount = maxSplitCount;
        this.splitSize = splitSize;
        this.splitNumberLimit = splitNumberLimit;
    }

    public ListSplitsRequest(List<Select> selects)
    {
        this(selects, 0, 0, 0);
    }

    @JsonProperty
    public List<Select> getSelects()
    {
        return selects;
    }

    /**
     * Zero when the caller leaves the choice to the data source.
     */
    @JsonProperty
    public long getMaxSplitCount()
    {
        return maxSplitCount;
    }

    @JsonProperty
    public long getSplitSize()
    {
        return splitSize;
    }

    @JsonProperty
    public long getSplitNumberLimit()
    {
        return splitNumberLimit;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("selects", selects)
                .add("maxSplitCount", maxSplitCount)
                .add("splitSize", splitSize)
                .add("splitNumberLimit", splitNumberLimit)
                .toString();
    }
}
