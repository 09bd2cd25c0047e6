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

public class ReadSplitsRequest
{
    private final DataSourceInstance dataSourceInstance;
    private final List<Split> splits;
    private final ReadSplitsFormat format;
    private final Filtering filtering;

    /**
     * @param dataSourceInstance optional; when null every split is read from the instance embedded in its select
     */
    @JsonCreator
    public ReadSplitsRequest(
            @JsonProperty("dataSourceInstance") DataSourceInstance dataSourceInstance,
            @JsonProperty("splits") List<Split> splits,
            @JsonProperty("format") ReadSplitsFormat format,
            @JsonProperty("filtering") Filtering filtering)
    {
        this.dataSourceInstance = dataSourceInstance;
        this.splits = splits == null ? ImmutableList.of() : ImmutableList.copyOf(splits);
        this.format = format == null ? ReadSplitsFormat.UNSPECIFIED : format;
        this.filtering = filtering == null ? Filtering.UNSPECIFIED : filtering;
    }

    @JsonProperty
    public DataSourceInstance getDataSourceInstance()
    {
        return dataSourceInstance;
    }

    @JsonProperty
    public List<Split> getSplits()
    {
        return splits;
    }

    @JsonProperty
    public ReadSplitsFormat getFormat()
    {
        return format;
    }

    @JsonProperty
    public Filtering getFiltering()
    {
        return filtering;
    }

    public ReadSplitsRequest withFormat(ReadSplitsFormat format)
    {
        return new ReadSplitsRequest(dataSourceInstance, splits, format, filtering);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("splits", splits.size())
                .add("format", format)
                .add("filtering", filtering)
                .toString();
    }
}
