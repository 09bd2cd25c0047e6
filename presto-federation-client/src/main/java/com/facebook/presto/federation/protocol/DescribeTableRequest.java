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

public class DescribeTableRequest
{
    private final DataSourceInstance dataSourceInstance;
    private final String table;
    private final TypeMappingSettings typeMappingSettings;

    @JsonCreator
    public DescribeTableRequest(
            @JsonProperty("dataSourceInstance") DataSourceInstance dataSourceInstance,
            @JsonProperty("table") String table,
            @JsonProperty("typeMappingSettings") TypeMappingSettings typeMappingSettings)
    {
        this.dataSourceInstance = dataSourceInstance;
        this.table = table;
        this.typeMappingSettings = typeMappingSettings == null ? TypeMappingSettings.defaults() : typeMappingSettings;
    }

    @JsonProperty
    public DataSourceInstance getDataSourceInstance()
    {
        return dataSourceInstance;
    }

    @JsonProperty
    public String getTable()
    {
        return table;
    }

    @JsonProperty
    public TypeMappingSettings getTypeMappingSettings()
    {
        return typeMappingSettings;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("dataSourceInstance", dataSourceInstance)
                .add("table", table)
                .add("typeMappingSettings", typeMappingSettings)
                .toString();
    }
}
