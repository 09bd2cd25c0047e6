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

public class TypeMappingSettings
{
    private final DateTimeFormat dateTimeFormat;

    @JsonCreator
    public TypeMappingSettings(@JsonProperty("dateTimeFormat") DateTimeFormat dateTimeFormat)
    {
        this.dateTimeFormat = dateTimeFormat == null ? DateTimeFormat.UNSPECIFIED : dateTimeFormat;
    }

    public static TypeMappingSettings defaults()
    {
        return new TypeMappingSettings(DateTimeFormat.YQL_FORMAT);
    }

    @JsonProperty
    public DateTimeFormat getDateTimeFormat()
    {
        return dateTimeFormat;
    }

    @Override
    public String toString()
    {
        return "dateTimeFormat=" + dateTimeFormat;
    }
}
