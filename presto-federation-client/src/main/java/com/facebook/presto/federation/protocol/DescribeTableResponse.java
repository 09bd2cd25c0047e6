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

public class DescribeTableResponse
{
    private final TableSchema schema;
    private final ApiError error;

    @JsonCreator
    public DescribeTableResponse(
            @JsonProperty("schema") TableSchema schema,
            @JsonProperty("error") ApiError error)
    {
        this.schema = schema;
        this.error = requireNonNull(error, "error is null");
    }

    public static DescribeTableResponse success(TableSchema schema)
    {
        return new DescribeTableResponse(requireNonNull(schema, "schema is null"), ApiError.success());
    }

    public static DescribeTableResponse failure(ApiError error)
    {
        return new DescribeTableResponse(null, error);
    }

    /**
     * Null unless the error envelope is successful.
     */
    @JsonProperty
    public TableSchema getSchema()
    {
        return schema;
    }

    @JsonProperty
    public ApiError getError()
    {
        return error;
    }
}
