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

public class ListSplitsResponse
{
    private final List<Split> splits;
    private final ApiError error;

    @JsonCreator
    public ListSplitsResponse(
            @JsonProperty("splits") List<Split> splits,
            @JsonProperty("error") ApiError error)
    {
        this.splits = splits == null ? ImmutableList.of() : ImmutableList.copyOf(splits);
        this.error = requireNonNull(error, "error is null");
    }

    public static ListSplitsResponse success(List<Split> splits)
    {
        return new ListSplitsResponse(splits, ApiError.success());
    }

    public static ListSplitsResponse failure(ApiError error)
    {
        return new ListSplitsResponse(ImmutableList.of(), error);
    }

    @JsonProperty
    public List<Split> getSplits()
    {
        return splits;
    }

    @JsonProperty
    public ApiError getError()
    {
        return error;
    }
}
