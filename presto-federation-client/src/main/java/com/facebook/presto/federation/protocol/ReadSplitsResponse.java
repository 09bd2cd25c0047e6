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

/**
 * One streamed page of a split, or the terminal error of a split.
 */
public class ReadSplitsResponse
{
    private final byte[] arrowIpcStreaming;
    private final int splitIndexNumber;
    private final Stats stats;
    private final ApiError error;

    @JsonCreator
    public ReadSplitsResponse(
            @JsonProperty("arrowIpcStreaming") byte[] arrowIpcStreaming,
            @JsonProperty("splitIndexNumber") int splitIndexNumber,
            @JsonProperty("stats") Stats stats,
            @JsonProperty("error") ApiError error)
    {
        this.arrowIpcStreaming = arrowIpcStreaming;
        this.splitIndexNumber = splitIndexNumber;
        this.stats = stats == null ? Stats.empty() : stats;
        this.error = requireNonNull(error, "error is null");
    }

    public static ReadSplitsResponse page(byte[] arrowIpcStreaming, int splitIndexNumber, Stats stats)
    {
        return new ReadSplitsResponse(requireNonNull(arrowIpcStreaming, "arrowIpcStreaming is null"), splitIndexNumber, stats, ApiError.success());
    }

    public static ReadSplitsResponse failure(int splitIndexNumber, ApiError error)
    {
        return new ReadSplitsResponse(null, splitIndexNumber, Stats.empty(), error);
    }

    /**
     * Arrow IPC streaming bytes of the page; null for error responses.
     */
    @JsonProperty
    public byte[] getArrowIpcStreaming()
    {
        return arrowIpcStreaming;
    }

    @JsonProperty
    public int getSplitIndexNumber()
    {
        return splitIndexNumber;
    }

    @JsonProperty
    public Stats getStats()
    {
        return stats;
    }

    @JsonProperty
    public ApiError getError()
    {
        return error;
    }
}
