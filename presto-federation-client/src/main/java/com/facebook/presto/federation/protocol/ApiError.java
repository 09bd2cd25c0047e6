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

/**
 * In-band error envelope carried by every response.
 */
public class ApiError
{
    private static final ApiError SUCCESS = new ApiError(StatusCode.SUCCESS, "succeeded");

    private final StatusCode status;
    private final String message;

    @JsonCreator
    public ApiError(
            @JsonProperty("status") StatusCode status,
            @JsonProperty("message") String message)
    {
        this.status = requireNonNull(status, "status is null");
        this.message = message == null ? "" : message;
    }

    public static ApiError success()
    {
        return SUCCESS;
    }

    @JsonProperty
    public StatusCode getStatus()
    {
        return status;
    }

    @JsonProperty
    public String getMessage()
    {
        return message;
    }

    public boolean isSuccess()
    {
        return status == StatusCode.SUCCESS;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ApiError that = (ApiError) o;
        return status == that.status && message.equals(that.message);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(status, message);
    }

    @Override
    public String toString()
    {
        return status + ": " + message;
    }
}
