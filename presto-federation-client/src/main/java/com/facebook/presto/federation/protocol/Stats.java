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

public class Stats
{
    private static final Stats EMPTY = new Stats(0, 0);

    private final long rows;
    private final long bytes;

    @JsonCreator
    public Stats(
            @JsonProperty("rows") long rows,
            @JsonProperty("bytes") long bytes)
    {
        this.rows = rows;
        this.bytes = bytes;
    }

    public static Stats empty()
    {
        return EMPTY;
    }

    @JsonProperty
    public long getRows()
    {
        return rows;
    }

    @JsonProperty
    public long getBytes()
    {
        return bytes;
    }

    public Stats add(Stats other)
    {
        return new Stats(rows + other.rows, bytes + other.bytes);
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
        Stats that = (Stats) o;
        return rows == that.rows && bytes == that.bytes;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(rows, bytes);
    }

    @Override
    public String toString()
    {
        return "rows=" + rows + ", bytes=" + bytes;
    }
}
