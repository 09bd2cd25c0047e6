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
package com.facebook.presto.federation.datasource.jdbc;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Part of a table a JDBC split covers: the whole table, one shard of a key modulo, or a half open key range.
 */
public class JdbcSplitDescription
{
    private final Optional<String> keyColumn;
    private final Optional<Long> shardCount;
    private final Optional<Long> shardIndex;
    private final Optional<Long> lowerBound;
    private final Optional<Long> upperBound;

    @JsonCreator
    public JdbcSplitDescription(
            @JsonProperty("keyColumn") Optional<String> keyColumn,
            @JsonProperty("shardCount") Optional<Long> shardCount,
            @JsonProperty("shardIndex") Optional<Long> shardIndex,
            @JsonProperty("lowerBound") Optional<Long> lowerBound,
            @JsonProperty("upperBound") Optional<Long> upperBound)
    {
        this.keyColumn = requireNonNull(keyColumn, "keyColumn is null");
        this.shardCount = requireNonNull(shardCount, "shardCount is null");
        this.shardIndex = requireNonNull(shardIndex, "shardIndex is null");
        this.lowerBound = requireNonNull(lowerBound, "lowerBound is null");
        this.upperBound = requireNonNull(upperBound, "upperBound is null");
    }

    public static JdbcSplitDescription wholeTable()
    {
        return new JdbcSplitDescription(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static JdbcSplitDescription shard(String keyColumn, long shardCount, long shardIndex)
    {
        return new JdbcSplitDescription(Optional.of(keyColumn), Optional.of(shardCount), Optional.of(shardIndex), Optional.empty(), Optional.empty());
    }

    public static JdbcSplitDescription range(String keyColumn, Optional<Long> lowerBound, Optional<Long> upperBound)
    {
        return new JdbcSplitDescription(Optional.of(keyColumn), Optional.empty(), Optional.empty(), lowerBound, upperBound);
    }

    @JsonProperty
    public Optional<String> getKeyColumn()
    {
        return keyColumn;
    }

    @JsonProperty
    public Optional<Long> getShardCount()
    {
        return shardCount;
    }

    @JsonProperty
    public Optional<Long> getShardIndex()
    {
        return shardIndex;
    }

    @JsonProperty
    public Optional<Long> getLowerBound()
    {
        return lowerBound;
    }

    @JsonProperty
    public Optional<Long> getUpperBound()
    {
        return upperBound;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("keyColumn", keyColumn.orElse(null))
                .add("shardCount", shardCount.orElse(null))
                .add("shardIndex", shardIndex.orElse(null))
                .add("lowerBound", lowerBound.orElse(null))
                .add("upperBound", upperBound.orElse(null))
                .omitNullValues()
                .toString();
    }
}
