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
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Logical read intent: which columns of which table (or object) to fetch, and how to filter them.
 */
public class Select
{
    private final DataSourceInstance dataSourceInstance;
    private final String from;
    private final List<Column> what;
    private final Optional<Predicate> where;

    @JsonCreator
    public Select(
            @JsonProperty("dataSourceInstance") DataSourceInstance dataSourceInstance,
            @JsonProperty("from") String from,
            @JsonProperty("what") List<Column> what,
            @JsonProperty("where") Optional<Predicate> where)
    {
        this.dataSourceInstance = dataSourceInstance;
        this.from = from;
        this.what = what == null ? ImmutableList.of() : ImmutableList.copyOf(what);
        this.where = where == null ? Optional.empty() : where;
    }

    public Select(DataSourceInstance dataSourceInstance, String from, List<Column> what)
    {
        this(dataSourceInstance, from, what, Optional.empty());
    }

    @JsonProperty
    public DataSourceInstance getDataSourceInstance()
    {
        return dataSourceInstance;
    }

    @JsonProperty
    public String getFrom()
    {
        return from;
    }

    @JsonProperty
    public List<Column> getWhat()
    {
        return what;
    }

    @JsonProperty
    public Optional<Predicate> getWhere()
    {
        return where;
    }

    public Select withWhere(Predicate predicate)
    {
        requireNonNull(predicate, "predicate is null");
        return new Select(dataSourceInstance, from, what, Optional.of(predicate));
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("from", from)
                .add("what", what)
                .add("where", where.orElse(null))
                .omitNullValues()
                .toString();
    }
}
