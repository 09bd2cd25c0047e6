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

import com.facebook.airlift.configuration.Config;
import com.facebook.airlift.configuration.ConfigDescription;
import com.facebook.presto.federation.protocol.DataSourceKind;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.google.common.collect.ImmutableSet.toImmutableSet;

public class JdbcDataSourceConfig
{
    private static final Splitter SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private Set<DataSourceKind> pushdownEnabledKinds = ImmutableSet.of(
            DataSourceKind.POSTGRESQL,
            DataSourceKind.GREENPLUM,
            DataSourceKind.MYSQL,
            DataSourceKind.CLICKHOUSE,
            DataSourceKind.MS_SQL_SERVER);
    private Set<DataSourceKind> splittingEnabledKinds = ImmutableSet.of();
    private Long rowsPerSplit;

    @NotNull
    public Set<DataSourceKind> getPushdownEnabledKinds()
    {
        return pushdownEnabledKinds;
    }

    @Config("pushdown.enabled-kinds")
    @ConfigDescription("Comma separated data source kinds whose predicates are pushed down to the backend")
    public JdbcDataSourceConfig setPushdownEnabledKinds(String kinds)
    {
        this.pushdownEnabledKinds = parseKinds(kinds);
        return this;
    }

    @NotNull
    public Set<DataSourceKind> getSplittingEnabledKinds()
    {
        return splittingEnabledKinds;
    }

    @Config("splitting.enabled-kinds")
    @ConfigDescription("Comma separated data source kinds that honor maxSplitCount of ListSplits")
    public JdbcDataSourceConfig setSplittingEnabledKinds(String kinds)
    {
        this.splittingEnabledKinds = parseKinds(kinds);
        return this;
    }

    public Optional<@Min(1) Long> getRowsPerSplit()
    {
        return Optional.ofNullable(rowsPerSplit);
    }

    @Config("splitting.rows-per-split")
    @ConfigDescription("Split tables with an integer primary key into key ranges covering this many key values")
    public JdbcDataSourceConfig setRowsPerSplit(Long rowsPerSplit)
    {
        this.rowsPerSplit = rowsPerSplit;
        return this;
    }

    private static Set<DataSourceKind> parseKinds(String kinds)
    {
        if (kinds == null) {
            return ImmutableSet.of();
        }
        return SPLITTER.splitToList(kinds).stream()
                .map(kind -> DataSourceKind.valueOf(kind.toUpperCase(Locale.ENGLISH)))
                .collect(toImmutableSet());
    }
}
