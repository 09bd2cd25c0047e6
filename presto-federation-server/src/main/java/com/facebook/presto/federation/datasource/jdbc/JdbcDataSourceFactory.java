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

import com.facebook.presto.federation.FederationException;
import com.facebook.presto.federation.datasource.DataSource;
import com.facebook.presto.federation.datasource.DataSourceFactory;
import com.facebook.presto.federation.protocol.DataSourceKind;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;

import java.util.Map;
import java.util.Set;

import static com.facebook.presto.federation.FederationErrorCode.DATA_SOURCE_NOT_SUPPORTED;
import static java.util.Objects.requireNonNull;

public class JdbcDataSourceFactory
        implements DataSourceFactory
{
    private static final Map<DataSourceKind, SqlDialect> DIALECTS = ImmutableMap.<DataSourceKind, SqlDialect>builder()
            .put(DataSourceKind.POSTGRESQL, new PostgreSqlDialect())
            .put(DataSourceKind.GREENPLUM, new PostgreSqlDialect())
            .put(DataSourceKind.MYSQL, new MySqlDialect())
            .put(DataSourceKind.CLICKHOUSE, new ClickHouseDialect())
            .put(DataSourceKind.MS_SQL_SERVER, new SqlServerDialect())
            .build();

    private final ConnectionFactory connectionFactory;
    private final JdbcDataSourceConfig config;

    @Inject
    public JdbcDataSourceFactory(ConnectionFactory connectionFactory, JdbcDataSourceConfig config)
    {
        this.connectionFactory = requireNonNull(connectionFactory, "connectionFactory is null");
        this.config = requireNonNull(config, "config is null");
    }

    public static Set<DataSourceKind> getSupportedKinds()
    {
        return DIALECTS.keySet();
    }

    @Override
    public DataSource create(DataSourceKind kind)
    {
        SqlDialect dialect = DIALECTS.get(kind);
        if (dialect == null) {
            throw new FederationException(DATA_SOURCE_NOT_SUPPORTED, "Not a relational data source kind: " + kind);
        }
        return new JdbcDataSource(kind, dialect, connectionFactory, config);
    }
}
