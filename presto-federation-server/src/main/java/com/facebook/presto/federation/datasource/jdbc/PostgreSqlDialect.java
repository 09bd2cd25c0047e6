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

import com.facebook.presto.federation.protocol.DataSourceInstance;
import com.facebook.presto.federation.protocol.PrimitiveTypeId;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Optional;

/**
 * PostgreSQL and Greenplum.
 */
public class PostgreSqlDialect
        extends BaseSqlDialect
{
    public PostgreSqlDialect()
    {
        super("postgresql", "\"");
    }

    @Override
    public String getJdbcUrl(DataSourceInstance instance)
    {
        String url = super.getJdbcUrl(instance);
        return instance.isUseTls() ? url + "?sslmode=require" : url;
    }

    @Override
    public Optional<PrimitiveTypeId> getVendorType(String typeName)
    {
        switch (typeName.toLowerCase(Locale.ENGLISH)) {
            case "json":
            case "jsonb":
                return Optional.of(PrimitiveTypeId.JSON);
            case "text":
            case "uuid":
                return Optional.of(PrimitiveTypeId.UTF8);
            case "bytea":
                return Optional.of(PrimitiveTypeId.STRING);
            default:
                return Optional.empty();
        }
    }

    @Override
    public void configureForStreaming(Connection connection, Statement statement)
            throws SQLException
    {
        // the driver only uses a cursor outside of autocommit mode
        connection.setAutoCommit(false);
        super.configureForStreaming(connection, statement);
    }
}
