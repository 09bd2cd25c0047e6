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

import static java.lang.String.format;

public class MySqlDialect
        extends BaseSqlDialect
{
    public MySqlDialect()
    {
        super("mysql", "`");
    }

    @Override
    public String getJdbcUrl(DataSourceInstance instance)
    {
        return super.getJdbcUrl(instance) + (instance.isUseTls() ? "?sslMode=REQUIRED" : "?sslMode=DISABLED");
    }

    @Override
    public Optional<PrimitiveTypeId> getVendorType(String typeName)
    {
        switch (typeName.toLowerCase(Locale.ENGLISH)) {
            case "json":
                return Optional.of(PrimitiveTypeId.JSON);
            case "tinyint unsigned":
                return Optional.of(PrimitiveTypeId.UINT8);
            case "smallint unsigned":
                return Optional.of(PrimitiveTypeId.UINT16);
            case "mediumint unsigned":
            case "int unsigned":
                return Optional.of(PrimitiveTypeId.UINT32);
            case "bigint unsigned":
                return Optional.of(PrimitiveTypeId.UINT64);
            default:
                return Optional.empty();
        }
    }

    @Override
    public Optional<String> renderRegexp(String value, String pattern)
    {
        return Optional.of(format("(%s REGEXP %s)", value, pattern));
    }

    @Override
    public void configureForStreaming(Connection connection, Statement statement)
            throws SQLException
    {
        // row by row streaming in Connector/J
        statement.setFetchSize(Integer.MIN_VALUE);
    }
}
