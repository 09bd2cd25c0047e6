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

import com.facebook.presto.federation.protocol.Credentials;
import com.facebook.presto.federation.protocol.DataSourceInstance;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.Properties;

/**
 * Opens a fresh connection per call through {@link DriverManager}. Instance options are passed as driver properties.
 */
public class DriverConnectionFactory
        implements ConnectionFactory
{
    @Override
    public Connection openConnection(SqlDialect dialect, DataSourceInstance instance)
            throws SQLException
    {
        Properties properties = new Properties();
        for (Map.Entry<String, String> option : instance.getOptions().entrySet()) {
            if (!option.getKey().equals(JdbcDataSource.SCHEMA_OPTION)) {
                properties.setProperty(option.getKey(), option.getValue());
            }
        }
        Credentials credentials = instance.getCredentials();
        if (credentials != null) {
            if (credentials.getUsername() != null) {
                properties.setProperty("user", credentials.getUsername());
            }
            if (credentials.getPassword() != null) {
                properties.setProperty("password", credentials.getPassword());
            }
        }
        return DriverManager.getConnection(dialect.getJdbcUrl(instance), properties);
    }
}
