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
import java.util.Optional;

/**
 * Backend specific parts of SQL generation and connection setup.
 */
public interface SqlDialect
{
    String getJdbcUrl(DataSourceInstance instance);

    String quoteIdentifier(String identifier);

    /**
     * Wire type for a backend type the standard JDBC type codes do not describe, such as {@code jsonb}.
     */
    Optional<PrimitiveTypeId> getVendorType(String typeName);

    /**
     * @return the rendered condition, or empty when the backend has no regular expression operator
     */
    Optional<String> renderRegexp(String value, String pattern);

    /**
     * Condition selecting the rows of shard {@code shardIndex} out of {@code shardCount}, keyed on an integer column.
     */
    String renderShardCondition(String quotedKeyColumn, long shardCount, long shardIndex);

    /**
     * Prepares the connection and statement for streaming a large result set.
     */
    void configureForStreaming(Connection connection, Statement statement)
            throws SQLException;
}
