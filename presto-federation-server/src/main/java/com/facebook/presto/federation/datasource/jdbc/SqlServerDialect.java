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
import com.facebook.presto.federation.protocol.Endpoint;

import static com.google.common.base.Strings.nullToEmpty;
import static java.lang.String.format;

public class SqlServerDialect
        extends BaseSqlDialect
{
    public SqlServerDialect()
    {
        super("sqlserver", "\"");
    }

    @Override
    public String getJdbcUrl(DataSourceInstance instance)
    {
        Endpoint endpoint = instance.getEndpoint();
        return format("jdbc:sqlserver://%s:%s;databaseName=%s;encrypt=%s",
                endpoint.getHost(),
                endpoint.getPort(),
                nullToEmpty(instance.getDatabase()),
                instance.isUseTls());
    }

    @Override
    public String quoteIdentifier(String identifier)
    {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    @Override
    public String renderShardCondition(String quotedKeyColumn, long shardCount, long shardIndex)
    {
        return format("ABS(%s) %% %s = %s", quotedKeyColumn, shardCount, shardIndex);
    }
}
