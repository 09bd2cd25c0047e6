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
import com.facebook.presto.federation.protocol.PrimitiveTypeId;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

import static com.google.common.base.Strings.nullToEmpty;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

public abstract class BaseSqlDialect
        implements SqlDialect
{
    private static final int FETCH_SIZE = 1000;

    private final String urlScheme;
    private final String identifierQuote;

    protected BaseSqlDialect(String urlScheme, String identifierQuote)
    {
        this.urlScheme = requireNonNull(urlScheme, "urlScheme is null");
        this.identifierQuote = requireNonNull(identifierQuote, "identifierQuote is null");
    }

    @Override
    public String getJdbcUrl(DataSourceInstance instance)
    {
        Endpoint endpoint = requireNonNull(instance.getEndpoint(), "endpoint is null");
        return format("jdbc:%s://%s:%s/%s", urlScheme, endpoint.getHost(), endpoint.getPort(), nullToEmpty(instance.getDatabase()));
    }

    @Override
    public String quoteIdentifier(String identifier)
    {
        return identifierQuote + identifier.replace(identifierQuote, identifierQuote + identifierQuote) + identifierQuote;
    }

    @Override
    public Optional<PrimitiveTypeId> getVendorType(String typeName)
    {
        return Optional.empty();
    }

    @Override
    public Optional<String> renderRegexp(String value, String pattern)
    {
        return Optional.empty();
    }

    @Override
    public String renderShardCondition(String quotedKeyColumn, long shardCount, long shardIndex)
    {
        return format("MOD(ABS(%s), %s) = %s", quotedKeyColumn, shardCount, shardIndex);
    }

    @Override
    public void configureForStreaming(Connection connection, Statement statement)
            throws SQLException
    {
        statement.setFetchSize(FETCH_SIZE);
    }
}
