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

import com.facebook.presto.federation.protocol.PrimitiveTypeId;

import java.util.Locale;
import java.util.Optional;

import static java.lang.String.format;

public class ClickHouseDialect
        extends BaseSqlDialect
{
    public ClickHouseDialect()
    {
        super("clickhouse", "`");
    }

    @Override
    public Optional<PrimitiveTypeId> getVendorType(String typeName)
    {
        String type = typeName.toLowerCase(Locale.ENGLISH);
        if (type.startsWith("nullable(")) {
            type = type.substring("nullable(".length(), type.length() - 1);
        }
        switch (type) {
            case "uint8":
                return Optional.of(PrimitiveTypeId.UINT8);
            case "uint16":
                return Optional.of(PrimitiveTypeId.UINT16);
            case "uint32":
                return Optional.of(PrimitiveTypeId.UINT32);
            case "uint64":
                return Optional.of(PrimitiveTypeId.UINT64);
            default:
                return Optional.empty();
        }
    }

    @Override
    public String renderShardCondition(String quotedKeyColumn, long shardCount, long shardIndex)
    {
        return format("modulo(abs(%s), %s) = %s", quotedKeyColumn, shardCount, shardIndex);
    }
}
