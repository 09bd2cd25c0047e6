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

import com.facebook.presto.federation.protocol.DataSourceKind;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.testng.annotations.Test;

import java.util.Map;
import java.util.Optional;

import static com.facebook.airlift.configuration.testing.ConfigAssertions.assertFullMapping;
import static com.facebook.airlift.configuration.testing.ConfigAssertions.assertRecordedDefaults;
import static com.facebook.airlift.configuration.testing.ConfigAssertions.recordDefaults;
import static org.testng.Assert.assertEquals;

public class TestJdbcDataSourceConfig
{
    @Test
    public void testDefaults()
    {
        assertRecordedDefaults(recordDefaults(JdbcDataSourceConfig.class)
                .setPushdownEnabledKinds("postgresql,greenplum,mysql,clickhouse,ms_sql_server")
                .setSplittingEnabledKinds("")
                .setRowsPerSplit(null));
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = new ImmutableMap.Builder<String, String>()
                .put("pushdown.enabled-kinds", "postgresql")
                .put("splitting.enabled-kinds", "postgresql, mysql")
                .put("splitting.rows-per-split", "100000")
                .build();

        JdbcDataSourceConfig expected = new JdbcDataSourceConfig()
                .setPushdownEnabledKinds("POSTGRESQL")
                .setSplittingEnabledKinds("MYSQL,POSTGRESQL")
                .setRowsPerSplit(100000L);

        assertFullMapping(properties, expected);
    }

    @Test
    public void testParsedKinds()
    {
        JdbcDataSourceConfig config = new JdbcDataSourceConfig()
                .setSplittingEnabledKinds(" mysql,,Greenplum ");
        assertEquals(config.getSplittingEnabledKinds(), ImmutableSet.of(DataSourceKind.MYSQL, DataSourceKind.GREENPLUM));
        assertEquals(config.getRowsPerSplit(), Optional.empty());
    }
}
