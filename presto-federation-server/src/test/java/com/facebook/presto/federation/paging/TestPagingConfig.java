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
package com.facebook.presto.federation.paging;

import com.google.common.collect.ImmutableMap;
import io.airlift.units.DataSize;
import org.testng.annotations.Test;

import java.util.Map;

import static com.facebook.airlift.configuration.testing.ConfigAssertions.assertFullMapping;
import static com.facebook.airlift.configuration.testing.ConfigAssertions.assertRecordedDefaults;
import static com.facebook.airlift.configuration.testing.ConfigAssertions.recordDefaults;
import static io.airlift.units.DataSize.Unit.BYTE;
import static io.airlift.units.DataSize.Unit.MEGABYTE;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertThrows;

public class TestPagingConfig
{
    @Test
    public void testDefaults()
    {
        assertRecordedDefaults(recordDefaults(PagingConfig.class)
                .setBytesPerPage(new DataSize(4, MEGABYTE))
                .setRowsPerPage(0)
                .setPrefetchQueueCapacity(2));
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = new ImmutableMap.Builder<String, String>()
                .put("paging.bytes-per-page", "1MB")
                .put("paging.rows-per-page", "1000")
                .put("paging.prefetch-queue-capacity", "8")
                .build();

        PagingConfig expected = new PagingConfig()
                .setBytesPerPage(new DataSize(1, MEGABYTE))
                .setRowsPerPage(1000)
                .setPrefetchQueueCapacity(8);

        assertFullMapping(properties, expected);
    }

    @Test
    public void testValidate()
    {
        new PagingConfig().validate();
        new PagingConfig().setBytesPerPage(new DataSize(0, BYTE)).setRowsPerPage(10).validate();
        assertEquals(new PagingConfig().getBytesPerPageInBytes(), 4 * 1024 * 1024);

        assertThrows(IllegalArgumentException.class, () -> new PagingConfig().setBytesPerPage(new DataSize(0, BYTE)).validate());
        assertThrows(IllegalArgumentException.class, () -> new PagingConfig().setBytesPerPage(new DataSize(51, MEGABYTE)).validate());
        assertThrows(IllegalArgumentException.class, () -> new PagingConfig().setPrefetchQueueCapacity(0).validate());
    }
}
