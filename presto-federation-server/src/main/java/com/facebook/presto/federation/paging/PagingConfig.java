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

import com.facebook.airlift.configuration.Config;
import com.facebook.airlift.configuration.ConfigDescription;
import io.airlift.units.DataSize;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import static com.google.common.base.Preconditions.checkArgument;
import static io.airlift.units.DataSize.Unit.MEGABYTE;

public class PagingConfig
{
    // maximum gRPC message size accepted by the Flight transport
    public static final DataSize MAX_BYTES_PER_PAGE = new DataSize(50, MEGABYTE);

    private DataSize bytesPerPage = new DataSize(4, MEGABYTE);
    private long rowsPerPage;
    private int prefetchQueueCapacity = 2;

    @NotNull
    public DataSize getBytesPerPage()
    {
        return bytesPerPage;
    }

    @Config("paging.bytes-per-page")
    @ConfigDescription("Maximum estimated size of a page, 0B disables the threshold")
    public PagingConfig setBytesPerPage(DataSize bytesPerPage)
    {
        this.bytesPerPage = bytesPerPage;
        return this;
    }

    @Min(0)
    public long getRowsPerPage()
    {
        return rowsPerPage;
    }

    @Config("paging.rows-per-page")
    @ConfigDescription("Maximum number of rows in a page, 0 disables the threshold")
    public PagingConfig setRowsPerPage(long rowsPerPage)
    {
        this.rowsPerPage = rowsPerPage;
        return this;
    }

    @Min(1)
    public int getPrefetchQueueCapacity()
    {
        return prefetchQueueCapacity;
    }

    @Config("paging.prefetch-queue-capacity")
    @ConfigDescription("Number of sealed pages a split reader may prepare ahead of the network sender")
    public PagingConfig setPrefetchQueueCapacity(int prefetchQueueCapacity)
    {
        this.prefetchQueueCapacity = prefetchQueueCapacity;
        return this;
    }

    public long getBytesPerPageInBytes()
    {
        return bytesPerPage.toBytes();
    }

    /**
     * Checks the combination of thresholds. Invalid paging settings are a startup failure.
     */
    public PagingConfig validate()
    {
        long bytes = getBytesPerPageInBytes();
        checkArgument(bytes > 0 || rowsPerPage > 0, "at least one of paging.bytes-per-page and paging.rows-per-page must be set");
        checkArgument(bytes <= MAX_BYTES_PER_PAGE.toBytes(), "paging.bytes-per-page %s exceeds the limit of %s", bytesPerPage, MAX_BYTES_PER_PAGE);
        checkArgument(rowsPerPage >= 0, "paging.rows-per-page must not be negative");
        checkArgument(prefetchQueueCapacity >= 1, "paging.prefetch-queue-capacity must be at least 1");
        return this;
    }
}
