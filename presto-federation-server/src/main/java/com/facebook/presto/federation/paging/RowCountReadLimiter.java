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

import com.facebook.presto.federation.FederationException;

import static com.facebook.presto.federation.FederationErrorCode.READ_LIMIT_EXCEEDED;
import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;

/**
 * Shared by the splits of one request. Splits are read one at a time, so no synchronization.
 */
public class RowCountReadLimiter
        implements ReadLimiter
{
    private final long rowsLimit;
    private long rowsRead;

    public RowCountReadLimiter(long rowsLimit)
    {
        checkArgument(rowsLimit >= 0, "rowsLimit is negative");
        this.rowsLimit = rowsLimit;
    }

    @Override
    public void addRow()
    {
        if (rowsRead >= rowsLimit) {
            throw new FederationException(READ_LIMIT_EXCEEDED, format("Read limit exceeded: %s rows", rowsLimit));
        }
        rowsRead++;
    }

    public long getRowsRead()
    {
        return rowsRead;
    }
}
