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
import com.facebook.presto.federation.protocol.Stats;
import com.google.common.base.Utf8;

import java.util.List;

import static com.facebook.presto.federation.FederationErrorCode.PAGE_SIZE_EXCEEDED;
import static java.lang.String.format;

/**
 * Decides page boundaries from the byte and row thresholds and accumulates page and split statistics.
 * <p>
 * Row sizes are estimated from acceptor values. Fixed width columns are sized once; variable width columns on every row.
 * Not thread safe: owned by the producer task.
 */
public class TrafficTracker
{
    private static final int DECIMAL_SIZE = 16;

    private final long bytesPerPage;
    private final long rowsPerPage;

    private boolean sized;
    private long fixedRowSize;
    private int[] variableColumns;

    private long bytesCurrent;
    private long rowsCurrent;
    private Stats total = Stats.empty();

    public TrafficTracker(PagingConfig config)
    {
        this.bytesPerPage = config.getBytesPerPageInBytes();
        this.rowsPerPage = config.getRowsPerPage();
    }

    /**
     * Accounts the row in the current page.
     *
     * @return false if the row does not fit and the current page must be flushed first
     * @throws FederationException with {@code PAGE_SIZE_EXCEEDED} if the row cannot fit even an empty page
     */
    public boolean tryAddRow(List<Acceptor> acceptors)
    {
        long rowSize = estimateRowSize(acceptors);
        if (bytesPerPage > 0 && rowSize > bytesPerPage) {
            throw new FederationException(PAGE_SIZE_EXCEEDED, format("Row size %s exceeds the page size limit %s", rowSize, bytesPerPage));
        }

        if (rowsPerPage > 0 && rowsCurrent + 1 > rowsPerPage) {
            return false;
        }
        if (bytesPerPage > 0 && bytesCurrent + rowSize > bytesPerPage) {
            return false;
        }

        rowsCurrent++;
        bytesCurrent += rowSize;
        return true;
    }

    /**
     * Closes the current page and returns its statistics.
     */
    public Stats flush()
    {
        Stats page = new Stats(rowsCurrent, bytesCurrent);
        total = total.add(page);
        rowsCurrent = 0;
        bytesCurrent = 0;
        return page;
    }

    public Stats getCurrentPageStats()
    {
        return new Stats(rowsCurrent, bytesCurrent);
    }

    public Stats getTotalStats()
    {
        return total;
    }

    private long estimateRowSize(List<Acceptor> acceptors)
    {
        if (!sized) {
            int variableCount = 0;
            for (Acceptor acceptor : acceptors) {
                if (acceptor.getKind().isFixedWidth()) {
                    fixedRowSize += acceptor.getKind().getFixedSize();
                }
                else {
                    variableCount++;
                }
            }
            variableColumns = new int[variableCount];
            int next = 0;
            for (int i = 0; i < acceptors.size(); i++) {
                if (!acceptors.get(i).getKind().isFixedWidth()) {
                    variableColumns[next++] = i;
                }
            }
            sized = true;
        }

        long size = fixedRowSize;
        for (int column : variableColumns) {
            size += variableSize(acceptors.get(column));
        }
        return size;
    }

    private static long variableSize(Acceptor acceptor)
    {
        Object value = acceptor.get();
        if (value == null) {
            return 0;
        }
        switch (acceptor.getKind()) {
            case STRING:
                return Utf8.encodedLength((String) value);
            case BYTES:
                return ((byte[]) value).length;
            case DECIMAL:
                return DECIMAL_SIZE;
            default:
                throw new IllegalStateException("Unexpected variable width kind: " + acceptor.getKind());
        }
    }
}
