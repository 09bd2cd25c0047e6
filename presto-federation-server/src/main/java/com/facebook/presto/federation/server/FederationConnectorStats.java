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
package com.facebook.presto.federation.server;

import com.facebook.airlift.stats.CounterStat;
import com.facebook.presto.federation.protocol.Stats;
import org.weakref.jmx.Managed;
import org.weakref.jmx.Nested;

public final class FederationConnectorStats
{
    private final CounterStat rows = new CounterStat();
    private final CounterStat bytes = new CounterStat();
    private final CounterStat pages = new CounterStat();
    private final CounterStat failedSplits = new CounterStat();
    private final CounterStat canceledSplits = new CounterStat();

    public void pageSent(Stats page)
    {
        pages.update(1);
        rows.update(page.getRows());
        bytes.update(page.getBytes());
    }

    public void splitFailed()
    {
        failedSplits.update(1);
    }

    public void splitCanceled()
    {
        canceledSplits.update(1);
    }

    @Managed
    @Nested
    public CounterStat getRows()
    {
        return rows;
    }

    @Managed
    @Nested
    public CounterStat getBytes()
    {
        return bytes;
    }

    @Managed
    @Nested
    public CounterStat getPages()
    {
        return pages;
    }

    @Managed
    @Nested
    public CounterStat getFailedSplits()
    {
        return failedSplits;
    }

    @Managed
    @Nested
    public CounterStat getCanceledSplits()
    {
        return canceledSplits;
    }
}
