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

import com.facebook.presto.federation.protocol.Stats;

import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Item handed from a split reader to the sender: a sealed page, or the terminal signal of the split read.
 */
public final class ReadResult
{
    private static final ReadResult SUCCESS = new ReadResult(null, null, null, true);

    private final byte[] page;
    private final Stats stats;
    private final Throwable error;
    private final boolean terminal;

    private ReadResult(byte[] page, Stats stats, Throwable error, boolean terminal)
    {
        this.page = page;
        this.stats = stats;
        this.error = error;
        this.terminal = terminal;
    }

    public static ReadResult page(byte[] page, Stats stats)
    {
        return new ReadResult(requireNonNull(page, "page is null"), requireNonNull(stats, "stats is null"), null, false);
    }

    public static ReadResult success()
    {
        return SUCCESS;
    }

    public static ReadResult failure(Throwable error)
    {
        return new ReadResult(null, null, requireNonNull(error, "error is null"), true);
    }

    public boolean isTerminal()
    {
        return terminal;
    }

    public byte[] getPage()
    {
        checkState(!terminal, "terminal result has no page");
        return page;
    }

    public Stats getStats()
    {
        checkState(!terminal, "terminal result has no stats");
        return stats;
    }

    public Optional<Throwable> getError()
    {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("terminal", terminal)
                .add("stats", stats)
                .add("error", error)
                .omitNullValues()
                .toString();
    }
}
