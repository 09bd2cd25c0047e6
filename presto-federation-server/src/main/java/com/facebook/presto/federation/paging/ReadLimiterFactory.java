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

import com.facebook.airlift.log.Logger;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

public class ReadLimiterFactory
{
    private static final Logger log = Logger.get(ReadLimiterFactory.class);

    private final Optional<Long> rowsLimit;

    public ReadLimiterFactory(Optional<Long> rowsLimit)
    {
        this.rowsLimit = requireNonNull(rowsLimit, "rowsLimit is null");
        rowsLimit.ifPresent(rows -> log.warn("Read limiter is enabled, requests are capped at %s rows", rows));
    }

    public ReadLimiter makeReadLimiter(String queryId)
    {
        if (!rowsLimit.isPresent()) {
            return NoOpReadLimiter.INSTANCE;
        }
        log.debug("Query %s is limited to %s rows", queryId, rowsLimit.get());
        return new RowCountReadLimiter(rowsLimit.get());
    }
}
