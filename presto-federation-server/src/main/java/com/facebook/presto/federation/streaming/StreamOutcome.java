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
package com.facebook.presto.federation.streaming;

import com.facebook.presto.federation.protocol.ApiError;
import com.facebook.presto.federation.protocol.Stats;

import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public final class StreamOutcome
{
    public enum State
    {
        COMPLETED,
        FAILED,
        CANCELED,
    }

    private final State state;
    private final Stats stats;
    private final Optional<ApiError> error;

    private StreamOutcome(State state, Stats stats, Optional<ApiError> error)
    {
        this.state = requireNonNull(state, "state is null");
        this.stats = requireNonNull(stats, "stats is null");
        this.error = requireNonNull(error, "error is null");
    }

    public static StreamOutcome completed(Stats stats)
    {
        return new StreamOutcome(State.COMPLETED, stats, Optional.empty());
    }

    public static StreamOutcome failed(Stats stats, ApiError error)
    {
        return new StreamOutcome(State.FAILED, stats, Optional.of(error));
    }

    public static StreamOutcome canceled(Stats stats)
    {
        return new StreamOutcome(State.CANCELED, stats, Optional.empty());
    }

    public State getState()
    {
        return state;
    }

    /**
     * Rows and bytes of the pages actually sent.
     */
    public Stats getStats()
    {
        return stats;
    }

    /**
     * The error envelope sent to the caller, present for failed streams.
     */
    public Optional<ApiError> getError()
    {
        return error;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("state", state)
                .add("stats", stats)
                .add("error", error.orElse(null))
                .omitNullValues()
                .toString();
    }
}
