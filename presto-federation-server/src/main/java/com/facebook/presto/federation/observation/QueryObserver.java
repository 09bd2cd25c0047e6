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
package com.facebook.presto.federation.observation;

import com.facebook.presto.federation.protocol.ApiError;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.Split;
import com.facebook.presto.federation.protocol.Stats;

/**
 * Receives the lifecycle events of ReadSplits requests.
 * Implementations must not throw; they are called on the request thread.
 */
public interface QueryObserver
{
    void queryStarted(String queryId, ReadSplitsRequest request);

    void splitFinished(String queryId, Split split, Stats stats);

    void queryFinished(String queryId, Stats stats);

    void queryFailed(String queryId, ApiError error);

    void queryCanceled(String queryId);
}
