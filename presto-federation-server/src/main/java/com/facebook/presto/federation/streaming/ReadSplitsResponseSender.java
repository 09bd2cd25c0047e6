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

import com.facebook.presto.federation.protocol.ReadSplitsResponse;

/**
 * Outbound side of a ReadSplits call.
 */
public interface ReadSplitsResponseSender
{
    /**
     * Blocks until the transport can take the response, so a slow client holds back the split reader.
     */
    void send(ReadSplitsResponse response);

    /**
     * True once the caller has gone away. Checked between pages.
     */
    boolean isCancelled();
}
