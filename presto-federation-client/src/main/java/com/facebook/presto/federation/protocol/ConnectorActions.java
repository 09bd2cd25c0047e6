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
package com.facebook.presto.federation.protocol;

/**
 * Flight action types served by the connector. ReadSplits is served as a DoGet stream instead.
 */
public final class ConnectorActions
{
    public static final String DESCRIBE_TABLE = "DescribeTable";
    public static final String LIST_SPLITS = "ListSplits";

    private ConnectorActions()
    {
    }
}
