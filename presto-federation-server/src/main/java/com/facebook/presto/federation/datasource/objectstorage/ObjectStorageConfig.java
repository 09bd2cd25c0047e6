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
package com.facebook.presto.federation.datasource.objectstorage;

import com.facebook.airlift.configuration.Config;
import com.facebook.airlift.configuration.ConfigDescription;

import java.net.URI;
import java.util.Optional;

public class ObjectStorageConfig
{
    private URI endpoint;

    public Optional<URI> getEndpoint()
    {
        return Optional.ofNullable(endpoint);
    }

    @Config("object-storage.endpoint")
    @ConfigDescription("Base URI buckets are resolved against; defaults to the endpoint of the data source instance")
    public ObjectStorageConfig setEndpoint(URI endpoint)
    {
        this.endpoint = endpoint;
        return this;
    }
}
