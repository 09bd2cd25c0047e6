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

import com.facebook.presto.federation.FederationException;
import com.facebook.presto.federation.datasource.DataSource;
import com.facebook.presto.federation.datasource.DataSourceFactory;
import com.facebook.presto.federation.protocol.DataSourceKind;
import com.google.inject.Inject;

import static com.facebook.presto.federation.FederationErrorCode.DATA_SOURCE_NOT_SUPPORTED;
import static java.util.Objects.requireNonNull;

public class CsvObjectStorageDataSourceFactory
        implements DataSourceFactory
{
    private final ObjectStorageClient client;

    @Inject
    public CsvObjectStorageDataSourceFactory(ObjectStorageClient client)
    {
        this.client = requireNonNull(client, "client is null");
    }

    @Override
    public DataSource create(DataSourceKind kind)
    {
        if (kind != DataSourceKind.S3) {
            throw new FederationException(DATA_SOURCE_NOT_SUPPORTED, "Not an object storage data source kind: " + kind);
        }
        return new CsvObjectStorageDataSource(client);
    }
}
