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

import com.facebook.presto.federation.protocol.DataSourceInstance;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

public interface ObjectStorageClient
{
    /**
     * Opens the object {@code key} of the bucket named by the instance's database.
     *
     * @throws FileNotFoundException when the object does not exist
     */
    InputStream openObject(DataSourceInstance instance, String key)
            throws IOException;
}
