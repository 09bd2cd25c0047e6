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
import com.facebook.presto.federation.protocol.Endpoint;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.escape.Escaper;
import com.google.common.io.Resources;
import com.google.inject.Inject;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.util.Optional;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.net.UrlEscapers.urlPathSegmentEscaper;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fetches objects by path style URL, {@code <endpoint>/<bucket>/<key>}.
 */
public class UrlObjectStorageClient
        implements ObjectStorageClient
{
    private static final Escaper SEGMENT_ESCAPER = urlPathSegmentEscaper();

    private final Optional<URI> endpoint;

    @Inject
    public UrlObjectStorageClient(ObjectStorageConfig config)
    {
        this.endpoint = requireNonNull(config, "config is null").getEndpoint();
    }

    @Override
    public InputStream openObject(DataSourceInstance instance, String key)
            throws IOException
    {
        return Resources.asByteSource(getObjectUrl(instance, key)).openBufferedStream();
    }

    URL getObjectUrl(DataSourceInstance instance, String key)
            throws IOException
    {
        String base = endpoint.map(URI::toString).orElseGet(() -> instanceEndpoint(instance));
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String path = Joiner.on('/').join(Splitter.on('/').splitToList(key).stream()
                .map(SEGMENT_ESCAPER::escape)
                .collect(toImmutableList()));
        return new URL(base + "/" + SEGMENT_ESCAPER.escape(instance.getDatabase()) + "/" + path);
    }

    private static String instanceEndpoint(DataSourceInstance instance)
    {
        Endpoint endpoint = instance.getEndpoint();
        return format("%s://%s:%s", instance.isUseTls() ? "https" : "http", endpoint.getHost(), endpoint.getPort());
    }
}
