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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Coordinates of a single backing store: its kind, where it lives and how to log into it.
 */
public class DataSourceInstance
{
    private final DataSourceKind kind;
    private final Endpoint endpoint;
    private final String database;
    private final Credentials credentials;
    private final boolean useTls;
    private final Map<String, String> options;

    @JsonCreator
    public DataSourceInstance(
            @JsonProperty("kind") DataSourceKind kind,
            @JsonProperty("endpoint") Endpoint endpoint,
            @JsonProperty("database") String database,
            @JsonProperty("credentials") Credentials credentials,
            @JsonProperty("useTls") boolean useTls,
            @JsonProperty("options") Map<String, String> options)
    {
        this.kind = kind == null ? DataSourceKind.UNSPECIFIED : kind;
        this.endpoint = endpoint;
        this.database = database;
        this.credentials = credentials;
        this.useTls = useTls;
        this.options = options == null ? ImmutableMap.of() : ImmutableMap.copyOf(options);
    }

    @JsonProperty
    public DataSourceKind getKind()
    {
        return kind;
    }

    @JsonProperty
    public Endpoint getEndpoint()
    {
        return endpoint;
    }

    @JsonProperty
    public String getDatabase()
    {
        return database;
    }

    @JsonProperty
    public Credentials getCredentials()
    {
        return credentials;
    }

    @JsonProperty
    public boolean isUseTls()
    {
        return useTls;
    }

    @JsonProperty
    public Map<String, String> getOptions()
    {
        return options;
    }

    public Optional<String> getOption(String name)
    {
        requireNonNull(name, "name is null");
        return Optional.ofNullable(options.get(name));
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("kind", kind)
                .add("endpoint", endpoint)
                .add("database", database)
                .add("useTls", useTls)
                .toString();
    }
}
