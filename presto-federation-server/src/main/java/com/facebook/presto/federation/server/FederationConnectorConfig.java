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
package com.facebook.presto.federation.server;

import com.facebook.airlift.configuration.Config;
import com.facebook.airlift.configuration.ConfigDescription;
import com.facebook.presto.federation.protocol.ReadSplitsFormat;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Optional;

public class FederationConnectorConfig
{
    public static final String CONFIG_PREFIX = "federation-connector";

    private String serverName;
    private Integer serverPort;
    private boolean serverSslEnabled;
    private String serverSSLCertificateFile;
    private String serverSSLKeyFile;
    private int readSplitThreadPoolSize = 16;
    private ReadSplitsFormat defaultFormat = ReadSplitsFormat.ARROW_IPC_STREAMING;
    private Long readLimitRows;
    private boolean observationEnabled;

    public String getServerName()
    {
        return serverName;
    }

    @Config("server")
    public FederationConnectorConfig setServerName(String serverName)
    {
        this.serverName = serverName;
        return this;
    }

    public Integer getServerPort()
    {
        return serverPort;
    }

    @Config("server.port")
    public FederationConnectorConfig setServerPort(Integer serverPort)
    {
        this.serverPort = serverPort;
        return this;
    }

    public boolean getServerSslEnabled()
    {
        return serverSslEnabled;
    }

    @Config("server-ssl-enabled")
    public FederationConnectorConfig setServerSslEnabled(boolean serverSslEnabled)
    {
        this.serverSslEnabled = serverSslEnabled;
        return this;
    }

    public String getServerSSLCertificateFile()
    {
        return serverSSLCertificateFile;
    }

    @Config("server-ssl-certificate-file")
    public FederationConnectorConfig setServerSSLCertificateFile(String serverSSLCertificateFile)
    {
        this.serverSSLCertificateFile = serverSSLCertificateFile;
        return this;
    }

    public String getServerSSLKeyFile()
    {
        return serverSSLKeyFile;
    }

    @Config("server-ssl-key-file")
    public FederationConnectorConfig setServerSSLKeyFile(String serverSSLKeyFile)
    {
        this.serverSSLKeyFile = serverSSLKeyFile;
        return this;
    }

    @Min(1)
    public int getReadSplitThreadPoolSize()
    {
        return readSplitThreadPoolSize;
    }

    @Config("thread-pool-size")
    @ConfigDescription("Size of thread pool used to read splits")
    public FederationConnectorConfig setReadSplitThreadPoolSize(int readSplitThreadPoolSize)
    {
        this.readSplitThreadPoolSize = readSplitThreadPoolSize;
        return this;
    }

    @NotNull
    public ReadSplitsFormat getDefaultFormat()
    {
        return defaultFormat;
    }

    @Config("default-format")
    @ConfigDescription("Page format used when a ReadSplits request does not specify one")
    public FederationConnectorConfig setDefaultFormat(ReadSplitsFormat defaultFormat)
    {
        this.defaultFormat = defaultFormat;
        return this;
    }

    public Optional<Long> getReadLimitRows()
    {
        return Optional.ofNullable(readLimitRows);
    }

    @Config("read-limit.rows")
    @ConfigDescription("Maximum number of rows a ReadSplits request may return")
    public FederationConnectorConfig setReadLimitRows(Long readLimitRows)
    {
        this.readLimitRows = readLimitRows;
        return this;
    }

    public boolean isObservationEnabled()
    {
        return observationEnabled;
    }

    @Config("observation.enabled")
    @ConfigDescription("Log the lifecycle of ReadSplits requests")
    public FederationConnectorConfig setObservationEnabled(boolean observationEnabled)
    {
        this.observationEnabled = observationEnabled;
        return this;
    }
}
