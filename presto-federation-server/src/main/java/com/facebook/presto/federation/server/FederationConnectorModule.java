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

import com.facebook.airlift.configuration.AbstractConfigurationAwareModule;
import com.facebook.presto.federation.datasource.DataSourceCollection;
import com.facebook.presto.federation.datasource.DataSourceFactory;
import com.facebook.presto.federation.datasource.jdbc.ConnectionFactory;
import com.facebook.presto.federation.datasource.jdbc.DriverConnectionFactory;
import com.facebook.presto.federation.datasource.jdbc.JdbcDataSourceConfig;
import com.facebook.presto.federation.datasource.jdbc.JdbcDataSourceFactory;
import com.facebook.presto.federation.datasource.objectstorage.CsvObjectStorageDataSourceFactory;
import com.facebook.presto.federation.datasource.objectstorage.ObjectStorageClient;
import com.facebook.presto.federation.datasource.objectstorage.ObjectStorageConfig;
import com.facebook.presto.federation.datasource.objectstorage.UrlObjectStorageClient;
import com.facebook.presto.federation.observation.LoggingQueryObserver;
import com.facebook.presto.federation.observation.NoOpQueryObserver;
import com.facebook.presto.federation.observation.QueryObserver;
import com.facebook.presto.federation.paging.PagingConfig;
import com.facebook.presto.federation.protocol.DataSourceKind;
import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.multibindings.MapBinder;
import jakarta.inject.Singleton;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static com.facebook.airlift.concurrent.Threads.threadsNamed;
import static com.facebook.airlift.configuration.ConfigBinder.configBinder;
import static com.facebook.presto.federation.server.FederationConnectorConfig.CONFIG_PREFIX;
import static com.google.inject.multibindings.MapBinder.newMapBinder;
import static java.util.concurrent.Executors.newCachedThreadPool;
import static org.weakref.jmx.guice.ExportBinder.newExporter;

public class FederationConnectorModule
        extends AbstractConfigurationAwareModule
{
    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(FederationConnectorConfig.class, CONFIG_PREFIX);
        configBinder(binder).bindConfig(PagingConfig.class, CONFIG_PREFIX);
        configBinder(binder).bindConfig(JdbcDataSourceConfig.class, CONFIG_PREFIX);
        configBinder(binder).bindConfig(ObjectStorageConfig.class, CONFIG_PREFIX);

        binder.bind(BufferAllocator.class).to(RootAllocator.class).in(Scopes.SINGLETON);
        binder.bind(FederationFlightProducer.class).in(Scopes.SINGLETON);
        binder.bind(DataSourceCollection.class).in(Scopes.SINGLETON);

        binder.bind(FederationConnectorStats.class).in(Scopes.SINGLETON);
        newExporter(binder).export(FederationConnectorStats.class).withGeneratedName();

        // data sources
        binder.bind(ConnectionFactory.class).to(DriverConnectionFactory.class).in(Scopes.SINGLETON);
        binder.bind(JdbcDataSourceFactory.class).in(Scopes.SINGLETON);
        binder.bind(ObjectStorageClient.class).to(UrlObjectStorageClient.class).in(Scopes.SINGLETON);
        binder.bind(CsvObjectStorageDataSourceFactory.class).in(Scopes.SINGLETON);

        MapBinder<DataSourceKind, DataSourceFactory> dataSourceFactories = newMapBinder(binder, DataSourceKind.class, DataSourceFactory.class);
        for (DataSourceKind kind : JdbcDataSourceFactory.getSupportedKinds()) {
            dataSourceFactories.addBinding(kind).to(JdbcDataSourceFactory.class);
        }
        dataSourceFactories.addBinding(DataSourceKind.S3).to(CsvObjectStorageDataSourceFactory.class);

        if (buildConfigObject(FederationConnectorConfig.class).isObservationEnabled()) {
            binder.bind(QueryObserver.class).to(LoggingQueryObserver.class).in(Scopes.SINGLETON);
        }
        else {
            binder.bind(QueryObserver.class).to(NoOpQueryObserver.class).in(Scopes.SINGLETON);
        }
    }

    @Provides
    @Singleton
    @ForSplitReader
    public static ExecutorService createSplitReaderExecutor(FederationConnectorConfig config)
    {
        int threads = config.getReadSplitThreadPoolSize();
        return new ThreadPoolExecutor(threads, threads, 1L, TimeUnit.MINUTES, new LinkedBlockingQueue<>(), threadsNamed("federation-split-reader-%s"));
    }

    /**
     * One thread per open ReadSplits stream, parked while its client is not ready for more.
     */
    @Provides
    @Singleton
    @ForReadSplitsStream
    public static ExecutorService createReadSplitsStreamExecutor()
    {
        return newCachedThreadPool(threadsNamed("federation-read-splits-%s"));
    }

    @Provides
    @Singleton
    @ForFlightServer
    public static ExecutorService createFlightServerExecutor(FederationConnectorConfig config)
    {
        return new ThreadPoolExecutor(0, config.getReadSplitThreadPoolSize(), 1L, TimeUnit.MINUTES, new SynchronousQueue<>(), threadsNamed("federation-flight-%s"), new ThreadPoolExecutor.CallerRunsPolicy());
    }
}
