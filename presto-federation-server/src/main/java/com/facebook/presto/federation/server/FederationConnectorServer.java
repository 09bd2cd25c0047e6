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

import com.facebook.airlift.bootstrap.Bootstrap;
import com.facebook.airlift.json.JsonModule;
import com.facebook.airlift.log.Logger;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Module;
import org.apache.arrow.flight.FlightServer;
import org.apache.arrow.flight.Location;
import org.apache.arrow.flight.grpc.ContextPropagatingExecutorService;
import org.apache.arrow.memory.BufferAllocator;
import org.weakref.jmx.guice.MBeanModule;

import javax.management.MBeanServer;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.util.Map;
import java.util.concurrent.ExecutorService;

public class FederationConnectorServer
{
    private FederationConnectorServer()
    {
    }

    /**
     * @param extraModules must bind {@link MBeanServer}
     */
    public static Injector initialize(Map<String, String> config, Module... extraModules)
    {
        Bootstrap app = new Bootstrap(ImmutableList.<Module>builder()
                .add(new FederationConnectorModule())
                .add(new JsonModule())
                .add(new MBeanModule())
                .add(extraModules)
                .build());

        if (config != null && !config.isEmpty()) {
            // Required config was provided instead of vm option -Dconfig=<path-to-config>
            app.setRequiredConfigurationProperties(config);
        }

        return app.initialize();
    }

    public static FlightServer start(Injector injector, FlightServer.Builder builder)
            throws Exception
    {
        builder.allocator(injector.getInstance(BufferAllocator.class));
        FederationConnectorConfig config = injector.getInstance(FederationConnectorConfig.class);

        if (config.getServerName() == null || config.getServerPort() == null) {
            throw new IllegalArgumentException("Required configuration 'federation-connector.server' and 'federation-connector.server.port' not set");
        }

        if (config.getServerSslEnabled()) {
            if (config.getServerSSLCertificateFile() == null || config.getServerSSLKeyFile() == null) {
                throw new IllegalArgumentException("'federation-connector.server-ssl-enabled' is enabled but 'federation-connector.server-ssl-certificate-file' or 'federation-connector.server-ssl-key-file' not set");
            }
            builder.location(Location.forGrpcTls(config.getServerName(), config.getServerPort()));
            builder.useTls(new File(config.getServerSSLCertificateFile()), new File(config.getServerSSLKeyFile()));
        }
        else {
            builder.location(Location.forGrpcInsecure(config.getServerName(), config.getServerPort()));
        }

        ExecutorService executor = injector.getInstance(Key.get(ExecutorService.class, ForFlightServer.class));
        builder.executor(new ContextPropagatingExecutorService(executor));
        builder.producer(injector.getInstance(FederationFlightProducer.class));

        FlightServer server = builder.build();
        server.start();
        return server;
    }

    public static void main(String[] args)
    {
        Logger log = Logger.get(FederationConnectorServer.class);

        Map<String, String> config;
        if (System.getProperty("config") == null) {
            log.info("Federation connector using default config, override with -Dconfig=<path-to-config>");
            config = ImmutableMap.of(
                    "federation-connector.server", "localhost",
                    "federation-connector.server.port", String.valueOf(2130));
        }
        else {
            log.info("Federation connector using config from: %s", System.getProperty("config"));
            config = ImmutableMap.of();
        }
        Injector injector = initialize(config, binder -> binder.bind(MBeanServer.class).toInstance(ManagementFactory.getPlatformMBeanServer()));

        try (FlightServer server = start(injector, FlightServer.builder())) {
            log.info("======== Federation connector started on port: %s ========", server.getPort());
            server.awaitTermination();
        }
        catch (Throwable t) {
            log.error(t);
            System.exit(1);
        }
        finally {
            injector.getInstance(Key.get(ExecutorService.class, ForReadSplitsStream.class)).shutdownNow();
            injector.getInstance(Key.get(ExecutorService.class, ForSplitReader.class)).shutdownNow();
            injector.getInstance(BufferAllocator.class).close();
        }
    }
}
