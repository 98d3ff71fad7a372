package de.bsommerfeld.catalog.server.http;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.config.ServerConfig;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Jetty 12 server exposing the catalog query surface under
 * {@code /api/v1} plus a {@code /healthz} probe.
 */
@Singleton
public class RegistryServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryServer.class);
    private static final long STOP_TIMEOUT_MILLIS = 2000;

    private final ServerConfig config;
    private final RegistryServlet registryServlet;
    private final Object lifecycleLock = new Object();
    private Server server;

    @Inject
    public RegistryServer(ServerConfig config, RegistryServlet registryServlet) {
        this.config = config;
        this.registryServlet = registryServlet;
    }

    public void start() throws Exception {
        synchronized (lifecycleLock) {
            if (server != null && server.isStarted()) {
                LOG.trace("Server already started");
                return;
            }

            QueuedThreadPool threadPool = new QueuedThreadPool();
            threadPool.setDaemon(true);
            threadPool.setName("catalog-http");

            Server jetty = new Server(threadPool);
            ServerConnector connector = new ServerConnector(jetty);
            if (!"0.0.0.0".equals(config.getHost())) {
                connector.setHost(config.getHost());
            }
            connector.setPort(config.getPort());
            jetty.addConnector(connector);

            ServletContextHandler context = new ServletContextHandler();
            context.setContextPath("/");
            context.addServlet(new ServletHolder(registryServlet), "/api/v1/*");
            context.addServlet(new ServletHolder(new HealthServlet()), "/healthz");
            jetty.setHandler(context);
            jetty.setStopTimeout(STOP_TIMEOUT_MILLIS);

            jetty.start();
            server = jetty;
            LOG.info("Catalog server listening on {}:{}", config.getHost(), getPort());
        }
    }

    public void stop() throws Exception {
        synchronized (lifecycleLock) {
            if (server == null) {
                return;
            }
            try {
                server.stop();
                LOG.info("Catalog server stopped");
            } finally {
                server = null;
            }
        }
    }

    public void join() throws InterruptedException {
        Server s;
        synchronized (lifecycleLock) {
            s = server;
        }
        if (s != null) {
            s.join();
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return server != null && server.isRunning();
        }
    }

    /** The bound port once started (resolves port 0), the configured port otherwise. */
    public int getPort() {
        synchronized (lifecycleLock) {
            if (server != null && server.isStarted()) {
                return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
            }
            return config.getPort();
        }
    }

    @Override
    public void close() throws Exception {
        stop();
    }
}
