package com.ryuqq.bridge.adapter.http.server;

import com.ryuqq.bridge.application.knowledge.KnowledgeService;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 지식 베이스 라우트를 노출하는 Embedded Jetty 12 서버.
 *
 * <p>{@link #start()} / {@link #stop()}는 {@code lifecycleLock}으로 직렬화되며 여러 번 호출해도 안전합니다.
 * 라우트는 {@value #ROUTE_PREFIX} 아래에 등록됩니다.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public class KnowledgeHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeHttpServer.class);

    public static final String ROUTE_PREFIX = "/api/knowledge";

    private final ServerConfig config;
    private final KnowledgeService knowledgeService;
    private final Object lifecycleLock = new Object();

    private Server server;
    private ServerConnector connector;

    public KnowledgeHttpServer(ServerConfig config, KnowledgeService knowledgeService) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (knowledgeService == null) {
            throw new IllegalArgumentException("knowledgeService cannot be null");
        }
        this.config = config;
        this.knowledgeService = knowledgeService;
    }

    /**
     * 서버 시작. 이미 실행 중이면 아무 것도 하지 않습니다.
     *
     * @throws IllegalStateException 포트 바인딩 등 시작 실패 시
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (server != null && server.isRunning()) {
                log.debug("HTTP server already running on port {}", getPort());
                return;
            }

            Server newServer = new Server();
            ServerConnector newConnector = new ServerConnector(newServer);
            newConnector.setHost(config.host());
            newConnector.setPort(config.port());
            newServer.addConnector(newConnector);

            ServletContextHandler context = new ServletContextHandler();
            context.setContextPath("/");
            ServletHolder routes = new ServletHolder(new KnowledgeRoutesServlet(knowledgeService));
            routes.setAsyncSupported(true);
            context.addServlet(routes, ROUTE_PREFIX + "/*");
            newServer.setHandler(context);

            try {
                newServer.start();
            } catch (Exception e) {
                stopQuietly(newServer);
                throw new IllegalStateException(
                    "Failed to start HTTP server on " + config.host() + ":" + config.port(), e);
            }

            server = newServer;
            connector = newConnector;
            log.info("Knowledge HTTP server started on http://{}:{}{}",
                config.host(), newConnector.getLocalPort(), ROUTE_PREFIX);
        }
    }

    /**
     * 서버 정지. 실행 중이 아니면 아무 것도 하지 않습니다.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (server == null) {
                return;
            }
            stopQuietly(server);
            server = null;
            connector = null;
            log.info("Knowledge HTTP server stopped");
        }
    }

    /**
     * 서버 스레드가 종료될 때까지 대기.
     *
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public void join() throws InterruptedException {
        Server current;
        synchronized (lifecycleLock) {
            current = server;
        }
        if (current != null) {
            current.join();
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return server != null && server.isRunning();
        }
    }

    /**
     * 실제 바인딩된 포트 (설정 포트가 0이면 임의 포트).
     *
     * @return 포트, 실행 중이 아니면 -1
     */
    public int getPort() {
        synchronized (lifecycleLock) {
            return connector == null ? -1 : connector.getLocalPort();
        }
    }

    @Override
    public void close() {
        stop();
    }

    private static void stopQuietly(Server target) {
        try {
            target.stop();
        } catch (Exception e) {
            log.warn("Error while stopping HTTP server: {}", e.getMessage(), e);
        }
    }
}
