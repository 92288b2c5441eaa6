package com.ryuqq.bridge.adapter.http.server;

import com.ryuqq.bridge.adapter.inmemory.knowledge.InMemoryKnowledgeBase;
import com.ryuqq.bridge.adapter.inmemory.queue.LinkedDispatchQueue;
import com.ryuqq.bridge.adapter.runner.SingleWorkerBridge;
import com.ryuqq.bridge.adapter.runner.WorkerConfig;
import com.ryuqq.bridge.application.knowledge.DefaultKnowledgeService;
import com.ryuqq.bridge.core.call.DispatchItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 지식 베이스 HTTP 서버 진입점.
 *
 * <p>워커 시작 → 준비 대기 → HTTP 서버 시작 순서로 구동하고,
 * JVM 종료 시 HTTP 서버 → 브리지 순서로 정리합니다.
 * 초기화에 실패해도 서버는 뜨며, 라우트는 503을 반환합니다.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class KnowledgeServerApp {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeServerApp.class);

    private static final Duration READY_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private KnowledgeServerApp() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void main(String[] args) throws InterruptedException {
        ServerConfig config = ServerConfig.fromEnvironment();

        SingleWorkerBridge bridge = new SingleWorkerBridge(
            new LinkedDispatchQueue<DispatchItem>(),
            () -> new InMemoryKnowledgeBase(config.dataDir()),
            new WorkerConfig());
        bridge.start();

        if (!bridge.awaitReady(READY_TIMEOUT)) {
            log.warn("Knowledge base not ready (state={}); routes will answer 503", bridge.getState());
        }

        KnowledgeHttpServer server = new KnowledgeHttpServer(config, new DefaultKnowledgeService(bridge));
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(server, bridge), "knowledge-shutdown"));

        server.start();
        server.join();
    }

    static void shutdown(KnowledgeHttpServer server, SingleWorkerBridge bridge) {
        server.close();
        bridge.close();
        try {
            if (!bridge.awaitTermination(SHUTDOWN_TIMEOUT)) {
                log.warn("Knowledge worker did not stop within {}", SHUTDOWN_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
