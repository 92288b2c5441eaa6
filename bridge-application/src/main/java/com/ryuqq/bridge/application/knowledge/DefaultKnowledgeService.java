package com.ryuqq.bridge.application.knowledge;

import com.ryuqq.bridge.application.bridge.Bridge;
import com.ryuqq.bridge.core.call.Operation;
import com.ryuqq.bridge.core.model.SearchResult;
import com.ryuqq.bridge.core.outcome.CallOutcome;
import com.ryuqq.bridge.core.outcome.Completed;
import com.ryuqq.bridge.core.outcome.Failed;
import com.ryuqq.bridge.core.outcome.NotReady;
import com.ryuqq.bridge.core.outcome.TimedOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Bridge 기반 KnowledgeService 구현체.
 *
 * <p>각 작업을 Operation으로 감싸 Bridge에 제출하고, CallOutcome을 표시용 문자열로 변환합니다.</p>
 *
 * <p><strong>결과 변환 규칙:</strong></p>
 * <ul>
 *   <li>Completed → ResultFormatter로 포맷</li>
 *   <li>Failed → "&lt;작업&gt; failed: &lt;메시지&gt;"</li>
 *   <li>TimedOut → 작업별 degraded 메시지 (예: "Read timed out")</li>
 *   <li>NotReady → "Knowledge base not initialized"</li>
 * </ul>
 *
 * <p>retrieveContext는 어떤 실패든 빈 문자열을 반환합니다.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class DefaultKnowledgeService implements KnowledgeService {

    private static final Logger log = LoggerFactory.getLogger(DefaultKnowledgeService.class);

    private final Bridge bridge;
    private final KnowledgeServiceConfig config;
    private final ResultFormatter formatter;

    public DefaultKnowledgeService(Bridge bridge) {
        this(bridge, new KnowledgeServiceConfig());
    }

    public DefaultKnowledgeService(Bridge bridge, KnowledgeServiceConfig config) {
        if (bridge == null) {
            throw new IllegalArgumentException("bridge cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.bridge = bridge;
        this.config = config;
        this.formatter = new ResultFormatter(config);
    }

    @Override
    public boolean isReady() {
        return bridge.isReady();
    }

    @Override
    public CompletableFuture<String> search(String query, int limit) {
        requireText("query", query);
        requirePositive(limit);
        Operation<SearchResult> op = Operation.of("search", backend -> backend.search(query, limit), query, limit);
        return call(op, config.searchTimeout(),
            result -> formatter.formatSearch(query, result),
            "Search '" + query + "' timed out", "Search");
    }

    @Override
    public CompletableFuture<String> find(String query, int limit) {
        requireText("query", query);
        requirePositive(limit);
        Operation<SearchResult> op = Operation.of("find", backend -> backend.find(query, limit), query, limit);
        return call(op, config.findTimeout(),
            result -> formatter.formatFind(query, result),
            "Deep search '" + query + "' timed out", "Deep search");
    }

    @Override
    public CompletableFuture<String> addResource(String path) {
        requireText("path", path);
        Duration indexTimeout = config.addResourceTimeout();
        // 파일 존재 확인도 워커에서 수행
        Operation<String> op = Operation.of("addResource", backend -> {
            Path file = Paths.get(path);
            if (!Files.exists(file)) {
                return formatter.fileNotFound(path);
            }
            return formatter.formatAddResource(backend.addResource(path, true, indexTimeout));
        }, path);
        return call(op, indexTimeout, Function.identity(), "Adding resource timed out", "Adding resource");
    }

    @Override
    public CompletableFuture<String> listDirectory(String uri) {
        requireText("uri", uri);
        return call(Operation.of("listDirectory", backend -> backend.listDirectory(uri), uri), config.browseTimeout(),
            entries -> formatter.formatDirectory(uri, entries),
            "Listing " + uri + " timed out", "Listing " + uri);
    }

    @Override
    public CompletableFuture<String> read(String uri) {
        requireText("uri", uri);
        return call(Operation.of("read", backend -> backend.read(uri), uri), config.browseTimeout(),
            formatter::formatRead, "Read timed out", "Read");
    }

    @Override
    public CompletableFuture<String> abstractOf(String uri) {
        requireText("uri", uri);
        return call(Operation.of("abstract", backend -> backend.abstractOf(uri), uri), config.browseTimeout(),
            text -> text == null ? "" : text, "Abstract timed out", "Abstract");
    }

    @Override
    public CompletableFuture<String> listSessions() {
        return call(Operation.of("listSessions", backend -> backend.listSessions()), config.browseTimeout(),
            formatter::formatSessions, "Listing sessions timed out", "Listing sessions");
    }

    @Override
    public CompletableFuture<String> retrieveContext(String query, int limit) {
        requireText("query", query);
        requirePositive(limit);
        Operation<SearchResult> op = Operation.of("retrieveContext", backend -> backend.search(query, limit), query, limit);
        return bridge.submit(op, config.contextTimeout())
            .thenApply(outcome -> {
                if (outcome instanceof Completed<SearchResult> completed && completed.value() != null) {
                    return formatter.formatContext(completed.value());
                }
                return "";
            })
            .exceptionally(e -> {
                log.warn("Context retrieval for '{}' could not be rendered", query, e);
                return "";
            });
    }

    private <T> CompletableFuture<String> call(
            Operation<T> operation,
            Duration timeout,
            Function<T, String> onValue,
            String timeoutText,
            String failureLabel) {
        return bridge.submit(operation, timeout)
            .thenApply(outcome -> render(outcome, onValue, timeoutText, failureLabel))
            .exceptionally(e -> {
                log.error("Rendering {} result failed", operation.name(), e);
                return failureLabel + " failed: " + e.getMessage();
            });
    }

    private static <T> String render(
            CallOutcome<T> outcome,
            Function<T, String> onValue,
            String timeoutText,
            String failureLabel) {
        if (outcome instanceof Completed<T> completed) {
            return onValue.apply(completed.value());
        }
        if (outcome instanceof Failed<T> failed) {
            return failureLabel + " failed: " + failed.message();
        }
        if (outcome instanceof TimedOut<T>) {
            return timeoutText;
        }
        return ((NotReady<T>) outcome).reason();
    }

    private static void requireText(String name, String value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
    }
}
