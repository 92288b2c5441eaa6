package com.ryuqq.bridge.adapter.http.server;

import com.ryuqq.bridge.adapter.http.json.JsonSupport;
import com.ryuqq.bridge.adapter.http.json.JsonSupport.MalformedBodyException;
import com.ryuqq.bridge.adapter.http.json.KnowledgeMessages.AddRequest;
import com.ryuqq.bridge.adapter.http.json.KnowledgeMessages.AugmentRequest;
import com.ryuqq.bridge.adapter.http.json.KnowledgeMessages.ErrorResponse;
import com.ryuqq.bridge.adapter.http.json.KnowledgeMessages.ResultResponse;
import com.ryuqq.bridge.adapter.http.json.KnowledgeMessages.SearchRequest;
import com.ryuqq.bridge.adapter.http.json.KnowledgeMessages.StatusResponse;
import com.ryuqq.bridge.application.knowledge.ContextAugmenter;
import com.ryuqq.bridge.application.knowledge.KnowledgeService;
import com.ryuqq.bridge.core.exception.BridgeNotReadyException;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 지식 베이스 HTTP 라우트 (비동기 서블릿).
 *
 * <p>각 라우트는 {@link KnowledgeService} 호출 하나에 1:1로 대응합니다.
 * 응답은 {@link AsyncContext}로 완료되므로 대기 중인 호출이 Jetty 스레드를 점유하지 않습니다.</p>
 *
 * <p><strong>상태 코드:</strong></p>
 * <ul>
 *   <li>200: {@code {"result": "..."}}</li>
 *   <li>400: 잘못된 JSON, 필수 필드 누락, 양수가 아닌 limit</li>
 *   <li>404: 알 수 없는 라우트</li>
 *   <li>503: 지식 베이스 미초기화</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public class KnowledgeRoutesServlet extends HttpServlet {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeRoutesServlet.class);

    private static final String JSON_CONTENT_TYPE = "application/json";

    private final transient KnowledgeService knowledgeService;
    private final transient ContextAugmenter contextAugmenter;

    public KnowledgeRoutesServlet(KnowledgeService knowledgeService) {
        if (knowledgeService == null) {
            throw new IllegalArgumentException("knowledgeService cannot be null");
        }
        this.knowledgeService = knowledgeService;
        this.contextAugmenter = new ContextAugmenter(knowledgeService);
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
        String route = route(request);
        switch (route) {
            case "/status" -> writeJson(response, HttpServletResponse.SC_OK, status());
            case "/ls" -> dispatch(request, response, () -> {
                String uri = request.getParameter("uri");
                return knowledgeService.listDirectory(
                    uri == null || uri.isBlank() ? KnowledgeService.DEFAULT_DIRECTORY_URI : uri);
            });
            case "/read" -> dispatch(request, response,
                () -> knowledgeService.read(requiredParameter(request, "uri")));
            case "/abstract" -> dispatch(request, response,
                () -> knowledgeService.abstractOf(requiredParameter(request, "uri")));
            case "/sessions" -> dispatch(request, response, knowledgeService::listSessions);
            default -> notFound(response);
        }
    }

    @Override
    protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
        String route = route(request);
        switch (route) {
            case "/search" -> dispatch(request, response, () -> {
                SearchRequest body = JsonSupport.read(request.getInputStream(), SearchRequest.class);
                return knowledgeService.search(requiredField(body.query(), "query"), body.limitOrDefault());
            });
            case "/find" -> dispatch(request, response, () -> {
                SearchRequest body = JsonSupport.read(request.getInputStream(), SearchRequest.class);
                return knowledgeService.find(requiredField(body.query(), "query"), body.limitOrDefault());
            });
            case "/add" -> dispatch(request, response, () -> {
                AddRequest body = JsonSupport.read(request.getInputStream(), AddRequest.class);
                return knowledgeService.addResource(requiredField(body.path(), "path"));
            });
            case "/augment" -> dispatchAugment(request, response);
            default -> notFound(response);
        }
    }

    private StatusResponse status() {
        return knowledgeService.isReady()
            ? StatusResponse.ok()
            : StatusResponse.disabled(KnowledgeService.NOT_READY_MESSAGE);
    }

    /**
     * 준비 상태 확인 → 요청 파싱 → 비동기 호출 → 결과 기록.
     */
    private void dispatch(HttpServletRequest request, HttpServletResponse response, RouteCall call)
            throws IOException {
        CompletableFuture<String> result;
        try {
            ensureReady();
            result = call.invoke();
        } catch (BridgeNotReadyException e) {
            writeError(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, e.getMessage());
            return;
        } catch (MalformedBodyException | IllegalArgumentException e) {
            writeError(response, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
            return;
        }

        complete(request, response, result.thenApply(ResultResponse::new));
    }

    private void ensureReady() {
        if (!knowledgeService.isReady()) {
            throw new BridgeNotReadyException(KnowledgeService.NOT_READY_MESSAGE);
        }
    }

    /**
     * 미준비 상태에서도 원본 메시지를 그대로 돌려줍니다.
     */
    private void dispatchAugment(HttpServletRequest request, HttpServletResponse response) throws IOException {
        CompletableFuture<String> result;
        try {
            AugmentRequest body = JsonSupport.read(request.getInputStream(), AugmentRequest.class);
            result = contextAugmenter.augment(requiredField(body.message(), "message"), body.limitOrDefault());
        } catch (MalformedBodyException | IllegalArgumentException e) {
            writeError(response, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
            return;
        }

        complete(request, response, result.thenApply(ResultResponse::new));
    }

    /**
     * 응답 기록은 컨테이너 스레드에서 수행 (워커 스레드는 결과 완료만 담당).
     */
    private void complete(HttpServletRequest request, HttpServletResponse response,
                          CompletableFuture<ResultResponse> result) {
        AsyncContext async = request.startAsync();
        async.setTimeout(0);
        result.whenComplete((body, error) -> async.start(() -> {
            try {
                if (error == null) {
                    writeJson(response, HttpServletResponse.SC_OK, body);
                } else {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                    log.error("Route {} failed", route(request), cause);
                    writeError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, String.valueOf(cause.getMessage()));
                }
            } catch (IOException e) {
                log.warn("Failed to write response for {}: {}", route(request), e.getMessage());
            } finally {
                async.complete();
            }
        }));
    }

    private static String route(HttpServletRequest request) {
        String pathInfo = request.getPathInfo();
        if (pathInfo == null || pathInfo.isEmpty()) {
            return "/";
        }
        return pathInfo.length() > 1 && pathInfo.endsWith("/")
            ? pathInfo.substring(0, pathInfo.length() - 1)
            : pathInfo;
    }

    private static String requiredParameter(HttpServletRequest request, String name) {
        return requiredField(request.getParameter(name), name);
    }

    private static String requiredField(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static void notFound(HttpServletResponse response) throws IOException {
        writeError(response, HttpServletResponse.SC_NOT_FOUND, "Not found");
    }

    private static void writeError(HttpServletResponse response, int status, String message) throws IOException {
        writeJson(response, status, new ErrorResponse(message));
    }

    private static void writeJson(HttpServletResponse response, int status, Object body) throws IOException {
        byte[] bytes = JsonSupport.toJson(body).getBytes(StandardCharsets.UTF_8);
        response.setStatus(status);
        response.setContentType(JSON_CONTENT_TYPE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentLength(bytes.length);
        response.getOutputStream().write(bytes);
    }

    @FunctionalInterface
    private interface RouteCall {
        CompletableFuture<String> invoke() throws IOException;
    }
}
