package com.ryuqq.bridge.adapter.http.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.bridge.adapter.http.json.JsonSupport;
import com.ryuqq.bridge.adapter.http.server.KnowledgeHttpServer;
import com.ryuqq.bridge.application.knowledge.KnowledgeService;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 지식 베이스 HTTP 라우트를 호출하는 커맨드라인 클라이언트.
 *
 * <pre>
 * knowledge search &lt;query&gt;     search the knowledge base
 * knowledge find &lt;query&gt;       deep search (recursive directory retrieval)
 * knowledge add &lt;file_path&gt;    add a file to the knowledge base
 * knowledge ls [uri]           list directory contents
 * knowledge sessions           list sessions
 * knowledge help               show this help
 * </pre>
 *
 * <p>응답의 {@code result} 필드를 출력하고, 없으면 {@code error} 필드를 출력합니다.
 * 서버에 연결할 수 없으면 {@code API unavailable: <reason>}을 출력합니다.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class KnowledgeCli {

    public static final String DEFAULT_BASE_URL = "http://127.0.0.1:18790";
    public static final String BASE_URL_ENV = "KNOWLEDGE_API_BASE";

    static final int CLI_SEARCH_LIMIT = 10;

    static final String HELP = String.join("\n",
        "Knowledge CLI - operate the knowledge base through the HTTP API.",
        "",
        "Usage:",
        "  knowledge search <query>        search the knowledge base",
        "  knowledge find <query>          deep search (recursive directory retrieval)",
        "  knowledge add <file_path>       add a file to the knowledge base",
        "  knowledge ls [uri]              list directory contents",
        "  knowledge sessions              list sessions",
        "  knowledge help                  show this help",
        "",
        "The knowledge HTTP server must be running (" + BASE_URL_ENV + ", default " + DEFAULT_BASE_URL + ").");

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl baseUrl;
    private final OkHttpClient client;
    private final PrintStream out;

    public KnowledgeCli(String baseUrl, OkHttpClient client, PrintStream out) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be null or blank");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        HttpUrl parsed = HttpUrl.parse(baseUrl.trim());
        if (parsed == null) {
            throw new IllegalArgumentException("baseUrl is not a valid http(s) URL (current: " + baseUrl + ")");
        }
        this.baseUrl = parsed;
        this.client = client;
        this.out = out;
    }

    public static void main(String[] args) {
        String base = System.getenv(BASE_URL_ENV);
        OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(120, TimeUnit.SECONDS)
            .build();
        KnowledgeCli cli = new KnowledgeCli(base == null || base.isBlank() ? DEFAULT_BASE_URL : base, client, System.out);
        System.exit(cli.run(args));
    }

    /**
     * 명령 실행.
     *
     * @param args 명령과 인자
     * @return 종료 코드 (성공 0, 사용법 오류 2, 서버 응답 없음 1)
     */
    public int run(String... args) {
        if (args == null || args.length == 0 || "help".equals(args[0])) {
            out.println(HELP);
            return 0;
        }

        String command = args[0];
        String rest = String.join(" ", Arrays.copyOfRange(args, 1, args.length)).trim();

        switch (command) {
            case "search":
            case "find":
                if (rest.isEmpty()) {
                    return usage(command + " <query>");
                }
                Map<String, Object> search = new LinkedHashMap<>();
                search.put("query", rest);
                search.put("limit", CLI_SEARCH_LIMIT);
                return print(post(command, search));
            case "add":
                if (rest.isEmpty()) {
                    return usage("add <file_path>");
                }
                return print(post("add", Map.of("path", rest)));
            case "ls":
                return print(get(route("ls").newBuilder()
                    .addQueryParameter("uri", rest.isEmpty() ? KnowledgeService.DEFAULT_DIRECTORY_URI : rest)
                    .build()));
            case "sessions":
                return print(get(route("sessions")));
            default:
                out.println("Unknown command: " + command);
                out.println(HELP);
                return 2;
        }
    }

    private int usage(String synopsis) {
        out.println("Usage: knowledge " + synopsis);
        return 2;
    }

    private int print(CliResult result) {
        out.println(result.text());
        return result.reachable() ? 0 : 1;
    }

    private HttpUrl route(String name) {
        return baseUrl.newBuilder()
            .addPathSegments(KnowledgeHttpServer.ROUTE_PREFIX.substring(1))
            .addPathSegment(name)
            .build();
    }

    private CliResult get(HttpUrl url) {
        return execute(new Request.Builder().url(url).get().build());
    }

    private CliResult post(String name, Map<String, ?> body) {
        RequestBody requestBody = RequestBody.create(JsonSupport.toJson(body), JSON);
        return execute(new Request.Builder().url(route(name)).post(requestBody).build());
    }

    private CliResult execute(Request request) {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            return new CliResult(extract(text), true);
        } catch (IOException e) {
            return new CliResult("API unavailable: " + e.getMessage(), false);
        }
    }

    private static String extract(String text) {
        JsonNode node;
        try {
            node = JsonSupport.mapper().readTree(text);
        } catch (IOException e) {
            return text;
        }
        if (node != null && node.hasNonNull("result")) {
            return node.get("result").asText();
        }
        if (node != null && node.hasNonNull("error")) {
            return node.get("error").asText();
        }
        return "Unknown error";
    }

    private record CliResult(String text, boolean reachable) {
    }
}
