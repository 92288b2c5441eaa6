package com.ryuqq.bridge.adapter.http.server;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

/**
 * HTTP 서버 설정 (불변 record).
 *
 * <p><strong>설정 항목 (시스템 프로퍼티 → 환경 변수 → 기본값 순):</strong></p>
 * <ul>
 *   <li>host: {@code knowledge.http.host} / {@code KNOWLEDGE_HTTP_HOST} (기본 127.0.0.1)</li>
 *   <li>port: {@code knowledge.http.port} / {@code KNOWLEDGE_HTTP_PORT} (기본 18790, 0이면 임의 포트)</li>
 *   <li>dataDir: {@code knowledge.data.dir} / {@code KNOWLEDGE_DATA_DIR} (기본 없음, 빈 저장소)</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 * @param host 바인딩 주소 (null/blank 불가)
 * @param port 포트 (0 ~ 65535)
 * @param dataDir 초기 리소스 디렉터리 (null 허용)
 */
public record ServerConfig(
    String host,
    int port,
    Path dataDir
) {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 18790;

    /**
     * 기본 설정 생성자.
     */
    public ServerConfig() {
        this(DEFAULT_HOST, DEFAULT_PORT, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ServerConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535 (current: " + port + ")");
        }
        host = host.trim();
    }

    /**
     * 현재 프로세스의 시스템 프로퍼티와 환경 변수로 설정 생성.
     *
     * @return ServerConfig
     * @throws IllegalArgumentException 포트 값이 숫자가 아닌 경우
     */
    public static ServerConfig fromEnvironment() {
        return resolve(System::getProperty, System::getenv);
    }

    /**
     * 주어진 조회 함수로 설정 생성 (시스템 프로퍼티 우선).
     *
     * @param properties 시스템 프로퍼티 조회 함수
     * @param environment 환경 변수 조회 함수
     * @return ServerConfig
     * @throws IllegalArgumentException 포트 값이 숫자가 아닌 경우
     */
    public static ServerConfig resolve(Function<String, String> properties, Function<String, String> environment) {
        String host = lookup(properties, environment, "knowledge.http.host", "KNOWLEDGE_HTTP_HOST");
        String port = lookup(properties, environment, "knowledge.http.port", "KNOWLEDGE_HTTP_PORT");
        String dataDir = lookup(properties, environment, "knowledge.data.dir", "KNOWLEDGE_DATA_DIR");
        return new ServerConfig(
            host == null ? DEFAULT_HOST : host,
            port == null ? DEFAULT_PORT : parsePort(port),
            dataDir == null ? null : Paths.get(dataDir));
    }

    public ServerConfig withPort(int port) {
        return new ServerConfig(host, port, dataDir);
    }

    public ServerConfig withDataDir(Path dataDir) {
        return new ServerConfig(host, port, dataDir);
    }

    private static String lookup(Function<String, String> properties, Function<String, String> environment,
                                 String propertyKey, String envKey) {
        String value = properties.apply(propertyKey);
        if (value == null || value.isBlank()) {
            value = environment.apply(envKey);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parsePort(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("port must be a number (current: " + value + ")", e);
        }
    }
}
