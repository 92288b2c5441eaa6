package com.ryuqq.bridge.application.knowledge;

import java.time.Duration;

/**
 * KnowledgeService 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>searchTimeoutMs: search 대기 시간 (기본 15000ms)</li>
 *   <li>findTimeoutMs: find 대기 시간 (기본 30000ms)</li>
 *   <li>addResourceTimeoutMs: addResource 대기 및 인덱싱 시간 (기본 120000ms)</li>
 *   <li>browseTimeoutMs: ls/read/abstract/sessions 대기 시간 (기본 15000ms)</li>
 *   <li>contextTimeoutMs: retrieveContext 대기 시간 (기본 10000ms)</li>
 *   <li>snippetLength: 검색 결과 항목 최대 길이 (기본 300)</li>
 *   <li>readMaxLength: read 결과 최대 길이 (기본 2000)</li>
 *   <li>contextSnippetLength: 컨텍스트 리소스 항목 최대 길이 (기본 500)</li>
 *   <li>maxSessions: 세션 목록 최대 개수 (기본 20)</li>
 *   <li>contextMaxEntries: 컨텍스트에 포함할 메모리/리소스 최대 개수 (각각, 기본 3)</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record KnowledgeServiceConfig(
    long searchTimeoutMs,
    long findTimeoutMs,
    long addResourceTimeoutMs,
    long browseTimeoutMs,
    long contextTimeoutMs,
    int snippetLength,
    int readMaxLength,
    int contextSnippetLength,
    int maxSessions,
    int contextMaxEntries
) {

    /**
     * 기본 설정 생성자.
     */
    public KnowledgeServiceConfig() {
        this(15_000, 30_000, 120_000, 15_000, 10_000, 300, 2000, 500, 20, 3);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 양수가 아닌 값이 있는 경우
     */
    public KnowledgeServiceConfig {
        requirePositive("searchTimeoutMs", searchTimeoutMs);
        requirePositive("findTimeoutMs", findTimeoutMs);
        requirePositive("addResourceTimeoutMs", addResourceTimeoutMs);
        requirePositive("browseTimeoutMs", browseTimeoutMs);
        requirePositive("contextTimeoutMs", contextTimeoutMs);
        requirePositive("snippetLength", snippetLength);
        requirePositive("readMaxLength", readMaxLength);
        requirePositive("contextSnippetLength", contextSnippetLength);
        requirePositive("maxSessions", maxSessions);
        requirePositive("contextMaxEntries", contextMaxEntries);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    public Duration searchTimeout() {
        return Duration.ofMillis(searchTimeoutMs);
    }

    public Duration findTimeout() {
        return Duration.ofMillis(findTimeoutMs);
    }

    public Duration addResourceTimeout() {
        return Duration.ofMillis(addResourceTimeoutMs);
    }

    public Duration browseTimeout() {
        return Duration.ofMillis(browseTimeoutMs);
    }

    public Duration contextTimeout() {
        return Duration.ofMillis(contextTimeoutMs);
    }

    /**
     * searchTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public KnowledgeServiceConfig withSearchTimeoutMs(long searchTimeoutMs) {
        return new KnowledgeServiceConfig(searchTimeoutMs, findTimeoutMs, addResourceTimeoutMs, browseTimeoutMs,
            contextTimeoutMs, snippetLength, readMaxLength, contextSnippetLength, maxSessions, contextMaxEntries);
    }

    /**
     * findTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public KnowledgeServiceConfig withFindTimeoutMs(long findTimeoutMs) {
        return new KnowledgeServiceConfig(searchTimeoutMs, findTimeoutMs, addResourceTimeoutMs, browseTimeoutMs,
            contextTimeoutMs, snippetLength, readMaxLength, contextSnippetLength, maxSessions, contextMaxEntries);
    }

    /**
     * addResourceTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public KnowledgeServiceConfig withAddResourceTimeoutMs(long addResourceTimeoutMs) {
        return new KnowledgeServiceConfig(searchTimeoutMs, findTimeoutMs, addResourceTimeoutMs, browseTimeoutMs,
            contextTimeoutMs, snippetLength, readMaxLength, contextSnippetLength, maxSessions, contextMaxEntries);
    }

    /**
     * browseTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public KnowledgeServiceConfig withBrowseTimeoutMs(long browseTimeoutMs) {
        return new KnowledgeServiceConfig(searchTimeoutMs, findTimeoutMs, addResourceTimeoutMs, browseTimeoutMs,
            contextTimeoutMs, snippetLength, readMaxLength, contextSnippetLength, maxSessions, contextMaxEntries);
    }

    /**
     * contextTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public KnowledgeServiceConfig withContextTimeoutMs(long contextTimeoutMs) {
        return new KnowledgeServiceConfig(searchTimeoutMs, findTimeoutMs, addResourceTimeoutMs, browseTimeoutMs,
            contextTimeoutMs, snippetLength, readMaxLength, contextSnippetLength, maxSessions, contextMaxEntries);
    }

    /**
     * readMaxLength만 변경한 새 인스턴스 생성.
     */
    public KnowledgeServiceConfig withReadMaxLength(int readMaxLength) {
        return new KnowledgeServiceConfig(searchTimeoutMs, findTimeoutMs, addResourceTimeoutMs, browseTimeoutMs,
            contextTimeoutMs, snippetLength, readMaxLength, contextSnippetLength, maxSessions, contextMaxEntries);
    }

    /**
     * maxSessions만 변경한 새 인스턴스 생성.
     */
    public KnowledgeServiceConfig withMaxSessions(int maxSessions) {
        return new KnowledgeServiceConfig(searchTimeoutMs, findTimeoutMs, addResourceTimeoutMs, browseTimeoutMs,
            contextTimeoutMs, snippetLength, readMaxLength, contextSnippetLength, maxSessions, contextMaxEntries);
    }
}
