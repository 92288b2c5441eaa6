package com.ryuqq.bridge.core.model;

import java.util.UUID;

/**
 * PendingCall의 고유 식별자.
 *
 * <p>CallId는 Bridge에 제출된 모든 호출을 로그와 진단 정보에서 추적하는 데 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class CallId {

    private final String value;

    private CallId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CallId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("CallId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("CallId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * CallId 생성.
     *
     * @param value CallId 값
     * @return CallId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CallId of(String value) {
        return new CallId(value);
    }

    /**
     * UUID 기반 CallId 생성.
     *
     * @return 새 CallId
     */
    public static CallId random() {
        return new CallId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallId callId = (CallId) o;
        return value.equals(callId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CallId{" + value + '}';
    }
}
