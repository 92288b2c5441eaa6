package com.ryuqq.bridge.core.call;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 워커에서 실행될 작업 단위 (불변).
 *
 * <p>Operation은 백엔드 함수와 진단용 이름/인자를 묶습니다.
 * 인자는 함수에 이미 캡처되어 있으며, 로그에 남기기 위해서만 보관합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Operation&lt;SearchResult&gt; op = Operation.of("search",
 *     backend -&gt; backend.search("java", 5), "java", 5);
 * </pre>
 *
 * @param <T> 결과 타입
 * @param name 작업 이름 (진단용, null/blank 불가)
 * @param args 작업 인자 (순서 유지, 불변 사본)
 * @param function 백엔드 함수 (null 불가)
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record Operation<T>(
    String name,
    List<Object> args,
    BackendFunction<T> function
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null/blank이거나 function이 null인 경우
     */
    public Operation {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        // List.copyOf는 null 원소를 거부하므로 unmodifiableList 사용
        args = args == null ? List.of() : Collections.unmodifiableList(Arrays.asList(args.toArray()));
    }

    /**
     * Operation 생성.
     *
     * @param name 작업 이름
     * @param function 백엔드 함수
     * @param args 진단용 인자
     * @param <T> 결과 타입
     * @return Operation 인스턴스
     */
    public static <T> Operation<T> of(String name, BackendFunction<T> function, Object... args) {
        return new Operation<>(name, args == null ? List.of() : Arrays.asList(args), function);
    }

    @Override
    public String toString() {
        return name + args;
    }
}
