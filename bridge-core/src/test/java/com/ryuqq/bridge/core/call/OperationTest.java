package com.ryuqq.bridge.core.call;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Operation 테스트.
 *
 * @author Bridge Team
 * @since 1.0.0
 */
class OperationTest {

    @Test
    void of_KeepsArgumentOrder() {
        // When
        Operation<String> op = Operation.of("read", backend -> backend.read("viking://a"), "viking://a", 7);

        // Then
        assertEquals("read", op.name());
        assertEquals(List.of("viking://a", 7), op.args());
        assertEquals("read[viking://a, 7]", op.toString());
    }

    @Test
    void of_NullArgument_IsAllowed() {
        // When
        Operation<String> op = Operation.of("ls", backend -> "x", (Object) null);

        // Then
        assertEquals(1, op.args().size());
        assertNull(op.args().get(0));
    }

    @Test
    void of_BlankName_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Operation.of(" ", backend -> "x"));
    }

    @Test
    void of_NullFunction_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Operation.of("search", null)
        );
        assertTrue(exception.getMessage().contains("function cannot be null"));
    }

    @Test
    void args_AreImmutable() {
        // Given
        Operation<String> op = Operation.of("search", backend -> "x", "q");

        // When & Then
        assertThrows(UnsupportedOperationException.class, () -> op.args().add("more"));
    }
}
