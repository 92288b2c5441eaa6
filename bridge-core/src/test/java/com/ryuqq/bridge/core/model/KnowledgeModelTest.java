package com.ryuqq.bridge.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Backend result record tests.
 *
 * @author Bridge Team
 * @since 1.0.0
 */
class KnowledgeModelTest {

    @Test
    void searchResult_NullLists_BecomeEmpty() {
        // When
        SearchResult result = new SearchResult(3, null, null);

        // Then
        assertTrue(result.memories().isEmpty());
        assertTrue(result.resources().isEmpty());
        assertTrue(result.isEmpty());
        assertEquals(3, result.total());
    }

    @Test
    void searchResult_ListsAreDefensivelyCopied() {
        // Given
        List<MemoryHit> memories = new ArrayList<>();
        memories.add(MemoryHit.of("likes java"));

        // When
        SearchResult result = new SearchResult(1, memories, List.of());
        memories.clear();

        // Then
        assertEquals(1, result.memories().size());
        assertThrows(UnsupportedOperationException.class, () -> result.memories().add(MemoryHit.of("x")));
    }

    @Test
    void searchResult_NegativeTotal_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new SearchResult(-1, List.of(), List.of())
        );
        assertTrue(exception.getMessage().contains("current: -1"));
    }

    @Test
    void resourceHit_ContentOrAbstract_PrefersContent() {
        assertEquals("body", new ResourceHit("viking://a", null, "abs", "body").contentOrAbstract());
        assertEquals("abs", new ResourceHit("viking://a", null, "abs", "").contentOrAbstract());
        assertEquals("", new ResourceHit("viking://a", null, null, null).contentOrAbstract());
    }

    @Test
    void resourceHit_TitleOrUri_FallsBackToUri() {
        assertEquals("Guide", new ResourceHit("viking://a", "Guide", null, null).titleOrUri());
        assertEquals("viking://a", ResourceHit.of("viking://a", "x").titleOrUri());
    }

    @Test
    void addResourceResult_Errors_AreReported() {
        // When
        AddResourceResult ok = AddResourceResult.success("success", "viking://resources/a.md");
        AddResourceResult failed = new AddResourceResult("error", List.of("bad format"), null);

        // Then
        assertFalse(ok.hasErrors());
        assertTrue(failed.hasErrors());
    }

    @Test
    void directoryEntry_NegativeSize_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new DirectoryEntry("a.md", false, -5));
    }

    @Test
    void sessionInfo_BlankId_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> SessionInfo.of(" "));
    }
}
