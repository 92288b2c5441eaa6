package com.ryuqq.bridge.application.knowledge;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ContextAugmenter 테스트.
 *
 * @author Bridge Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ContextAugmenterTest {

    @Mock
    private KnowledgeService knowledgeService;

    @Test
    void 컨텍스트가_있으면_메시지_앞에_추가() {
        // given
        when(knowledgeService.isReady()).thenReturn(true);
        when(knowledgeService.retrieveContext("How do I deploy?", 3))
            .thenReturn(CompletableFuture.completedFuture("[memory] uses k8s"));
        ContextAugmenter augmenter = new ContextAugmenter(knowledgeService);

        // when
        String result = augmenter.augment("How do I deploy?").join();

        // then
        assertThat(result).isEqualTo(
            "[The following context was retrieved from the knowledge base for reference]\n"
                + "[memory] uses k8s\n"
                + "[End of context]\n\n"
                + "How do I deploy?");
    }

    @Test
    void 준비_안됨이면_원본_메시지() {
        // given
        when(knowledgeService.isReady()).thenReturn(false);
        ContextAugmenter augmenter = new ContextAugmenter(knowledgeService);

        // when
        String result = augmenter.augment("hello").join();

        // then
        assertThat(result).isEqualTo("hello");
        verify(knowledgeService, never()).retrieveContext(anyString(), anyInt());
    }

    @Test
    void 빈_컨텍스트면_원본_메시지() {
        // given
        when(knowledgeService.isReady()).thenReturn(true);
        when(knowledgeService.retrieveContext("hello", 3)).thenReturn(CompletableFuture.completedFuture(""));

        // when & then
        assertThat(new ContextAugmenter(knowledgeService).augment("hello").join()).isEqualTo("hello");
    }

    @Test
    void 조회_실패면_원본_메시지() {
        // given
        when(knowledgeService.isReady()).thenReturn(true);
        when(knowledgeService.retrieveContext("hello", 5))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        // when & then
        assertThat(new ContextAugmenter(knowledgeService).augment("hello", 5).join()).isEqualTo("hello");
    }
}
