package com.ryuqq.bridge.application.knowledge;

import com.ryuqq.bridge.core.model.AddResourceResult;
import com.ryuqq.bridge.core.model.DirectoryEntry;
import com.ryuqq.bridge.core.model.MemoryHit;
import com.ryuqq.bridge.core.model.ResourceHit;
import com.ryuqq.bridge.core.model.SearchResult;
import com.ryuqq.bridge.core.model.SessionInfo;
import com.ryuqq.bridge.core.spi.KnowledgeBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DefaultKnowledgeService 포맷팅 테스트.
 *
 * <p>작업을 호출 스레드에서 바로 실행하는 DirectBridge와 Mockito 백엔드를 사용합니다.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultKnowledgeServiceTest {

    @Mock
    private KnowledgeBase backend;

    private DefaultKnowledgeService service;

    @BeforeEach
    void setUp() {
        service = new DefaultKnowledgeService(new DirectBridge(backend));
    }

    @Test
    void search_결과_있음_메모리와_리소스_포맷() throws Exception {
        // given
        SearchResult result = new SearchResult(2,
            List.of(MemoryHit.of("user prefers Java")),
            List.of(new ResourceHit("viking://resources/guide.md", null, "Guide abstract", null)));
        when(backend.search("java", 5)).thenReturn(result);

        // when
        String text = service.search("java").join();

        // then
        assertThat(text).isEqualTo("Search 'java' found 2 results:\n\n"
            + "[memory] user prefers Java\n\n"
            + "[resource:viking://resources/guide.md] Guide abstract");
    }

    @Test
    void search_결과_없음() throws Exception {
        // given
        when(backend.search("rust", 5)).thenReturn(new SearchResult(0, null, null));

        // when
        String text = service.search("rust").join();

        // then
        assertThat(text).isEqualTo("Search 'rust' found no results (total=0)");
    }

    @Test
    void search_긴_내용은_300자로_자름() throws Exception {
        // given
        String longContent = "x".repeat(400);
        when(backend.search("q", 5)).thenReturn(new SearchResult(1, List.of(MemoryHit.of(longContent)), List.of()));

        // when
        String text = service.search("q").join();

        // then
        assertThat(text).endsWith("[memory] " + "x".repeat(300));
    }

    @Test
    void search_백엔드_오류는_실패_메시지() throws Exception {
        // given
        when(backend.search("q", 5)).thenThrow(new IllegalStateException("index corrupted"));

        // when
        String text = service.search("q").join();

        // then
        assertThat(text).isEqualTo("Search failed: index corrupted");
    }

    @Test
    void find_기본_limit_10_및_포맷() throws Exception {
        // given
        when(backend.find("deep", 10)).thenReturn(
            new SearchResult(1, List.of(), List.of(ResourceHit.of("viking://resources/a.md", "alpha"))));

        // when
        String text = service.find("deep").join();

        // then
        assertThat(text).isEqualTo("Deep search 'deep' found 1 results:\n\n[resource:viking://resources/a.md] alpha");
    }

    @Test
    void find_total_0이면_결과_없음() throws Exception {
        // given
        when(backend.find("none", 10)).thenReturn(SearchResult.empty());

        // when & then
        assertThat(service.find("none").join()).isEqualTo("Deep search 'none' found no results");
    }

    @Test
    void addResource_파일_없음_백엔드_호출_안함(@TempDir Path dir) throws Exception {
        // given
        String missing = dir.resolve("missing.md").toString();

        // when
        String text = service.addResource(missing).join();

        // then
        assertThat(text).isEqualTo("File not found: " + missing);
        verify(backend, never()).addResource(anyString(), anyBoolean(), any());
    }

    @Test
    void addResource_성공(@TempDir Path dir) throws Exception {
        // given
        Path file = Files.writeString(dir.resolve("notes.md"), "hello");
        when(backend.addResource(eq(file.toString()), eq(true), eq(Duration.ofSeconds(120))))
            .thenReturn(AddResourceResult.success("success", "viking://resources/notes.md"));

        // when
        String text = service.addResource(file.toString()).join();

        // then
        assertThat(text).isEqualTo("Resource added: viking://resources/notes.md (status=success)");
    }

    @Test
    void addResource_백엔드_오류_목록(@TempDir Path dir) throws Exception {
        // given
        Path file = Files.writeString(dir.resolve("bad.bin"), "\u0000");
        when(backend.addResource(eq(file.toString()), eq(true), any()))
            .thenReturn(new AddResourceResult("error", List.of("unsupported type", "empty text"), null));

        // when
        String text = service.addResource(file.toString()).join();

        // then
        assertThat(text).isEqualTo("Failed to add resource: unsupported type, empty text");
    }

    @Test
    void listDirectory_항목_표시() throws Exception {
        // given
        when(backend.listDirectory("viking://resources/")).thenReturn(List.of(
            new DirectoryEntry("docs", true, 0),
            new DirectoryEntry("a.md", false, 42)));

        // when
        String text = service.listDirectory().join();

        // then
        assertThat(text).isEqualTo("Directory viking://resources/:\n  [D] docs (0b)\n  [F] a.md (42b)");
    }

    @Test
    void listDirectory_비어있음() throws Exception {
        // given
        when(backend.listDirectory("viking://resources/empty/")).thenReturn(List.of());

        // when & then
        assertThat(service.listDirectory("viking://resources/empty/").join())
            .isEqualTo("Directory viking://resources/empty/ is empty");
    }

    @Test
    void read_2000자로_자름() throws Exception {
        // given
        when(backend.read("viking://resources/big.md")).thenReturn("y".repeat(2500));

        // when
        String text = service.read("viking://resources/big.md").join();

        // then
        assertThat(text).hasSize(2000);
    }

    @Test
    void read_실패_메시지() throws Exception {
        // given
        when(backend.read("viking://resources/nope")).thenThrow(new NoSuchElementException("no such resource"));

        // when & then
        assertThat(service.read("viking://resources/nope").join()).isEqualTo("Read failed: no such resource");
    }

    @Test
    void abstractOf_실패_메시지() throws Exception {
        // given
        when(backend.abstractOf("viking://x")).thenThrow(new NoSuchElementException("gone"));

        // when & then
        assertThat(service.abstractOf("viking://x").join()).isEqualTo("Abstract failed: gone");
    }

    @Test
    void listSessions_최대_20개() throws Exception {
        // given
        List<SessionInfo> sessions = IntStream.range(0, 25)
            .mapToObj(i -> SessionInfo.of("s-" + i))
            .collect(Collectors.toList());
        when(backend.listSessions()).thenReturn(sessions);

        // when
        String text = service.listSessions().join();

        // then
        assertThat(text).startsWith("Sessions:\n  - s-0");
        assertThat(text.lines().count()).isEqualTo(21);
        assertThat(text).doesNotContain("s-20");
    }

    @Test
    void listSessions_없음() throws Exception {
        // given
        when(backend.listSessions()).thenReturn(List.of());

        // when & then
        assertThat(service.listSessions().join()).isEqualTo("No sessions");
    }

    @Test
    void retrieveContext_메모리와_리소스_각각_최대_3개() throws Exception {
        // given
        List<MemoryHit> memories = List.of(MemoryHit.of("m1"), MemoryHit.of(""), MemoryHit.of("m3"), MemoryHit.of("m4"));
        List<ResourceHit> resources = List.of(
            new ResourceHit("viking://r1", "Title One", null, "z".repeat(600)),
            new ResourceHit("viking://r2", null, null, null),
            new ResourceHit("viking://r3", null, "abstract three", null),
            new ResourceHit("viking://r4", null, null, "r4"));
        when(backend.search("ctx", 3)).thenReturn(new SearchResult(8, memories, resources));

        // when
        String context = service.retrieveContext("ctx").join();

        // then
        assertThat(context).isEqualTo("[memory] m1\n\n[memory] m3\n\n"
            + "[knowledge:Title One] " + "z".repeat(500) + "\n\n"
            + "[knowledge:viking://r3] abstract three");
    }

    @Test
    void retrieveContext_오류는_빈_문자열() throws Exception {
        // given
        when(backend.search("ctx", 3)).thenThrow(new IllegalStateException("down"));

        // when & then
        assertThat(service.retrieveContext("ctx").join()).isEmpty();
    }
}
