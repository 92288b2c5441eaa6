package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.adapter.inmemory.queue.LinkedDispatchQueue;
import com.ryuqq.bridge.core.call.DispatchItem;
import com.ryuqq.bridge.core.call.Operation;
import com.ryuqq.bridge.core.call.PendingCall;
import com.ryuqq.bridge.core.exception.BackendInitializationException;
import com.ryuqq.bridge.core.spi.KnowledgeBase;
import com.ryuqq.bridge.core.statemachine.WorkerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * WorkerLoop 생명주기 테스트.
 *
 * <p>큐에 PendingCall을 직접 넣어 Bridge의 준비 상태 검사 없이 워커 동작을 검증합니다.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WorkerLoopTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Mock
    private KnowledgeBase backend;

    @Test
    void 초기화_실패_시_INIT_FAILED_대기중_호출은_초기화_오류로_실패() throws Exception {
        // given
        LinkedDispatchQueue<DispatchItem> queue = new LinkedDispatchQueue<>();
        doThrow(new IOException("data dir missing")).when(backend).initialize();
        PendingCall<String> queued = PendingCall.of(Operation.of("read", kb -> kb.read("viking://a")));
        queue.enqueue(queued);
        WorkerLoop worker = new WorkerLoop(queue, () -> backend, new WorkerConfig());

        // when
        worker.start();
        boolean ready = worker.awaitReady(WAIT);

        // then
        assertThat(ready).isFalse();
        assertThat(worker.isReady()).isFalse();
        assertThatThrownBy(() -> queued.awaitable().get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .satisfies(e -> assertThat(e.getCause())
                .isInstanceOf(BackendInitializationException.class)
                .hasMessage("Knowledge base initialization failed: data dir missing"));
        assertThat(worker.getState()).isEqualTo(WorkerState.INIT_FAILED);
        verify(backend, never()).read("viking://a");

        worker.requestStop();
        assertThat(worker.awaitTermination(WAIT)).isTrue();
        assertThat(worker.getState()).isEqualTo(WorkerState.STOPPED);
        verify(backend).close();
    }

    @Test
    void 팩토리_예외도_초기화_실패로_처리() throws Exception {
        // given
        LinkedDispatchQueue<DispatchItem> queue = new LinkedDispatchQueue<>();
        WorkerLoop worker = new WorkerLoop(queue, () -> {
            throw new IllegalStateException("no backend");
        }, new WorkerConfig());

        // when
        worker.start();

        // then
        assertThat(worker.awaitReady(WAIT)).isFalse();
        assertThat(worker.getState()).isEqualTo(WorkerState.INIT_FAILED);
        worker.requestStop();
        assertThat(worker.awaitTermination(WAIT)).isTrue();
    }

    @Test
    void 빈_폴링_후에도_계속_대기() throws Exception {
        // given
        LinkedDispatchQueue<DispatchItem> queue = new LinkedDispatchQueue<>();
        when(backend.read("viking://a")).thenReturn("a");
        WorkerLoop worker = new WorkerLoop(queue, () -> backend, new WorkerConfig().withPollTimeoutMs(10));
        worker.start();
        assertThat(worker.awaitReady(WAIT)).isTrue();

        // when
        Thread.sleep(50);
        PendingCall<String> call = PendingCall.of(Operation.of("read", kb -> kb.read("viking://a")));
        queue.enqueue(call);

        // then
        assertThat(call.awaitable().get(5, TimeUnit.SECONDS)).isEqualTo("a");
        assertThat(worker.getState()).isIn(WorkerState.READY, WorkerState.RUNNING);
        worker.requestStop();
        assertThat(worker.awaitTermination(WAIT)).isTrue();
    }

    @Test
    void 실행_중_상태는_RUNNING() throws Exception {
        // given
        LinkedDispatchQueue<DispatchItem> queue = new LinkedDispatchQueue<>();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        WorkerLoop worker = new WorkerLoop(queue, () -> backend, new WorkerConfig());
        worker.start();
        assertThat(worker.awaitReady(WAIT)).isTrue();

        // when
        PendingCall<String> call = PendingCall.of(Operation.of("block", kb -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "done";
        }));
        queue.enqueue(call);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(worker.getState()).isEqualTo(WorkerState.RUNNING);
        release.countDown();
        assertThat(call.awaitable().get(5, TimeUnit.SECONDS)).isEqualTo("done");
        worker.requestStop();
        assertThat(worker.awaitTermination(WAIT)).isTrue();
    }

    @Test
    void Sentinel_이후_항목은_실행되지_않음() throws Exception {
        // given
        LinkedDispatchQueue<DispatchItem> queue = new LinkedDispatchQueue<>();
        WorkerLoop worker = new WorkerLoop(queue, () -> backend, new WorkerConfig());
        worker.start();
        assertThat(worker.awaitReady(WAIT)).isTrue();
        worker.requestStop();
        assertThat(worker.awaitTermination(WAIT)).isTrue();

        // when
        PendingCall<String> late = PendingCall.of(Operation.of("read", kb -> kb.read("viking://a")));
        queue.enqueue(late);
        Thread.sleep(50);

        // then
        assertThat(late.isCompleted()).isFalse();
        verify(backend, never()).read("viking://a");
    }

    @Test
    void 생성자_null_인자_예외() {
        // when & then
        assertThatThrownBy(() -> new WorkerLoop(null, () -> backend, new WorkerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("queue cannot be null");
        assertThatThrownBy(() -> new WorkerLoop(new LinkedDispatchQueue<>(), null, new WorkerConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WorkerLoop(new LinkedDispatchQueue<>(), () -> backend, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
