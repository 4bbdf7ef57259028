package com.retryloop.core.engine;

import com.retryloop.core.backoff.ExponentialBackoffPolicy;
import com.retryloop.core.backoff.FixedBackoffPolicy;
import com.retryloop.core.policy.SimpleRetryPolicy;
import com.retryloop.core.spi.RetryListener;
import com.retryloop.core.spi.RetryStatistics;
import com.retryloop.core.statistics.InMemoryRetryStatistics;
import com.retryloop.exception.RetryExhaustedException;
import com.retryloop.exception.RetryInterruptedException;
import com.retryloop.model.ctx.RetryContext;
import com.retryloop.testutil.Failures.NetworkError;
import com.retryloop.testutil.Failures.ValidationError;
import com.retryloop.testutil.RecordingListener;
import com.retryloop.testutil.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

/**
 * DefaultRetryExecutor 单元测试
 * 覆盖成功、耗尽、恢复、不可重试短路以及监听器顺序
 */
@DisplayName("DefaultRetryExecutor 单元测试")
class DefaultRetryExecutorTest {

    private RetryStatistics statistics;
    private RecordingListener recorder;
    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        statistics = new InMemoryRetryStatistics();
        recorder = new RecordingListener();
        sleeper = new RecordingSleeper();
    }

    private DefaultRetryExecutor executor(SimpleRetryPolicy policy) {
        return DefaultRetryExecutor.builder()
                .retryPolicy(policy)
                .backoffPolicy(new ExponentialBackoffPolicy(Duration.ofMillis(100), 2.0, Duration.ofSeconds(1), false))
                .listener(recorder)
                .statistics(statistics)
                .sleeper(sleeper)
                .build();
    }

    @ParameterizedTest(name = "maxAttempts={0}")
    @ValueSource(ints = {1, 2, 3, 5})
    @DisplayName("场景: 前 n-1 次失败第 n 次成功")
    void testEventualSuccess(int n) throws Exception {
        // Given: 前 n-1 次抛出可重试异常
        AtomicInteger calls = new AtomicInteger();
        RetryContext ctx = new RetryContext("eventual");

        // When
        String result = executor(new SimpleRetryPolicy(n)).execute(c -> {
            if (calls.incrementAndGet() < n) {
                throw new NetworkError("attempt " + calls.get());
            }
            return "ok";
        }, null, ctx);

        // Then
        assertEquals("ok", result);
        assertEquals(n, calls.get());
        assertEquals(n - 1, ctx.getAttemptCount());
        assertEquals(1, statistics.getStartedCount());
        assertEquals(1, statistics.getSuccessCount());
        assertEquals(0, statistics.getExhaustedCount());
        assertNull(recorder.closeFailure());
        assertEquals(n - 1, sleeper.sleeps().size());
    }

    @Test
    @DisplayName("场景: 始终失败且无恢复, 恰好 3 次尝试后抛出耗尽异常")
    void testExhaustionWithoutRecovery() {
        AtomicInteger calls = new AtomicInteger();
        RetryContext ctx = new RetryContext("always-fail");
        NetworkError[] last = new NetworkError[1];

        RetryExhaustedException ex = assertThrows(RetryExhaustedException.class, () ->
                executor(new SimpleRetryPolicy(3)).execute(c -> {
                    last[0] = new NetworkError("down " + calls.incrementAndGet());
                    throw last[0];
                }, null, ctx));

        assertEquals(3, calls.get());
        assertEquals(3, ex.getAttempts());
        assertSame(last[0], ex.getLastFailure());
        assertSame(ctx, ex.getContext());
        assertEquals("always-fail", ex.getOperationName());
        assertEquals(1, statistics.getExhaustedCount());
        assertEquals(0, statistics.getRecoveredCount());
        assertEquals(0, statistics.getSuccessCount());
        assertSame(last[0], recorder.closeFailure());
    }

    @Test
    @DisplayName("场景: 耗尽后执行恢复, 返回恢复结果")
    void testExhaustionWithRecovery() throws Exception {
        AtomicInteger recoveries = new AtomicInteger();
        RetryContext ctx = new RetryContext();

        String result = executor(new SimpleRetryPolicy(3)).execute(
                c -> { throw new NetworkError("down"); },
                c -> {
                    recoveries.incrementAndGet();
                    return "fallback after " + c.getAttemptCount() + ": " + c.getLastFailure().getMessage();
                },
                ctx);

        assertEquals("fallback after 3: down", result);
        assertEquals(1, recoveries.get());
        assertEquals(1, statistics.getExhaustedCount());
        assertEquals(1, statistics.getRecoveredCount());
        assertInstanceOf(NetworkError.class, recorder.closeFailure());
    }

    @Test
    @DisplayName("场景: 不可重试异常一次即结束")
    void testNonRetryableShortCircuit() {
        AtomicInteger calls = new AtomicInteger();
        SimpleRetryPolicy policy = new SimpleRetryPolicy(5, Set.of(NetworkError.class), Set.of());

        RetryExhaustedException ex = assertThrows(RetryExhaustedException.class, () ->
                executor(policy).execute(c -> {
                    calls.incrementAndGet();
                    throw new ValidationError("bad input");
                }, null, new RetryContext()));

        assertEquals(1, calls.get());
        assertEquals(1, ex.getAttempts());
        assertInstanceOf(ValidationError.class, ex.getLastFailure());
        assertEquals(1, statistics.getExhaustedCount());
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    @DisplayName("场景: 恢复自身失败时异常原样透传, onClose 仍触发一次")
    void testRecoveryFailurePropagatesUnwrapped() {
        IllegalStateException boom = new IllegalStateException("recovery broke");

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
                executor(new SimpleRetryPolicy(2)).execute(
                        c -> { throw new NetworkError("down"); },
                        c -> { throw boom; },
                        new RetryContext()));

        assertSame(boom, thrown);
        assertEquals(1, statistics.getRecoveredCount());
        assertEquals(List.of("open", "error", "retry", "error", "close"), recorder.events());
        assertSame(boom, recorder.closeFailure());
    }

    @Test
    @DisplayName("场景: 操作抛出 Error 时不重试, onClose 仍触发一次")
    void testErrorOutsideFailureChannel() {
        AtomicInteger calls = new AtomicInteger();
        AssertionError fatal = new AssertionError("fatal");

        AssertionError thrown = assertThrows(AssertionError.class, () ->
                executor(new SimpleRetryPolicy(5)).execute(c -> {
                    calls.incrementAndGet();
                    throw fatal;
                }, null, new RetryContext()));

        assertSame(fatal, thrown);
        assertEquals(1, calls.get());
        assertEquals(List.of("open", "close"), recorder.events());
        assertEquals(0, statistics.getExhaustedCount());
    }

    @Test
    @DisplayName("场景: 生命周期回调顺序 open -> (error, retry)* -> close")
    void testListenerOrdering() throws Exception {
        RetryListener listener = mock(RetryListener.class);
        AtomicInteger calls = new AtomicInteger();
        RetryContext ctx = new RetryContext();

        DefaultRetryExecutor executor = DefaultRetryExecutor.builder()
                .retryPolicy(new SimpleRetryPolicy(3))
                .listener(listener)
                .statistics(statistics)
                .sleeper(sleeper)
                .build();

        executor.execute(c -> {
            if (calls.incrementAndGet() < 3) {
                throw new NetworkError("down");
            }
            return 42;
        }, null, ctx);

        InOrder inOrder = inOrder(listener);
        inOrder.verify(listener).onOpen(ctx);
        inOrder.verify(listener).onError(same(ctx), any(NetworkError.class));
        inOrder.verify(listener).onRetry(ctx);
        inOrder.verify(listener).onError(same(ctx), any(NetworkError.class));
        inOrder.verify(listener).onRetry(ctx);
        inOrder.verify(listener).onClose(same(ctx), isNull());
        inOrder.verifyNoMoreInteractions();
    }

    @Test
    @DisplayName("场景: 多个监听器按注册顺序通知, 异常的监听器不影响流程")
    void testFaultyListenerIsIsolated() throws Exception {
        RetryListener faulty = new RetryListener() {
            @Override
            public void onError(RetryContext context, Throwable failure) {
                throw new IllegalStateException("listener bug");
            }
        };
        AtomicInteger calls = new AtomicInteger();

        DefaultRetryExecutor executor = DefaultRetryExecutor.builder()
                .retryPolicy(new SimpleRetryPolicy(3))
                .listener(faulty)
                .listener(recorder)
                .statistics(statistics)
                .sleeper(sleeper)
                .build();

        String result = executor.execute(c -> {
            if (calls.incrementAndGet() == 1) {
                throw new NetworkError("down");
            }
            return "ok";
        }, null, new RetryContext());

        assertEquals("ok", result);
        assertEquals(List.of("open", "error", "retry", "close"), recorder.events());
    }

    @Test
    @DisplayName("场景: 首次尝试前不等待, 之后按退避策略等待")
    void testBackoffBetweenAttempts() {
        assertThrows(RetryExhaustedException.class, () ->
                executor(new SimpleRetryPolicy(4)).execute(c -> { throw new NetworkError("down"); },
                        null, new RetryContext()));

        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)),
                sleeper.sleeps());
    }

    @Test
    @DisplayName("场景: 零延迟不调用等待")
    void testZeroBackoffSkipsSleep() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        DefaultRetryExecutor executor = DefaultRetryExecutor.builder()
                .retryPolicy(new SimpleRetryPolicy(3))
                .backoffPolicy(new FixedBackoffPolicy(Duration.ZERO))
                .statistics(statistics)
                .sleeper(sleeper)
                .build();

        executor.execute(c -> {
            if (calls.incrementAndGet() < 3) {
                throw new NetworkError("down");
            }
            return "ok";
        }, null, new RetryContext());

        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    @DisplayName("场景: 退避等待被中断时以取消结束")
    void testInterruptedDuringBackoff() {
        DefaultRetryExecutor executor = DefaultRetryExecutor.builder()
                .retryPolicy(new SimpleRetryPolicy(3))
                .backoffPolicy(FixedBackoffPolicy.ofMillis(50))
                .listener(recorder)
                .statistics(statistics)
                .sleeper(d -> { throw new InterruptedException("cancel"); })
                .build();

        try {
            RetryInterruptedException ex = assertThrows(RetryInterruptedException.class, () ->
                    executor.execute(c -> { throw new NetworkError("down"); }, null, new RetryContext()));

            assertTrue(Thread.currentThread().isInterrupted());
            assertInstanceOf(InterruptedException.class, ex.getCause());
            assertEquals(1, ex.getContext().getAttemptCount());
            assertEquals(List.of("open", "error", "retry", "close"), recorder.events());
            assertEquals(0, statistics.getExhaustedCount());
        } finally {
            // 清除中断标记
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("场景: 共享执行器的并发执行各自独立")
    void testConcurrentExecutionsShareStatistics() throws Exception {
        DefaultRetryExecutor executor = DefaultRetryExecutor.builder()
                .retryPolicy(new SimpleRetryPolicy(2))
                .statistics(statistics)
                .sleeper(d -> { })
                .build();
        int threads = 16;
        Thread[] workers = new Thread[threads];
        AtomicInteger ok = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            workers[i] = new Thread(() -> {
                RetryContext ctx = new RetryContext();
                try {
                    executor.execute(c -> {
                        if (c.getAttemptCount() == 0) {
                            throw new NetworkError("first");
                        }
                        return "ok";
                    }, null, ctx);
                    if (ctx.getAttemptCount() == 1) {
                        ok.incrementAndGet();
                    }
                } catch (Exception e) {
                    fail(e);
                }
            });
            workers[i].start();
        }
        for (Thread w : workers) {
            w.join(10_000);
        }

        assertEquals(threads, ok.get());
        assertEquals(threads, statistics.getStartedCount());
        assertEquals(threads, statistics.getSuccessCount());
    }

    @Test
    @DisplayName("场景: 构建时必须提供 retryPolicy")
    void testRequiresPolicy() {
        assertThrows(NullPointerException.class, () -> DefaultRetryExecutor.builder().build());
    }
}
