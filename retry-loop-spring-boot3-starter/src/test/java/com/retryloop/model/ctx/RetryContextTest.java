package com.retryloop.model.ctx;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryContext 单元测试")
class RetryContextTest {

    @Test
    @DisplayName("场景: 初始状态无失败")
    void testInitialState() {
        RetryContext ctx = RetryContext.named("order.pay");

        assertEquals(0, ctx.getAttemptCount());
        assertNull(ctx.getLastFailure());
        assertEquals("order.pay", ctx.getName());
        assertNull(new RetryContext().getName());
    }

    @Test
    @DisplayName("场景: 每登记一次失败计数 +1 并记录最近失败")
    void testRegisterFailure() {
        RetryContext ctx = new RetryContext();
        IOException first = new IOException("first");
        IllegalStateException second = new IllegalStateException("second");

        ctx.registerFailure(first);
        assertEquals(1, ctx.getAttemptCount());
        assertSame(first, ctx.getLastFailure());

        ctx.registerFailure(second);
        assertEquals(2, ctx.getAttemptCount());
        assertSame(second, ctx.getLastFailure());
    }

    @Test
    @DisplayName("场景: 自定义属性读写")
    void testAttributes() {
        RetryContext ctx = new RetryContext();

        assertFalse(ctx.hasAttribute("traceId"));
        ctx.setAttribute("traceId", "abc");

        assertTrue(ctx.hasAttribute("traceId"));
        assertEquals("abc", ctx.getAttribute("traceId"));
        assertNull(ctx.getAttribute("missing"));
    }
}
