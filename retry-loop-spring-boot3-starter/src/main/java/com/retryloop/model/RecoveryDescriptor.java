package com.retryloop.model;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 恢复处理器描述
 * 调用形态为 (lastFailure, ...originalArguments)
 */
@Getter
public final class RecoveryDescriptor {

    /** 标签, null 只匹配未声明标签的操作 */
    private final String label;

    /** 第一个参数接受的异常类型 */
    private final Class<? extends Throwable> acceptedFailureType;

    private final Class<?> resultType;

    /** 异常之后的参数类型, 与原操作参数按位置对应 */
    private final List<Class<?>> parameterTypes;

    private final RecoveryFunction function;

    private RecoveryDescriptor(Builder b) {
        this.label = b.label;
        this.acceptedFailureType = Objects.requireNonNull(b.acceptedFailureType, "acceptedFailureType");
        this.resultType = Objects.requireNonNull(b.resultType, "resultType");
        this.parameterTypes = List.copyOf(b.parameterTypes);
        this.function = Objects.requireNonNull(b.function, "function");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RecoveryDescriptor{label=" + label + ", accepts=" + acceptedFailureType.getSimpleName()
                + ", result=" + resultType.getSimpleName() + ", params=" + parameterTypes + "}";
    }

    /**
     * 恢复函数
     */
    @FunctionalInterface
    public interface RecoveryFunction {
        Object apply(Throwable failure, Object[] args) throws Exception;
    }

    public static final class Builder {
        private String label;
        private Class<? extends Throwable> acceptedFailureType = Exception.class;
        private Class<?> resultType;
        private List<Class<?>> parameterTypes = List.of();
        private RecoveryFunction function;

        public Builder label(String label) { this.label = label; return this; }
        public Builder accepts(Class<? extends Throwable> type) { this.acceptedFailureType = type; return this; }
        public Builder returns(Class<?> type) { this.resultType = type; return this; }
        public Builder parameters(Class<?>... types) { this.parameterTypes = List.of(types); return this; }
        public Builder function(RecoveryFunction f) { this.function = f; return this; }

        public RecoveryDescriptor build() {
            return new RecoveryDescriptor(this);
        }
    }
}
