package com.retryloop.model;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 被重试操作的声明形态: 结果类型、参数类型、可能抛出的异常类型
 * 用于筛选恢复处理器
 */
@Getter
public final class OperationSignature {

    private final Class<?> resultType;

    private final List<Class<?>> parameterTypes;

    private final Class<? extends Throwable> failureType;

    private OperationSignature(Class<?> resultType, List<Class<?>> parameterTypes,
                               Class<? extends Throwable> failureType) {
        this.resultType = Objects.requireNonNull(resultType, "resultType");
        this.parameterTypes = List.copyOf(parameterTypes);
        this.failureType = Objects.requireNonNull(failureType, "failureType");
    }

    public static OperationSignature of(Class<?> resultType, Class<?>... parameterTypes) {
        return new OperationSignature(resultType, List.of(parameterTypes), Exception.class);
    }

    public OperationSignature failingWith(Class<? extends Throwable> failureType) {
        return new OperationSignature(resultType, parameterTypes, failureType);
    }

    @Override
    public String toString() {
        return resultType.getSimpleName() + parameterTypes.stream()
                .map(Class::getSimpleName).toList() + " throws " + failureType.getSimpleName();
    }
}
