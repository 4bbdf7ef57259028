package com.retryloop.core;

import com.retryloop.core.spi.RetryCallback;
import com.retryloop.core.spi.RetryStatistics;
import com.retryloop.model.OperationSignature;
import com.retryloop.model.RecoveryDescriptor;
import com.retryloop.model.RetryDefinition;

import java.util.List;

/**
 * 以显式的 RetryDefinition 执行操作
 */
public interface RetryOperations {

    /**
     * 无恢复处理器, 耗尽时抛出 RetryExhaustedException
     */
    <T> T execute(RetryDefinition definition, RetryCallback<T> callback) throws Exception;

    /**
     * 从候选列表中按顺序选出恢复处理器
     * @param signature  操作声明, 用于筛选恢复处理器
     * @param recoveries 候选, 顺序即优先级
     * @param args       原操作参数, 恢复时跟在异常之后传入
     */
    <T> T execute(RetryDefinition definition, OperationSignature signature, RetryCallback<T> callback,
                  List<RecoveryDescriptor> recoveries, Object... args) throws Exception;

    /**
     * 从 RecoveryRegistry 的作用域中选出恢复处理器
     */
    <T> T execute(RetryDefinition definition, OperationSignature signature, RetryCallback<T> callback,
                  String recoveryScope, Object... args) throws Exception;

    RetryStatistics getStatistics();
}
