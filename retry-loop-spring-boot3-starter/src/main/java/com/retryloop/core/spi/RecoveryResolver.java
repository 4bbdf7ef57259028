package com.retryloop.core.spi;

import com.retryloop.model.OperationSignature;
import com.retryloop.model.RecoveryDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * 恢复处理器选择
 */
public interface RecoveryResolver {

    /**
     * 按给定顺序选出第一个匹配的处理器
     * @param label      操作标签, 可为 null
     * @param signature  操作声明
     * @param candidates 候选处理器
     */
    Optional<RecoveryDescriptor> resolve(String label, OperationSignature signature,
                                         List<RecoveryDescriptor> candidates);
}
