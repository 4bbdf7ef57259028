package com.retryloop.core.recovery;

import com.retryloop.core.spi.RecoveryResolver;
import com.retryloop.model.OperationSignature;
import com.retryloop.model.RecoveryDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ClassUtils;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 按 标签 -> 结果类型 -> 参数形态 依次过滤, 取给定顺序中的第一个
 * 不做特异性打分
 */
@Slf4j
public class DefaultRecoveryResolver implements RecoveryResolver {

    @Override
    public Optional<RecoveryDescriptor> resolve(String label, OperationSignature signature,
                                                List<RecoveryDescriptor> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        for (RecoveryDescriptor d : candidates) {
            if (!labelMatches(label, d)) {
                continue;
            }
            if (!resultCompatible(signature, d)) {
                continue;
            }
            if (!parametersCompatible(signature, d)) {
                continue;
            }
            log.trace("[Recovery] resolved {} for label={}, signature={}", d, label, signature);
            return Optional.of(d);
        }
        log.trace("[Recovery] no recovery for label={}, signature={}", label, signature);
        return Optional.empty();
    }

    /**
     * 无标签只匹配无标签, 有标签必须完全相等
     */
    static boolean labelMatches(String label, RecoveryDescriptor d) {
        return Objects.equals(label, d.getLabel());
    }

    /**
     * 处理器结果类型可赋值给原操作结果类型（含基本类型装箱）
     */
    static boolean resultCompatible(OperationSignature signature, RecoveryDescriptor d) {
        return ClassUtils.isAssignable(signature.getResultType(), d.getResultType());
    }

    /**
     * 首参接受原操作可能抛出的异常, 其余参数按位置兼容原操作参数（允许只取前缀）
     */
    static boolean parametersCompatible(OperationSignature signature, RecoveryDescriptor d) {
        if (!d.getAcceptedFailureType().isAssignableFrom(signature.getFailureType())) {
            return false;
        }
        List<Class<?>> expected = d.getParameterTypes();
        List<Class<?>> actual = signature.getParameterTypes();
        if (expected.size() > actual.size()) {
            return false;
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!ClassUtils.isAssignable(expected.get(i), actual.get(i))) {
                return false;
            }
        }
        return true;
    }
}
