package com.retryloop.core.recovery;

import com.retryloop.core.spi.RecoveryCallback;
import com.retryloop.model.RecoveryDescriptor;
import com.retryloop.model.ctx.RetryContext;
import org.springframework.util.ClassUtils;

import java.util.Arrays;

/**
 * 把选中的恢复处理器适配为 RecoveryCallback
 * 以 (lastFailure, 原参数前缀) 调用, 参数个数与处理器声明一致
 */
public class DescriptorRecoveryCallback<T> implements RecoveryCallback<T> {

    private final RecoveryDescriptor descriptor;

    private final Class<?> resultType;

    private final Object[] args;

    public DescriptorRecoveryCallback(RecoveryDescriptor descriptor, Class<?> resultType, Object[] args) {
        this.descriptor = descriptor;
        // 基本类型的结果由装箱对象承载
        this.resultType = ClassUtils.resolvePrimitiveIfNecessary(resultType);
        if (args.length < descriptor.getParameterTypes().size()) {
            throw new IllegalArgumentException("recovery expects " + descriptor.getParameterTypes().size()
                    + " arguments but " + args.length + " were given");
        }
        this.args = Arrays.copyOf(args, descriptor.getParameterTypes().size());
    }

    /**
     * 实际失败必须是处理器声明接受的类型
     */
    @Override
    public boolean canRecover(RetryContext context) {
        return descriptor.getAcceptedFailureType().isInstance(context.getLastFailure());
    }

    @Override
    @SuppressWarnings("unchecked")
    public T recover(RetryContext context) throws Exception {
        Object result = descriptor.getFunction().apply(context.getLastFailure(), args.clone());
        return (T) resultType.cast(result);
    }

    public RecoveryDescriptor getDescriptor() {
        return descriptor;
    }
}
