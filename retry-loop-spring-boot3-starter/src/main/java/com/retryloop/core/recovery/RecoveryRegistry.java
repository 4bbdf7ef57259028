package com.retryloop.core.recovery;

import com.retryloop.model.RecoveryDescriptor;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 按作用域登记恢复处理器, 保留登记顺序
 */
public class RecoveryRegistry {

    private final Map<String, List<RecoveryDescriptor>> scopes = new ConcurrentHashMap<>(16);

    /**
     * 追加到作用域末尾
     */
    public RecoveryRegistry register(String scope, RecoveryDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        scopes.computeIfAbsent(scope, k -> new CopyOnWriteArrayList<>()).add(descriptor);
        return this;
    }

    public RecoveryRegistry registerAll(String scope, List<RecoveryDescriptor> descriptors) {
        descriptors.forEach(d -> register(scope, d));
        return this;
    }

    /**
     * @return 按登记顺序的不可变副本, 作用域不存在时为空
     */
    public List<RecoveryDescriptor> get(String scope) {
        List<RecoveryDescriptor> list = scopes.get(scope);
        return list == null ? List.of() : List.copyOf(list);
    }

    public void clear(String scope) {
        scopes.remove(scope);
    }

    /** 列出已登记作用域 */
    public Set<String> scopes() { return Collections.unmodifiableSet(scopes.keySet()); }
}
