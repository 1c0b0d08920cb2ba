package com.demo.tokenauth.permission;

import java.util.Collection;
import java.util.Optional;

/**
 * 默认权限判定
 * <p>
 * 约定：scope 以字符串 "资源/动作" 表示（如 "admin/read"），动作由 HTTP 方法推导（见 {@link ScopeAction}）。
 * <p>
 * 规则：对每个 permit 构造 permit/action，token scopes 中命中任意一个即放行（OR）；
 * 按 permits 顺序返回第一个命中的 scope。精确匹配，区分大小写。
 */
public class DefaultPermissionChecker implements PermissionChecker {

    @Override
    public Optional<String> authorize(String method, Collection<String> permits, Collection<String> scopes) {
        // 未映射的方法直接拒绝
        Optional<ScopeAction> action = ScopeAction.fromMethod(method);
        if (action.isEmpty()) return Optional.empty();
        if (permits == null || permits.isEmpty()) return Optional.empty();
        if (scopes == null || scopes.isEmpty()) return Optional.empty();

        for (String permit : permits) {
            if (permit == null) continue;
            String candidate = action.get().scopeFor(permit);
            if (scopes.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
