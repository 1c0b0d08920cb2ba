package com.demo.tokenauth.permission;

import java.util.Collection;
import java.util.Optional;

/**
 * 授权判定。业务可替换实现以支持其他策略。
 */
public interface PermissionChecker {

    /**
     * 判断 token 的 scopes 是否满足当前请求。
     *
     * @param method  HTTP 方法
     * @param permits 接口声明接受的资源标签，如 ["user", "admin"]
     * @param scopes  token 中的 scopes
     * @return 命中的 scope（用于审计是哪个 permit 放行）；拒绝时为 empty
     */
    Optional<String> authorize(String method, Collection<String> permits, Collection<String> scopes);
}
