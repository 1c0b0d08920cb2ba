package com.demo.tokenauth.permission;

import java.util.Optional;

/**
 * HTTP 方法对应的动作。映射表固定，不可配置：
 * <ul>
 *   <li>GET / HEAD -&gt; read</li>
 *   <li>PUT / PATCH / POST -&gt; write</li>
 *   <li>DELETE -&gt; delete</li>
 * </ul>
 * 其他方法没有对应动作，一律拒绝。
 */
public enum ScopeAction {

    READ("read"),
    WRITE("write"),
    DELETE("delete");

    private final String value;

    ScopeAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 方法名区分大小写（"get" 不会匹配）。
     */
    public static Optional<ScopeAction> fromMethod(String method) {
        if (method == null) return Optional.empty();
        return switch (method) {
            case "GET", "HEAD" -> Optional.of(READ);
            case "PUT", "PATCH", "POST" -> Optional.of(WRITE);
            case "DELETE" -> Optional.of(DELETE);
            default -> Optional.empty();
        };
    }

    /**
     * permit + "/" + action，如 "admin/read"。
     */
    public String scopeFor(String permit) {
        return permit + "/" + value;
    }
}
