package com.demo.tokenauth.spi;

import java.util.List;

/**
 * 默认的当前用户表示：id 对应 sub，scopes 对应 token 的 scopes。
 */
public record AuthUser(String id, List<String> scopes) {

    public AuthUser {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public static AuthUser of(long id, String... scopes) {
        return new AuthUser(String.valueOf(id), List.of(scopes));
    }
}
