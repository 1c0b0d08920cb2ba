package com.demo.tokenauth.filter;

/**
 * 从 Authorization Header 提取 token。
 * - 兼容大小写：bearer/Bearer
 * - 兼容多空格：Bearer    xxx
 */
public final class BearerTokenExtractor {

    private static final String PREFIX = "Bearer";

    private BearerTokenExtractor() {
    }

    /**
     * @return token；header 缺失或不是 Bearer 时返回 null
     */
    public static String extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) return null;

        String h = authorizationHeader.trim();
        if (!h.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return null;
        }

        String rest = h.substring(PREFIX.length());
        if (!rest.isEmpty() && !Character.isWhitespace(rest.charAt(0)) && rest.charAt(0) != ':') {
            // "BearerX..." 不是 Bearer 方案
            return null;
        }
        rest = rest.trim();
        if (rest.startsWith(":")) { // 极少数网关会写成 Bearer:xxx
            rest = rest.substring(1).trim();
        }
        return rest.isEmpty() ? null : rest;
    }
}
