package com.demo.tokenauth.token;

/**
 * 签发选项。
 *
 * @param time 基准时间（秒）；null 表示取当前时钟
 * @param ttl  有效期；null 表示使用默认有效期
 */
public record TokenOptions(Long time, Ttl ttl) {

    private static final TokenOptions DEFAULTS = new TokenOptions(null, null);

    public static TokenOptions defaults() {
        return DEFAULTS;
    }

    public static TokenOptions atTime(long time) {
        return new TokenOptions(time, null);
    }

    public static TokenOptions withTtl(Ttl ttl) {
        return new TokenOptions(null, ttl);
    }

    public TokenOptions time(long time) {
        return new TokenOptions(time, ttl);
    }

    public TokenOptions ttl(Ttl ttl) {
        return new TokenOptions(time, ttl);
    }

    public TokenOptions ttlSeconds(long seconds) {
        return new TokenOptions(time, Ttl.ofSeconds(seconds));
    }
}
