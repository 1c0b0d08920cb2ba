package com.demo.tokenauth.token;

/**
 * Token 有效期（秒）。
 * <p>
 * 约定：
 * - {@link #infinite()}：永不过期，token 不写入 exp
 * - 允许负数：签出即过期的 token（用于测试过期逻辑）
 */
public final class Ttl {

    private static final Ttl INFINITE = new Ttl(0, true);

    private final long seconds;
    private final boolean infinite;

    private Ttl(long seconds, boolean infinite) {
        this.seconds = seconds;
        this.infinite = infinite;
    }

    public static Ttl ofSeconds(long seconds) {
        return new Ttl(seconds, false);
    }

    public static Ttl infinite() {
        return INFINITE;
    }

    public boolean isInfinite() {
        return infinite;
    }

    /**
     * 有效期秒数；infinite 时无意义。
     */
    public long getSeconds() {
        if (infinite) {
            throw new IllegalStateException("infinite ttl has no seconds");
        }
        return seconds;
    }

    /**
     * 计算 exp；infinite 返回 null。
     */
    public Long expiresAt(long issuedAt) {
        return infinite ? null : issuedAt + seconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ttl other)) return false;
        return seconds == other.seconds && infinite == other.infinite;
    }

    @Override
    public int hashCode() {
        return infinite ? -1 : Long.hashCode(seconds);
    }

    @Override
    public String toString() {
        return infinite ? "Ttl[infinite]" : "Ttl[" + seconds + "s]";
    }
}
