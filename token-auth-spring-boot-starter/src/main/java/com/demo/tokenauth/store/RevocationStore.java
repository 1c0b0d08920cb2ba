package com.demo.tokenauth.store;

/**
 * 吊销名单存储，弥补 JWT 天然无状态的不足。
 * <p>
 * 同一接口服务两类名单：
 * <ul>
 *   <li>blacklist：按 jti 吊销单个 token</li>
 *   <li>banlist：按 sub 吊销某主体的全部 token</li>
 * </ul>
 * <p>
 * 实现方自行保证线程安全；调用方不会在检查前后加锁，
 * 因此“检查通过后立即被拉黑”的窗口是允许的。
 * <p>
 * 任何存储故障都必须抛出 {@link RevocationStoreException}，不得当作“不存在”返回。
 */
public interface RevocationStore {

    /**
     * key 是否在名单中。
     */
    boolean exists(String key);

    /**
     * 将 key 加入名单（幂等）。
     */
    void insert(String key);

    /**
     * 将 key 移出名单（幂等）。
     */
    void delete(String key);
}
