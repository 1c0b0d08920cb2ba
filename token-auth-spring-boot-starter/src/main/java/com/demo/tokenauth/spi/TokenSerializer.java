package com.demo.tokenauth.spi;

import com.demo.tokenauth.token.TokenClaims;
import com.demo.tokenauth.token.TokenFactory;
import com.demo.tokenauth.token.TokenOptions;

/**
 * 业务资源（如用户）与 token claims 之间的转换，由业务系统实现，Starter 只依赖此接口。
 * <p>
 * 两个方向都可以失败，失败时抛出 {@link TokenSerializationException}，原样传递给调用方。
 *
 * @param <R> 业务资源类型
 */
public interface TokenSerializer<R> {

    /**
     * 签发阶段：资源 -> claims。
     *
     * @param tokens  当前配置下的 TokenFactory，用它构造 claims 以套用默认 iss/aud/jti/ttl
     * @param options 调用方传入的签发选项
     */
    TokenClaims toClaims(R resource, TokenFactory tokens, TokenOptions options);

    /**
     * 鉴权阶段：已校验的 claims -> 资源。
     */
    R fromClaims(TokenClaims claims);
}
