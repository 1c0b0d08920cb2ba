package com.demo.tokenauth.security;

import com.demo.tokenauth.token.TokenClaims;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.Objects;

/**
 * 校验通过的 token 对应的 Authentication。
 * <p>
 * principal 为序列化器转换出的资源（未配置序列化器时为 sub），authorities 为 token 的 scopes。
 */
public class TokenAuthentication extends AbstractAuthenticationToken {

    private final Object principal;
    private final TokenClaims claims;

    public TokenAuthentication(Object principal, TokenClaims claims) {
        super(Objects.requireNonNull(claims, "claims must not be null").scopes().stream()
                .filter(s -> !s.isBlank())
                .map(SimpleGrantedAuthority::new)
                .toList());
        this.principal = Objects.requireNonNull(principal, "principal must not be null");
        this.claims = claims;
        setAuthenticated(true);
    }

    @Override
    public Object getPrincipal() {
        return principal;
    }

    /**
     * 不保留原始 token 字符串。
     */
    @Override
    public Object getCredentials() {
        return null;
    }

    public TokenClaims getClaims() {
        return claims;
    }
}
