package com.demo.tokenauth.spi;

import com.demo.tokenauth.token.TokenClaims;
import com.demo.tokenauth.token.TokenFactory;
import com.demo.tokenauth.token.TokenOptions;
import com.demo.tokenauth.token.TokenRequest;

/**
 * 默认序列化：{@link AuthUser}(id, scopes) &lt;-&gt; sub + scopes。
 */
public class BasicTokenSerializer implements TokenSerializer<AuthUser> {

    @Override
    public TokenClaims toClaims(AuthUser user, TokenFactory tokens, TokenOptions options) {
        if (user == null) {
            throw new TokenSerializationException("user must not be null");
        }
        if (user.id() == null || user.id().isBlank()) {
            throw new TokenSerializationException("user has no id");
        }
        TokenRequest request = TokenRequest.builder()
                .subject(user.id())
                .scopes(user.scopes())
                .build();
        return tokens.create(request, options);
    }

    @Override
    public AuthUser fromClaims(TokenClaims claims) {
        if (claims == null || claims.subject() == null || claims.subject().isBlank()) {
            throw new TokenSerializationException("token has no subject");
        }
        return new AuthUser(claims.subject(), claims.scopes());
    }
}
