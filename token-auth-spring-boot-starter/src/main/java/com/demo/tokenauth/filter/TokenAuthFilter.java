package com.demo.tokenauth.filter;

import com.demo.tokenauth.TokenAuth;
import com.demo.tokenauth.exception.AuthErrorCodes;
import com.demo.tokenauth.security.TokenAuthentication;
import com.demo.tokenauth.security.VerificationFailure;
import com.demo.tokenauth.security.VerificationResult;
import com.demo.tokenauth.spi.TokenSerializationException;
import com.demo.tokenauth.token.TokenClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Objects;

/**
 * Token 鉴权过滤器
 * <p>
 * 功能：仅在请求携带 Bearer Token 时尝试认证并写入 SecurityContext。
 * <p>
 * 约定：Authorization: Bearer token；principal 由 TokenSerializer 从 claims 转换得到
 * （未配置序列化器时为 sub），authorities 为 token 的 scopes。
 * <p>
 * 策略：
 * - 未携带 token：不做任何标记，按匿名请求放行
 * - token 校验失败：在 request 上标记错误码与原因；rejectInvalid=true 时直接返回 401，否则按匿名放行
 */
public class TokenAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthFilter.class);

    private final TokenAuth tokenAuth;
    private final AuthenticationEntryPoint entryPoint;
    private final boolean rejectInvalid;

    public TokenAuthFilter(TokenAuth tokenAuth,
                           AuthenticationEntryPoint entryPoint,
                           boolean rejectInvalid) {
        this.tokenAuth = Objects.requireNonNull(tokenAuth, "tokenAuth must not be null");
        this.entryPoint = Objects.requireNonNull(entryPoint, "entryPoint must not be null");
        this.rejectInvalid = rejectInvalid;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        // 已认证则不重复解析
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            chain.doFilter(req, res);
            return;
        }

        // 1) 取 token
        String token = BearerTokenExtractor.extract(req.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            chain.doFilter(req, res);
            return;
        }

        // 2) 校验
        VerificationResult result = tokenAuth.verify(token);
        if (!result.isValid()) {
            VerificationFailure failure = result.getFailure();
            fail(req, res, chain, failure.code(), failure.reason());
            return;
        }
        TokenClaims claims = result.getClaims();

        // 3) 当前用户
        Object principal;
        try {
            principal = resolvePrincipal(claims);
        } catch (TokenSerializationException e) {
            log.debug("Token subject could not be resolved: {}", e.getMessage());
            fail(req, res, chain, AuthErrorCodes.CODE_USER_UNRESOLVED, "user_unresolved");
            return;
        }

        // 4) 放入 SecurityContext
        SecurityContextHolder.getContext().setAuthentication(new TokenAuthentication(principal, claims));
        req.setAttribute(AuthErrorCodes.REQ_ATTR_TOKEN, claims);

        chain.doFilter(req, res);
    }

    private Object resolvePrincipal(TokenClaims claims) {
        if (tokenAuth.getConfig().getSerializer().isEmpty()) {
            if (claims.subject() == null) {
                throw new TokenSerializationException("token has no subject");
            }
            return claims.subject();
        }
        Object principal = tokenAuth.fromClaims(claims);
        if (principal == null) {
            throw new TokenSerializationException("serializer returned no resource");
        }
        return principal;
    }

    private void fail(HttpServletRequest req, HttpServletResponse res, FilterChain chain, int code, String reason)
            throws ServletException, IOException {
        SecurityContextHolder.clearContext();
        req.setAttribute(AuthErrorCodes.REQ_ATTR_AUTH_ERROR_CODE, code);
        req.setAttribute(AuthErrorCodes.REQ_ATTR_AUTH_ERROR_REASON, reason);

        if (rejectInvalid) {
            entryPoint.commence(req, res, new InsufficientAuthenticationException(reason));
            return;
        }
        chain.doFilter(req, res);
    }
}
