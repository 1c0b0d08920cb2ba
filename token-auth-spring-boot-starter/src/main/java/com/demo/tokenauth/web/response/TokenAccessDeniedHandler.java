package com.demo.tokenauth.web.response;

import com.demo.tokenauth.exception.AuthErrorCodes;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;

import java.io.IOException;
import java.util.Objects;

/**
 * 已认证但 scope 不足：返回 403。
 */
public class TokenAccessDeniedHandler implements AccessDeniedHandler {

    private final JsonResponseWriter writer;

    public TokenAccessDeniedHandler(JsonResponseWriter writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    @Override
    public void handle(HttpServletRequest request,
                       HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        writer.forbidden(request, response, AuthErrorCodes.CODE_FORBIDDEN, "Forbidden");
    }
}
