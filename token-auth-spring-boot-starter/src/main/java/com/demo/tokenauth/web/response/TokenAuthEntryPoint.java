package com.demo.tokenauth.web.response;

import com.demo.tokenauth.exception.AuthErrorCodes;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.util.Objects;

/**
 * 未认证：返回 401。
 * <p>
 * 若 TokenAuthFilter 已在 request 上标记了失败原因，则响应体带上具体错误码与原因。
 */
public class TokenAuthEntryPoint implements AuthenticationEntryPoint {

    private final JsonResponseWriter writer;

    public TokenAuthEntryPoint(JsonResponseWriter writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        Object markedCode = request.getAttribute(AuthErrorCodes.REQ_ATTR_AUTH_ERROR_CODE);
        if (markedCode instanceof Integer code) {
            Object reason = request.getAttribute(AuthErrorCodes.REQ_ATTR_AUTH_ERROR_REASON);
            writer.unauthorized(request, response, code, reason == null ? "invalid_token" : reason.toString(), true);
            return;
        }
        writer.unauthorized(request, response, AuthErrorCodes.CODE_UNAUTHORIZED, "Unauthorized", false);
    }
}
