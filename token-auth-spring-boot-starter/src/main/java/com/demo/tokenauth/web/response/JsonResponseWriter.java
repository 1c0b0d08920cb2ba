package com.demo.tokenauth.web.response;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 写出 401 / 403 的 JSON 响应体（{@link ApiError}）。
 * <p>
 * 401 同时带上 Bearer 质询头；token 校验失败时 error="invalid_token"（RFC 6750）。
 */
public class JsonResponseWriter {

    private final ObjectMapper objectMapper;

    public JsonResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * @param invalidToken 请求携带了 token 但校验失败
     */
    public void unauthorized(HttpServletRequest request, HttpServletResponse response,
                             int code, String message, boolean invalidToken) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE,
                invalidToken ? "Bearer error=\"invalid_token\", error_description=\"" + message + "\"" : "Bearer");
        write(response, HttpServletResponse.SC_UNAUTHORIZED, new ApiError(code, message, request.getRequestURI()));
    }

    public void forbidden(HttpServletRequest request, HttpServletResponse response,
                          int code, String message) throws IOException {
        write(response, HttpServletResponse.SC_FORBIDDEN, new ApiError(code, message, request.getRequestURI()));
    }

    public void write(HttpServletResponse response, int httpStatus, ApiError body) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(httpStatus);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), body);
    }
}
