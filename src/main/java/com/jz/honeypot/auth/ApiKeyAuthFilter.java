package com.jz.honeypot.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.honeypot.config.AuthProperties;
import com.jz.honeypot.domain.dto.HoneypotReplyDTO;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * {@code /message} 的共享密钥校验。
 * 在所有 Controller 之前执行，被拒绝的请求不会进入会话存储。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyAuthFilter extends OncePerRequestFilter {

    static final String PROTECTED_PATH = "/message";

    private final AuthProperties props;
    private final ObjectMapper mapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        String path = req.getRequestURI().substring(req.getContextPath().length());
        return !PROTECTED_PATH.equals(path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse resp, FilterChain chain)
            throws ServletException, IOException {
        String presented = req.getHeader(props.getHeader());
        if (!matches(presented, props.getApiKey())) {
            log.info("Rejected request without valid {} from {}", props.getHeader(), req.getRemoteAddr());
            resp.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            resp.setContentType(MediaType.APPLICATION_JSON_VALUE);
            resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
            mapper.writeValue(resp.getOutputStream(), HoneypotReplyDTO.error("Unauthorized"));
            return;
        }
        chain.doFilter(req, resp);
    }

    private static boolean matches(String presented, String expected) {
        if (presented == null || expected == null) return false;
        return MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }
}
