package com.assignmenttracker.backend.global.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.assignmenttracker.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Writes 401 problem bodies with a bearer challenge. A request without credentials gets a bare
 * {@code Bearer} challenge; a request whose token failed verification gets {@code error="invalid_token"}.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String MISSING_CREDENTIALS_CODE = "unauthorized";
    static final String BEARER_CHALLENGE = "Bearer";
    static final String INVALID_TOKEN_CHALLENGE = "Bearer error=\"invalid_token\"";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        write(response, BEARER_CHALLENGE,
                ProblemResponse.of(HttpStatus.UNAUTHORIZED, MISSING_CREDENTIALS_CODE,
                        authException.getMessage(), request.getRequestURI()));
    }

    void rejectToken(HttpServletRequest request, HttpServletResponse response, String code, String detail)
            throws IOException {
        write(response, INVALID_TOKEN_CHALLENGE,
                ProblemResponse.of(HttpStatus.UNAUTHORIZED, code, detail, request.getRequestURI()));
    }

    private void write(HttpServletResponse response, String challenge, ProblemResponse body)
            throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(body.status());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, challenge);
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
