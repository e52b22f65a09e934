package com.schoolerp.backend.global.security;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schoolerp.backend.global.error.ProblemResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * Renders failures raised inside the security filter chain, before any controller advice
 * runs, as the same problem JSON the rest of the API returns.
 */
@Component
public class SecurityProblemHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    static final String UNAUTHORIZED = "unauthorized";
    static final String FORBIDDEN = "forbidden";

    private static final Logger log = LoggerFactory.getLogger(SecurityProblemHandler.class);

    private final ObjectMapper objectMapper;

    public SecurityProblemHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        log.debug("Unauthenticated request to {}", request.getRequestURI());
        write(response, ProblemResponse.of(HttpStatus.UNAUTHORIZED, UNAUTHORIZED,
                "A valid bearer token is required", request.getRequestURI()));
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        log.debug("Access denied to {}", request.getRequestURI());
        write(response, ProblemResponse.of(HttpStatus.FORBIDDEN, FORBIDDEN,
                "This route needs the ADMIN role", request.getRequestURI()));
    }

    private void write(HttpServletResponse response, ProblemResponse problem) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(problem.status());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
