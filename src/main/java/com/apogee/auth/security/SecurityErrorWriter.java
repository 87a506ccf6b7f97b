package com.apogee.auth.security;

import com.apogee.auth.dto.response.ApiResponse;
import com.apogee.auth.enums.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes security failures in the same envelope the controllers use.
 * Also serves as the entry point for unauthenticated calls to protected endpoints.
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         org.springframework.security.core.AuthenticationException authException) throws IOException {
        write(response, ErrorKind.MISSING_CREDENTIAL, "Authentication is required");
    }

    public void write(HttpServletResponse response, ErrorKind kind, String message) throws IOException {
        response.setStatus(kind.getHttpStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        String text = kind.requiresSignInRestart() ? message + ". Please sign in again." : message;
        objectMapper.writeValue(response.getOutputStream(), ApiResponse.error(text, kind.name()));
    }
}
