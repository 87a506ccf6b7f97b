package com.apogee.auth.security;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.exception.AuthenticationException;
import com.apogee.auth.security.jwt.TokenClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

/**
 * Authenticates bearer access credentials. The principal is the account id.
 * Built by the security configuration so it runs only inside the security chain.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String REFRESH_SUGGESTED_HEADER = "X-Token-Refresh-Suggested";
    private static final String BEARER_PREFIX = "Bearer ";

    private final AccessTokenValidator accessTokenValidator;
    private final SecurityProperties securityProperties;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            // anonymous; protected endpoints are answered by the entry point
            chain.doFilter(request, response);
            return;
        }

        TokenClaims claims;
        try {
            claims = accessTokenValidator.validate(header.substring(BEARER_PREFIX.length()).trim());
        } catch (AuthenticationException e) {
            log.debug("Rejected access token on {}: {}", request.getRequestURI(), e.getMessage());
            SecurityContextHolder.clearContext();
            errorWriter.write(response, e.getKind(), e.getMessage());
            return;
        }

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(claims.getAccountId(), null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        if (accessTokenValidator.suggestRefresh(claims, securityProperties.getJwt().getRefreshHintThresholdSeconds())) {
            response.setHeader(REFRESH_SUGGESTED_HEADER, "true");
        }

        chain.doFilter(request, response);
    }
}
