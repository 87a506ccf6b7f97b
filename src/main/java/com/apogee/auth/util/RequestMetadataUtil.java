package com.apogee.auth.util;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * Extracts caller metadata from an HTTP request.
 */
@Slf4j
@Component
public class RequestMetadataUtil {

    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final String CORRELATION_ID_ATTRIBUTE = "correlation-id";

    public ClientInfo describe(HttpServletRequest request) {
        return ClientInfo.builder()
                .ipAddress(clientAddress(request))
                .userAgent(request.getHeader("User-Agent"))
                .correlationId(correlationId(request))
                .build();
    }

    /**
     * First X-Forwarded-For hop when behind the gateway, otherwise the socket address.
     */
    public String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    /**
     * Correlation id from the gateway header, else one generated and remembered for this request.
     */
    public String correlationId(HttpServletRequest request) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (StringUtils.hasText(correlationId)) {
            return correlationId.trim();
        }

        Object stored = request.getAttribute(CORRELATION_ID_ATTRIBUTE);
        if (stored != null) {
            return stored.toString();
        }

        correlationId = UUID.randomUUID().toString();
        log.debug("Generated new correlation ID: {}", correlationId);
        request.setAttribute(CORRELATION_ID_ATTRIBUTE, correlationId);
        return correlationId;
    }
}
