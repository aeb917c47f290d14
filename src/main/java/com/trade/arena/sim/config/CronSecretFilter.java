package com.trade.arena.sim.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the scheduler trigger endpoints with {@code Authorization: Bearer <secret>}.
 * With no secret configured every request is rejected.
 */
@Slf4j
public class CronSecretFilter extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";

    private final byte[] secret;
    private final ObjectMapper mapper;

    public CronSecretFilter(String secret, ObjectMapper mapper) {
        this.secret = (secret == null || secret.isBlank()) ? null : secret.getBytes(StandardCharsets.UTF_8);
        this.mapper = mapper;
        if (this.secret == null) {
            log.warn("CRON_SECRET is not set; all trigger endpoints will answer 401");
        }
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        if (authorized(request.getHeader(HttpHeaders.AUTHORIZATION))) {
            chain.doFilter(request, response);
            return;
        }
        log.warn("Rejected trigger call {} {} from {}", request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        mapper.writeValue(response.getOutputStream(), Result.fail(ErrorCodes.UNAUTHORIZED, "Unauthorized"));
    }

    boolean authorized(String header) {
        if (secret == null || header == null || !header.startsWith(BEARER)) return false;
        byte[] presented = header.substring(BEARER.length()).trim().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(secret, presented);
    }
}
