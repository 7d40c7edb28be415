package io.github.jakubt4.platesolver.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Logs one line per request: method, path, status, duration and client address.
 */
@Slf4j
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(final HttpServletRequest request, final HttpServletResponse response,
                                    final FilterChain filterChain) throws ServletException, IOException {
        final var startedAt = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            final var elapsedMs = (System.nanoTime() - startedAt) / 1_000_000;
            log.info("{} {} {} {}ms {}", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), elapsedMs, request.getRemoteAddr());
        }
    }
}
