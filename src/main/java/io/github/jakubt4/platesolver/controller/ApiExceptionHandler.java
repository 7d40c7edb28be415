package io.github.jakubt4.platesolver.controller;

import io.github.jakubt4.platesolver.dto.AnalyseResponse;
import io.github.jakubt4.platesolver.dto.SolveResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;

/**
 * Maps upload failures raised before a controller runs onto that endpoint's response shape.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Object> uploadTooLarge(final MaxUploadSizeExceededException e,
                                                 final HttpServletRequest request) {
        log.warn("Rejected upload to {}: {}", request.getRequestURI(), e.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(body(request, "File too large"));
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<Object> malformedUpload(final MultipartException e, final HttpServletRequest request) {
        log.warn("Malformed multipart request to {}: {}", request.getRequestURI(), e.getMessage());
        return ResponseEntity.badRequest().body(body(request, "Failed to parse form"));
    }

    private static Object body(final HttpServletRequest request, final String message) {
        final var uri = request.getRequestURI();
        return uri != null && uri.endsWith("/analyse") ? AnalyseResponse.error(message) : SolveResponse.error(message);
    }
}
