package com.tunechat.match.api;

import com.tunechat.match.api.dto.ErrorResponse;
import com.tunechat.match.catalog.CatalogUnavailableException;
import com.tunechat.match.match.EmptyCatalogException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(errorResponse("bad_request", "Invalid request body", request));
    }

    @ExceptionHandler(EmptyCatalogException.class)
    public ResponseEntity<ErrorResponse> handleEmptyCatalog(EmptyCatalogException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(errorResponse("catalog_empty", "No songs are available to match", request));
    }

    @ExceptionHandler(CatalogUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleCatalogUnavailable(
        CatalogUnavailableException ex,
        HttpServletRequest request
    ) {
        log.warn("catalog unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(errorResponse("catalog_unavailable", "Song catalog is unavailable", request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("unexpected error path={}", request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorResponse("internal_error", "Unexpected error", request));
    }

    private ErrorResponse errorResponse(String code, String message, HttpServletRequest request) {
        String traceId = RequestIdUtil.traceId(request);
        String requestId = RequestIdUtil.requestId(request);
        return new ErrorResponse(code, message, traceId, requestId);
    }
}
