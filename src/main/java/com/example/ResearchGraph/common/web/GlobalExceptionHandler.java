package com.example.ResearchGraph.common.web;

import com.example.ResearchGraph.common.convention.errorcode.RagErrorCode;
import com.example.ResearchGraph.common.convention.exception.AbstractException;
import com.example.ResearchGraph.common.convention.exception.ClientException;
import com.example.ResearchGraph.common.convention.exception.RateLimitedException;
import com.example.ResearchGraph.common.convention.result.ErrorResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions thrown by controllers to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResult> handleValidationException(MethodArgumentNotValidException ex,
                                                                 HttpServletRequest request) {
        FieldError firstError = ex.getBindingResult().getFieldError();
        String errorMessage = firstError != null ? firstError.getDefaultMessage() : RagErrorCode.PARAM_INVALID.message();

        log.warn("[{}] {} - validation failed: {}", request.getMethod(), getFullRequestUrl(request), errorMessage);

        return ResponseEntity.badRequest()
                .body(ErrorResult.of(RagErrorCode.PARAM_INVALID.code(), errorMessage));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResult> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                            HttpServletRequest request) {
        log.warn("[{}] {} - unreadable request body", request.getMethod(), getFullRequestUrl(request));

        return ResponseEntity.badRequest()
                .body(ErrorResult.of(RagErrorCode.PARAM_INVALID.code(), "Request body is malformed"));
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ErrorResult> handleRateLimited(RateLimitedException ex, HttpServletRequest request) {
        long retryAfterSeconds = ex.getRetryAfter().toSeconds();
        log.warn("[{}] {} - generation rate limited, retry after {}s",
                request.getMethod(), getFullRequestUrl(request), retryAfterSeconds);

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(new ErrorResult(ex.getErrorCode(), ex.getErrorMessage(), retryAfterSeconds));
    }

    /**
     * ClientException / ServiceException.
     */
    @ExceptionHandler(AbstractException.class)
    public ResponseEntity<ErrorResult> handleAbstractException(AbstractException ex, HttpServletRequest request) {
        HttpStatus status = resolveStatus(ex);
        if (status.is5xxServerError()) {
            log.error("[{}] {} - {} ({})",
                    request.getMethod(), getFullRequestUrl(request), ex.getErrorMessage(), ex.getErrorCode(), ex);
        } else {
            log.info("[{}] {} - {} ({})",
                    request.getMethod(), getFullRequestUrl(request), ex.getErrorMessage(), ex.getErrorCode());
        }

        return ResponseEntity.status(status)
                .body(ErrorResult.of(ex.getErrorCode(), ex.getErrorMessage()));
    }

    @ExceptionHandler(Throwable.class)
    public ResponseEntity<ErrorResult> handleThrowable(Throwable throwable, HttpServletRequest request) {
        log.error("[{}] {} - unexpected error", request.getMethod(), getFullRequestUrl(request), throwable);

        // Never expose internal details.
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResult.of(RagErrorCode.SERVICE_ERROR.code(), RagErrorCode.SERVICE_ERROR.message()));
    }

    private HttpStatus resolveStatus(AbstractException ex) {
        String code = ex.getErrorCode();
        if (RagErrorCode.PAPER_NOT_FOUND.code().equals(code)
                || RagErrorCode.NO_CONTENT_AVAILABLE.code().equals(code)) {
            return HttpStatus.NOT_FOUND;
        }
        if (RagErrorCode.UPSTREAM_ERROR.code().equals(code)) {
            return HttpStatus.BAD_GATEWAY;
        }
        return ex instanceof ClientException ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private String getFullRequestUrl(HttpServletRequest request) {
        String queryString = request.getQueryString();
        return request.getRequestURI() + (queryString != null ? "?" + queryString : "");
    }
}
