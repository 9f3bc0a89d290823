package com.ecosnap.backend.analysis.web;

import com.ecosnap.backend.analysis.controller.ProductAnalysisController;
import com.ecosnap.backend.analysis.dto.AnalysisErrorResponse;
import com.ecosnap.backend.analysis.normalize.NormalizationException;
import com.ecosnap.backend.common.web.RequestIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice(assignableTypes = ProductAnalysisController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AnalysisExceptionAdvice {

    @ExceptionHandler(NormalizationException.class)
    public ResponseEntity<AnalysisErrorResponse> handleNormalization(NormalizationException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err(e.getCode(), e, req));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<AnalysisErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err(norm(e.getMessage(), "BAD_REQUEST"), e, req));
    }

    /** body 不是 JSON object */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<AnalysisErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new AnalysisErrorResponse("INVALID_BODY", "request body must be a JSON object", rid(req)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<AnalysisErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("analysis_unexpected_error rid={} err={}", rid(req), e.toString(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new AnalysisErrorResponse("INTERNAL_ERROR", "unexpected error", rid(req)));
    }

    // ===== helpers =====

    private static AnalysisErrorResponse err(String code, Throwable e, HttpServletRequest req) {
        return new AnalysisErrorResponse(code, safeMsgOrCode(e, code), rid(req));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }

    private static String norm(String msg, String fallback) {
        if (msg == null) return fallback;
        String c = msg.trim();
        return c.isEmpty() ? fallback : c;
    }

    private static String safeMsgOrCode(Throwable t, String code) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? code : m;
    }
}
