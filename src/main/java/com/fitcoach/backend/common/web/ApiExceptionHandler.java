package com.fitcoach.backend.common.web;

import com.fitcoach.backend.resolution.service.ProgramResolutionException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * 統一把常見例外轉成「可預期」的 HTTP 狀態碼與錯誤格式：
 * - 400：參數格式錯 / IllegalArgument / 參數驗證失敗
 * - 503：strict 模式下任一資料來源讀取失敗（PROGRAM_RESOLUTION_UNAVAILABLE）
 * - 500：其他未預期錯誤（含 app.program-resolution.zone 設定錯誤的 DateTimeException）
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // ===== 400 Bad Request =====

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("BAD_REQUEST", ex.getMessage(), req));
    }

    // @Size 等參數驗證（Spring 內建 method validation）
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(HandlerMethodValidationException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("VALIDATION_FAILED", "invalid request parameter", req));
    }

    // ===== 503 strict consistency =====

    @ExceptionHandler(ProgramResolutionException.class)
    public ResponseEntity<Map<String, Object>> handleResolution(ProgramResolutionException ex, HttpServletRequest req) {
        log.warn("program resolution unavailable kind={} msg={}", ex.getKind(), ex.getMessage());
        Map<String, Object> body = err(ProgramResolutionException.CODE, ex.getMessage(), req);
        if (ex.getKind() != null) body.put("kind", ex.getKind().name());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    // ===== 500 Fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("unhandled error", ex);
        // 上線不回 message，避免洩漏內部資訊；log 例外即可
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", null, req));
    }

    private static Map<String, Object> err(String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new HashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        m.put("requestId", RequestIdFilter.getOrCreate(req));
        return m;
    }
}
