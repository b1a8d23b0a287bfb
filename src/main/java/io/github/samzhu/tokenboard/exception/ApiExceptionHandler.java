package io.github.samzhu.tokenboard.exception;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import jakarta.servlet.ServletException;

import io.github.samzhu.tokenboard.dto.api.ApiErrorResponse;

/**
 * REST API 錯誤處理。
 *
 * <p>所有錯誤回應格式為 {@code {"error": "...", "details": [...]}}：
 * <ul>
 *   <li>400 - JSON 格式錯誤、驗證失敗、參數錯誤</li>
 *   <li>401 - API token 缺少、無效或過期</li>
 *   <li>404 - 用戶不存在</li>
 *   <li>500 - 儲存失敗（可重送）或未預期錯誤（細節只寫入 log）</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SubmissionValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(SubmissionValidationException ex) {
        List<String> details = ex.getErrors().isEmpty() ? null : ex.getErrors();
        return ResponseEntity.badRequest().body(new ApiErrorResponse(ex.getMessage(), details));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleArgumentNotValid(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + ": " + e.getDefaultMessage())
            .sorted()
            .toList();
        return ResponseEntity.badRequest().body(new ApiErrorResponse("Validation failed", details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiErrorResponse.of("Invalid JSON body"));
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleBadParameter(Exception ex) {
        return ResponseEntity.badRequest().body(ApiErrorResponse.of(ex.getMessage()));
    }

    /**
     * token 與訊息數以精確運算加總，超出 {@code long} 範圍時來自呼叫端提供的數值。
     */
    @ExceptionHandler(ArithmeticException.class)
    public ResponseEntity<ApiErrorResponse> handleOutOfRange(ArithmeticException ex) {
        log.warn("Rejected request with out-of-range counts: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiErrorResponse.of("Token or message counts out of range"));
    }

    @ExceptionHandler(InvalidApiTokenException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidToken(InvalidApiTokenException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ApiErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleUserNotFound(UserNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiErrorResponse.of("User not found"));
    }

    @ExceptionHandler(LedgerStoreException.class)
    public ResponseEntity<ApiErrorResponse> handleStoreFailure(LedgerStoreException ex) {
        log.error("Ledger store failure: userId={}, attempts={}", ex.getUserId(), ex.getAttempts(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiErrorResponse.of("Failed to store submission, retry later"));
    }

    /**
     * Spring MVC 自身的錯誤（405、404 路徑、415 等）保留原本的狀態碼。
     */
    @ExceptionHandler(ServletException.class)
    public ResponseEntity<ApiErrorResponse> handleServletException(ServletException ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            String detail = errorResponse.getBody().getDetail();
            return ResponseEntity.status(errorResponse.getStatusCode())
                .body(ApiErrorResponse.of(detail != null ? detail : ex.getMessage()));
        }
        return handleUnexpected(ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiErrorResponse.of("Internal server error"));
    }
}
