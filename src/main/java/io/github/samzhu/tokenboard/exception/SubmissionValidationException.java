package io.github.samzhu.tokenboard.exception;

import java.util.List;

/**
 * 提交內容驗證失敗。
 *
 * <p>驗證不會在第一個錯誤就中止，所有問題一次收集後隨此異常回傳（HTTP 400）。
 */
public class SubmissionValidationException extends RuntimeException {

    private final List<String> errors;

    public SubmissionValidationException(String message, List<String> errors) {
        super(message);
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public SubmissionValidationException(String message) {
        this(message, List.of());
    }

    public List<String> getErrors() {
        return errors;
    }
}
