package io.github.samzhu.tokenboard.exception;

/**
 * API token 缺少、無效或已過期（HTTP 401）。
 */
public class InvalidApiTokenException extends RuntimeException {

    public InvalidApiTokenException(String message) {
        super(message);
    }
}
