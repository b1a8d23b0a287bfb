package io.github.samzhu.tokenboard.exception;

/**
 * 查詢的用戶不存在（HTTP 404）。
 */
public class UserNotFoundException extends RuntimeException {

    private final String username;

    public UserNotFoundException(String username) {
        super("User not found: " + username);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
