package io.github.samzhu.tokenboard.exception;

/**
 * 合併交易寫入失敗。
 *
 * <p>交易為全有或全無，呼叫端可原封不動重送同一份提交（HTTP 500）。
 */
public class LedgerStoreException extends RuntimeException {

    private final String userId;
    private final int attempts;

    public LedgerStoreException(String userId, int attempts, Throwable cause) {
        super(String.format("Failed to store submission: userId='%s', attempts=%d", userId, attempts), cause);
        this.userId = userId;
        this.attempts = attempts;
    }

    public String getUserId() {
        return userId;
    }

    public int getAttempts() {
        return attempts;
    }
}
