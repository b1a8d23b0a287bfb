package io.github.samzhu.tokenboard.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 雜湊工具。
 *
 * <p>用於 API token 雜湊儲存與提交指紋。
 */
public final class FingerprintUtils {

    private FingerprintUtils() {
    }

    /**
     * 計算字串的 SHA-256 十六進位雜湊。
     *
     * @param value 原始字串
     * @return 64 字元小寫十六進位字串
     */
    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // 每個 JDK 都必須提供 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 計算短指紋：SHA-256 的前 16 個十六進位字元。
     */
    public static String shortFingerprint(String value) {
        return sha256Hex(value).substring(0, 16);
    }
}
