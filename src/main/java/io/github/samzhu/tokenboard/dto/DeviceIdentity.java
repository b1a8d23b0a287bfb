package io.github.samzhu.tokenboard.dto;

/**
 * 已驗證的提交裝置身分。
 *
 * @param userId 用戶 ID
 * @param username 用戶名稱
 * @param tokenId API token ID，作為合併時的裝置 ID
 */
public record DeviceIdentity(
    String userId,
    String username,
    String tokenId
) {
}
