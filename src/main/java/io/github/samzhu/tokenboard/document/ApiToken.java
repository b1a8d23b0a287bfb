package io.github.samzhu.tokenboard.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 裝置 API token 文件。
 *
 * <p>每台 CLI 安裝各自持有一個 token，文件 ID 即為合併時的裝置 ID。
 * Token 本身不落地，僅保存 SHA-256 雜湊。
 *
 * @param id token ID（裝置 ID）
 * @param userId 所屬用戶
 * @param name 裝置名稱
 * @param tokenHash token 的 SHA-256 雜湊
 * @param expiresAt 到期時間，null 表示不過期
 * @param lastUsedAt 最後一次提交時間
 * @param createdAt 建立時間
 */
@Document(collection = "api_tokens")
public record ApiToken(
    @Id String id,
    String userId,
    String name,
    String tokenHash,
    Instant expiresAt,
    Instant lastUsedAt,
    Instant createdAt
) {
}
