package io.github.samzhu.tokenboard.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 用戶帳號文件。
 */
@Document(collection = "users")
public record UserAccount(
    @Id String id,
    String username,
    String displayName,
    String avatarUrl,
    Instant createdAt
) {
}
