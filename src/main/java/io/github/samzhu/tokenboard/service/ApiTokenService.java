package io.github.samzhu.tokenboard.service;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenboard.document.ApiToken;
import io.github.samzhu.tokenboard.document.UserAccount;
import io.github.samzhu.tokenboard.dto.DeviceIdentity;
import io.github.samzhu.tokenboard.exception.InvalidApiTokenException;
import io.github.samzhu.tokenboard.repository.ApiTokenRepository;
import io.github.samzhu.tokenboard.repository.UserAccountRepository;
import io.github.samzhu.tokenboard.util.FingerprintUtils;

/**
 * 裝置 API token 驗證服務。
 *
 * <p>解析 {@code Authorization: Bearer <token>}，以 token 的 SHA-256 雜湊查詢，
 * 回傳 (userId, username, tokenId)。tokenId 即為合併時的裝置 ID。
 */
@Service
public class ApiTokenService {

    private static final Logger log = LoggerFactory.getLogger(ApiTokenService.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final ApiTokenRepository apiTokenRepository;
    private final UserAccountRepository userAccountRepository;
    private final Clock clock;

    public ApiTokenService(ApiTokenRepository apiTokenRepository,
                           UserAccountRepository userAccountRepository,
                           Clock clock) {
        this.apiTokenRepository = apiTokenRepository;
        this.userAccountRepository = userAccountRepository;
        this.clock = clock;
    }

    /**
     * 驗證 Authorization header。
     *
     * @param authorizationHeader header 值，可能為 null
     * @return 裝置身分
     * @throws InvalidApiTokenException header 缺少、token 無效或已過期
     */
    public DeviceIdentity authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new InvalidApiTokenException("Missing or invalid Authorization header");
        }

        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new InvalidApiTokenException("Missing or invalid Authorization header");
        }

        ApiToken apiToken = apiTokenRepository.findByTokenHash(FingerprintUtils.sha256Hex(token))
            .orElseThrow(() -> new InvalidApiTokenException("Invalid API token"));

        UserAccount user = userAccountRepository.findById(apiToken.userId())
            .orElseThrow(() -> {
                log.warn("API token {} references missing user {}", apiToken.id(), apiToken.userId());
                return new InvalidApiTokenException("Invalid API token");
            });

        if (apiToken.expiresAt() != null && apiToken.expiresAt().isBefore(clock.instant())) {
            log.info("Rejected expired API token: tokenId={}, expiredAt={}", apiToken.id(), apiToken.expiresAt());
            throw new InvalidApiTokenException("API token has expired");
        }

        log.debug("API token authenticated: tokenId={}, user={}", apiToken.id(), user.username());
        return new DeviceIdentity(user.id(), user.username(), apiToken.id());
    }
}
