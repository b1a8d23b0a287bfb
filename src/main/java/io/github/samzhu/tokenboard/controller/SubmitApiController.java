package io.github.samzhu.tokenboard.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.tokenboard.dto.DeviceIdentity;
import io.github.samzhu.tokenboard.dto.api.SubmitResponse;
import io.github.samzhu.tokenboard.dto.contribution.TokenContributionData;
import io.github.samzhu.tokenboard.exception.SubmissionValidationException;
import io.github.samzhu.tokenboard.service.SubmissionService;
import io.github.samzhu.tokenboard.service.SubmissionValidationService;
import io.github.samzhu.tokenboard.service.SubmissionValidationService.ValidationResult;

/**
 * 用量提交 REST API 控制器。
 *
 * <p>端點：{@code POST /api/v1/submit}，需要 {@code Authorization: Bearer <token>}
 *
 * <p>處理流程：
 * <pre>
 * 1. ApiTokenInterceptor 驗證 token → (userId, deviceId)
 * 2. 正規化並驗證提交內容 → 收集所有錯誤與警告
 * 3. 拒絕沒有任何貢獻資料的提交
 * 4. 在單一交易中合併提交 → 重算用戶累計
 * </pre>
 */
@RestController
@RequestMapping("/api/v1")
public class SubmitApiController {

    private static final Logger log = LoggerFactory.getLogger(SubmitApiController.class);

    private final SubmissionValidationService validationService;
    private final SubmissionService submissionService;

    public SubmitApiController(SubmissionValidationService validationService,
                               SubmissionService submissionService) {
        this.validationService = validationService;
        this.submissionService = submissionService;
    }

    /**
     * 提交一台裝置的用量資料。
     *
     * @param identity 已驗證的裝置身分
     * @param data 貢獻圖資料
     * @return 合併結果
     */
    @PostMapping("/submit")
    public ResponseEntity<SubmitResponse> submit(
            @RequestAttribute(ApiTokenInterceptor.DEVICE_IDENTITY) DeviceIdentity identity,
            @RequestBody TokenContributionData data) {

        log.info("API request: submit user={}, device={}", identity.username(), identity.tokenId());

        ValidationResult validation = validationService.validate(data);
        if (!validation.valid()) {
            throw new SubmissionValidationException("Validation failed", validation.errors());
        }
        if (validation.data().contributions().isEmpty()) {
            throw new SubmissionValidationException("No contribution data to submit");
        }

        SubmitResponse response = submissionService.submit(identity, validation.data(),
            validation.fingerprint(), validation.warnings());
        return ResponseEntity.ok(response);
    }
}
