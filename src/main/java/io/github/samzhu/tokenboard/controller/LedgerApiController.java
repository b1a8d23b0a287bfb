package io.github.samzhu.tokenboard.controller;

import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.tokenboard.dto.api.DailyBreakdownResponse;
import io.github.samzhu.tokenboard.dto.api.LeaderboardEntry;
import io.github.samzhu.tokenboard.dto.api.UserProfileResponse;
import io.github.samzhu.tokenboard.service.LedgerQueryService;

/**
 * 帳本查詢 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /api/v1/users/{username}} - 用戶個人統計</li>
 *   <li>{@code GET /api/v1/users/{username}/daily} - 用戶日明細</li>
 *   <li>{@code GET /api/v1/leaderboard} - 排行榜</li>
 * </ul>
 *
 * <p>日期參數使用 ISO 格式：{@code YYYY-MM-DD}
 */
@RestController
@RequestMapping("/api/v1")
public class LedgerApiController {

    private static final Logger log = LoggerFactory.getLogger(LedgerApiController.class);

    private final LedgerQueryService queryService;

    public LedgerApiController(LedgerQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/users/{username}")
    public ResponseEntity<UserProfileResponse> getUserProfile(@PathVariable String username) {
        log.info("API request: getUserProfile username={}", username);
        return ResponseEntity.ok(queryService.getUserProfile(username));
    }

    /**
     * 查詢用戶日明細。
     *
     * <p>端點：{@code GET /api/v1/users/{username}/daily?startDate=&endDate=}
     *
     * @param username 用戶名稱
     * @param startDate 起始日期（含）
     * @param endDate 結束日期（含）
     * @return 依日期排序的日明細
     */
    @GetMapping("/users/{username}/daily")
    public ResponseEntity<List<DailyBreakdownResponse>> getUserDaily(
            @PathVariable String username,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("API request: getUserDaily username={}, period={} to {}", username, startDate, endDate);
        return ResponseEntity.ok(queryService.getUserDaily(username, startDate, endDate));
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<List<LeaderboardEntry>> getLeaderboard(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        log.info("API request: getLeaderboard page={}, size={}", page, size);
        return ResponseEntity.ok(queryService.getLeaderboard(page, size));
    }
}
