package io.github.samzhu.tokenboard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Tokenboard - AI 助理 token 用量排行榜服務。
 *
 * <p>此服務接收同一帳號下多台 CLI 裝置提交的 token 用量資料，負責：
 * <ul>
 *   <li>模型定價解析（含模糊比對）與成本計算</li>
 *   <li>將原始用量事件聚合為每日貢獻圖資料</li>
 *   <li>驗證提交內容並產生提交指紋</li>
 *   <li>以裝置為單位合併提交，避免重複計算</li>
 *   <li>提供 REST API 查詢每日明細、個人統計與排行榜</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * CLI (各裝置) → POST /api/v1/submit → 驗證 → 合併交易 → MongoDB
 *                                                    ↓
 *                                    daily_breakdown    (用戶日明細，依裝置分區)
 *                                    submission_summary (用戶累計，每次重算)
 * </pre>
 */
@SpringBootApplication
public class TokenboardApplication {

    private static final Logger log = LoggerFactory.getLogger(TokenboardApplication.class);

    public static void main(String[] args) {
        log.info("Starting Tokenboard - AI token usage ledger");
        SpringApplication.run(TokenboardApplication.class, args);
    }
}
