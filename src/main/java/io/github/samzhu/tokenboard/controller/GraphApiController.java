package io.github.samzhu.tokenboard.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.tokenboard.dto.PricingTable;
import io.github.samzhu.tokenboard.dto.api.GraphRequest;
import io.github.samzhu.tokenboard.dto.contribution.TokenContributionData;
import io.github.samzhu.tokenboard.service.ContributionAggregationService;

/**
 * 貢獻圖聚合 REST API 控制器。
 *
 * <p>端點：{@code POST /api/v1/graph}
 *
 * <p>接收正規化後的用量事件，回傳可直接提交的貢獻圖資料。
 * 請求中的 {@code pricing} 會取代伺服器預設定價表。
 */
@RestController
@RequestMapping("/api/v1")
public class GraphApiController {

    private static final Logger log = LoggerFactory.getLogger(GraphApiController.class);

    private final ContributionAggregationService aggregationService;

    public GraphApiController(ContributionAggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    @PostMapping("/graph")
    public ResponseEntity<TokenContributionData> graph(@RequestBody @Validated GraphRequest request) {
        log.info("API request: graph events={}, customPricing={}",
            request.events().size(), request.pricing() != null);

        TokenContributionData data = request.pricing() != null
            ? aggregationService.aggregate(request.events(), PricingTable.fromEntries(request.pricing()))
            : aggregationService.aggregate(request.events());
        return ResponseEntity.ok(data);
    }
}
