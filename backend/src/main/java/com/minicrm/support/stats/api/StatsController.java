package com.minicrm.support.stats.api;

import com.minicrm.support.common.api.ApiResponse;
import com.minicrm.support.stats.service.StatsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/stats")
public class StatsController {

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping("/operators-load")
    public ApiResponse<List<OperatorLoadItem>> operatorsLoad() {
        var items = statsService.operatorLoadStats().stream()
                .map(s -> new OperatorLoadItem(
                        s.operatorId(),
                        s.operatorName(),
                        s.active(),
                        s.currentLoad(),
                        s.maxLoadLimit(),
                        s.loadPercentage()
                ))
                .toList();
        return ApiResponse.ok(items);
    }

    @GetMapping("/requests-distribution")
    public ApiResponse<DistributionStatsResponse> requestsDistribution() {
        var stats = statsService.requestDistributionStats();
        var byOperator = stats.byOperator().stream()
                .map(s -> new DistributionStatsResponse.OperatorBucket(s.operatorId(), s.operatorName(), s.requestCount()))
                .toList();
        var bySource = stats.bySource().stream()
                .map(s -> new DistributionStatsResponse.SourceBucket(s.sourceId(), s.sourceName(), s.requestCount()))
                .toList();
        return ApiResponse.ok(new DistributionStatsResponse(
                byOperator,
                bySource,
                stats.totalRequests(),
                stats.unassignedRequests()
        ));
    }
}
