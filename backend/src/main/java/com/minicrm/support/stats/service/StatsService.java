package com.minicrm.support.stats.service;

import com.minicrm.support.operator.repo.OperatorRepository;
import com.minicrm.support.stats.repo.StatsRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Service
public class StatsService {

    public record OperatorLoad(
            String operatorId,
            String operatorName,
            boolean active,
            int currentLoad,
            int maxLoadLimit,
            double loadPercentage
    ) {
    }

    /**
     * {@code operatorId} and {@code operatorName} are null for the unassigned bucket.
     */
    public record OperatorShare(String operatorId, String operatorName, long requestCount) {
    }

    public record SourceShare(String sourceId, String sourceName, long requestCount) {
    }

    public record Distribution(
            List<OperatorShare> byOperator,
            List<SourceShare> bySource,
            long totalRequests,
            long unassignedRequests
    ) {
    }

    private final OperatorRepository operatorRepository;
    private final StatsRepository statsRepository;

    public StatsService(OperatorRepository operatorRepository, StatsRepository statsRepository) {
        this.operatorRepository = operatorRepository;
        this.statsRepository = statsRepository;
    }

    /**
     * Every operator, active or not.
     */
    @Transactional(readOnly = true)
    public List<OperatorLoad> operatorLoadStats() {
        return operatorRepository.listAll().stream()
                .map(o -> new OperatorLoad(
                        o.id(),
                        o.name(),
                        o.active(),
                        o.currentLoad(),
                        o.maxLoadLimit(),
                        loadPercentage(o.currentLoad(), o.maxLoadLimit())
                ))
                .toList();
    }

    /**
     * {@code totalRequests} and {@code unassignedRequests} come from one statement, so
     * {@code unassignedRequests} is exactly the number of requests without an operator at that instant.
     */
    @Transactional(readOnly = true)
    public Distribution requestDistributionStats() {
        var totals = statsRepository.countTotals();

        var byOperator = new ArrayList<OperatorShare>();
        for (var row : statsRepository.countAssignedByOperator()) {
            byOperator.add(new OperatorShare(row.operatorId(), row.operatorName(), row.requestCount()));
        }

        var unassigned = totals.unassigned();
        if (unassigned > 0) {
            byOperator.add(new OperatorShare(null, null, unassigned));
        }

        var bySource = statsRepository.countBySource().stream()
                .map(r -> new SourceShare(r.sourceId(), r.sourceName(), r.requestCount()))
                .toList();

        return new Distribution(List.copyOf(byOperator), bySource, totals.total(), unassigned);
    }

    static double loadPercentage(int currentLoad, int maxLoadLimit) {
        if (maxLoadLimit <= 0) return 0.0;
        return currentLoad * 100.0 / maxLoadLimit;
    }
}
