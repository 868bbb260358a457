package com.minicrm.support.source.api;

import com.minicrm.support.common.api.ApiResponse;
import com.minicrm.support.source.repo.OperatorSourceWeightRepository;
import com.minicrm.support.source.service.SourceService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/sources")
public class SourceController {

    private final SourceService sourceService;

    public SourceController(SourceService sourceService) {
        this.sourceService = sourceService;
    }

    @PostMapping
    public ApiResponse<SourceItem> create(@Valid @RequestBody CreateSourceRequest req) {
        return ApiResponse.ok(SourceItem.from(sourceService.createSource(req.name(), req.identifier())));
    }

    @GetMapping
    public ApiResponse<List<SourceItem>> list() {
        return ApiResponse.ok(sourceService.listSources().stream().map(SourceItem::from).toList());
    }

    @PostMapping("/{id}/operators")
    public ApiResponse<List<OperatorWeightItem>> configureWeights(
            @PathVariable("id") String sourceId,
            @Valid @RequestBody ConfigureWeightsRequest req
    ) {
        var entries = req.weights().stream()
                .map(e -> new SourceService.OperatorWeight(e.operator_id().trim(), e.weight()))
                .toList();
        return ApiResponse.ok(toItems(sourceService.configureWeights(sourceId, entries)));
    }

    @GetMapping("/{id}/operators")
    public ApiResponse<List<OperatorWeightItem>> listWeights(@PathVariable("id") String sourceId) {
        return ApiResponse.ok(toItems(sourceService.listWeights(sourceId)));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable("id") String sourceId) {
        sourceService.deleteSource(sourceId);
        return ApiResponse.empty();
    }

    private static List<OperatorWeightItem> toItems(List<OperatorSourceWeightRepository.WeightRow> rows) {
        return rows.stream()
                .map(r -> new OperatorWeightItem(r.operatorId(), r.operatorName(), r.weight()))
                .toList();
    }
}
