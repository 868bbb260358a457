package com.minicrm.support.operator.api;

import com.minicrm.support.common.api.ApiResponse;
import com.minicrm.support.operator.service.OperatorService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/operators")
public class OperatorController {

    private final OperatorService operatorService;

    public OperatorController(OperatorService operatorService) {
        this.operatorService = operatorService;
    }

    @PostMapping
    public ApiResponse<OperatorItem> create(@Valid @RequestBody CreateOperatorRequest req) {
        var row = operatorService.createOperator(req.name(), req.max_load_limit());
        return ApiResponse.ok(OperatorItem.from(row));
    }

    @GetMapping
    public ApiResponse<List<OperatorItem>> list() {
        var items = operatorService.listOperators().stream().map(OperatorItem::from).toList();
        return ApiResponse.ok(items);
    }

    @PutMapping("/{id}")
    public ApiResponse<OperatorItem> update(
            @PathVariable("id") String operatorId,
            @Valid @RequestBody UpdateOperatorRequest req
    ) {
        var row = operatorService.updateOperator(operatorId, req.max_load_limit());
        return ApiResponse.ok(OperatorItem.from(row));
    }

    @PutMapping("/{id}/toggle-active")
    public ApiResponse<OperatorItem> toggleActive(@PathVariable("id") String operatorId) {
        return ApiResponse.ok(OperatorItem.from(operatorService.toggleActive(operatorId)));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable("id") String operatorId) {
        operatorService.deleteOperator(operatorId);
        return ApiResponse.empty();
    }
}
