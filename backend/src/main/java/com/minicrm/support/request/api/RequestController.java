package com.minicrm.support.request.api;

import com.minicrm.support.common.api.ApiResponse;
import com.minicrm.support.request.service.RequestService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/requests")
public class RequestController {

    private final RequestService requestService;

    public RequestController(RequestService requestService) {
        this.requestService = requestService;
    }

    /**
     * Creates the user on first contact, stores the request and distributes it in the same call.
     */
    @PostMapping
    public ApiResponse<RequestItem> create(@Valid @RequestBody CreateRequestRequest req) {
        var row = requestService.createRequest(req.user_identifier(), req.source_id(), req.message());
        return ApiResponse.ok(RequestItem.from(row));
    }

    @GetMapping
    public ApiResponse<List<RequestItem>> list() {
        return ApiResponse.ok(requestService.listRequests().stream().map(RequestItem::from).toList());
    }

    @GetMapping("/{id}")
    public ApiResponse<RequestDetailResponse> detail(@PathVariable("id") String requestId) {
        return ApiResponse.ok(RequestDetailResponse.from(requestService.getRequestDetail(requestId)));
    }
}
