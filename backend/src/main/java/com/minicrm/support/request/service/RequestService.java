package com.minicrm.support.request.service;

import com.minicrm.support.common.api.NotFoundException;
import com.minicrm.support.request.repo.RequestRepository;
import com.minicrm.support.source.repo.SourceRepository;
import com.minicrm.support.user.service.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class RequestService {

    private static final Logger log = LoggerFactory.getLogger(RequestService.class);

    private final RequestRepository requestRepository;
    private final SourceRepository sourceRepository;
    private final UserService userService;
    private final DistributionService distributionService;

    public RequestService(
            RequestRepository requestRepository,
            SourceRepository sourceRepository,
            UserService userService,
            DistributionService distributionService
    ) {
        this.requestRepository = requestRepository;
        this.sourceRepository = sourceRepository;
        this.userService = userService;
        this.distributionService = distributionService;
    }

    /**
     * Stores the inbound message as a pending request and distributes it right away.
     *
     * @return the request as it stands after distribution ({@code assigned} or {@code waiting})
     */
    @Transactional
    public RequestRepository.RequestRow createRequest(String userIdentifier, String sourceId, String message) {
        var identifier = requireText(userIdentifier, "user_identifier_required");
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message_required");
        }
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("source_id_required");
        }

        sourceRepository.findById(sourceId)
                .orElseThrow(() -> new NotFoundException("source_not_found"));

        var userId = userService.getOrCreate(identifier);
        var requestId = requestRepository.createPending(userId, sourceId, message);
        log.debug("request_created requestId={} sourceId={} userId={}", requestId, sourceId, userId);

        try {
            distributionService.distribute(requestId, sourceId);
        } catch (NotFoundException ex) {
            // the request row exists at this point, so this is an internal error
            throw new IllegalStateException("distribution_failed requestId=" + requestId, ex);
        }

        return requestRepository.findById(requestId)
                .orElseThrow(() -> new IllegalStateException("request_missing_after_create"));
    }

    @Transactional(readOnly = true)
    public List<RequestRepository.RequestRow> listRequests() {
        return requestRepository.listAll();
    }

    @Transactional(readOnly = true)
    public RequestRepository.RequestDetailRow getRequestDetail(String requestId) {
        return requestRepository.findDetail(requestId)
                .orElseThrow(() -> new NotFoundException("request_not_found"));
    }

    private static String requireText(String raw, String code) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(code);
        }
        return raw.trim();
    }
}
