package com.minicrm.support.operator.service;

import com.minicrm.support.common.api.ConflictException;
import com.minicrm.support.common.api.NotFoundException;
import com.minicrm.support.operator.repo.OperatorRepository;
import com.minicrm.support.request.repo.RequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class OperatorService {

    private static final Logger log = LoggerFactory.getLogger(OperatorService.class);

    private final OperatorRepository operatorRepository;
    private final RequestRepository requestRepository;

    public OperatorService(OperatorRepository operatorRepository, RequestRepository requestRepository) {
        this.operatorRepository = operatorRepository;
        this.requestRepository = requestRepository;
    }

    @Transactional
    public OperatorRepository.OperatorRow createOperator(String name, int maxLoadLimit) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name_required");
        }
        requirePositiveLimit(maxLoadLimit);

        var id = operatorRepository.create(name.trim(), maxLoadLimit);
        log.info("operator_created operatorId={} maxLoadLimit={}", id, maxLoadLimit);
        return operatorRepository.findById(id)
                .orElseThrow(() -> new IllegalStateException("operator_missing_after_create"));
    }

    @Transactional(readOnly = true)
    public List<OperatorRepository.OperatorRow> listOperators() {
        return operatorRepository.listAll();
    }

    /**
     * Changes capacity only. Lowering it below the current load is allowed; the operator just stops
     * receiving requests until load drops.
     */
    @Transactional
    public OperatorRepository.OperatorRow updateOperator(String operatorId, int maxLoadLimit) {
        requirePositiveLimit(maxLoadLimit);
        if (operatorRepository.updateMaxLoadLimit(operatorId, maxLoadLimit) == 0) {
            throw new NotFoundException("operator_not_found");
        }
        return requireOperator(operatorId);
    }

    @Transactional
    public OperatorRepository.OperatorRow toggleActive(String operatorId) {
        if (operatorRepository.toggleActive(operatorId) == 0) {
            throw new NotFoundException("operator_not_found");
        }
        var row = requireOperator(operatorId);
        log.info("operator_toggled operatorId={} active={}", operatorId, row.active());
        return row;
    }

    /**
     * Releases one unit of load, e.g. when a request is completed. Never drops below zero.
     */
    @Transactional
    public OperatorRepository.OperatorRow releaseLoad(String operatorId) {
        if (operatorRepository.decrementLoad(operatorId) == 0) {
            throw new NotFoundException("operator_not_found");
        }
        return requireOperator(operatorId);
    }

    /**
     * Refused while any request references the operator; its weight rows go with it.
     */
    @Transactional
    public void deleteOperator(String operatorId) {
        requireOperator(operatorId);
        if (requestRepository.countByOperator(operatorId) > 0) {
            throw new ConflictException("operator_in_use");
        }
        operatorRepository.delete(operatorId);
        log.info("operator_deleted operatorId={}", operatorId);
    }

    private OperatorRepository.OperatorRow requireOperator(String operatorId) {
        return operatorRepository.findById(operatorId)
                .orElseThrow(() -> new NotFoundException("operator_not_found"));
    }

    private static void requirePositiveLimit(int maxLoadLimit) {
        if (maxLoadLimit <= 0) {
            throw new IllegalArgumentException("max_load_limit_invalid");
        }
    }
}
