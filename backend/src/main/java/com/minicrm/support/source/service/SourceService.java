package com.minicrm.support.source.service;

import com.minicrm.support.common.api.ConflictException;
import com.minicrm.support.common.api.NotFoundException;
import com.minicrm.support.operator.repo.OperatorRepository;
import com.minicrm.support.request.repo.RequestRepository;
import com.minicrm.support.source.repo.OperatorSourceWeightRepository;
import com.minicrm.support.source.repo.SourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;

@Service
public class SourceService {

    private static final Logger log = LoggerFactory.getLogger(SourceService.class);

    public static final int MIN_WEIGHT = 1;
    public static final int MAX_WEIGHT = 100;

    public record OperatorWeight(String operatorId, int weight) {
    }

    private final SourceRepository sourceRepository;
    private final OperatorSourceWeightRepository weightRepository;
    private final OperatorRepository operatorRepository;
    private final RequestRepository requestRepository;

    public SourceService(
            SourceRepository sourceRepository,
            OperatorSourceWeightRepository weightRepository,
            OperatorRepository operatorRepository,
            RequestRepository requestRepository
    ) {
        this.sourceRepository = sourceRepository;
        this.weightRepository = weightRepository;
        this.operatorRepository = operatorRepository;
        this.requestRepository = requestRepository;
    }

    @Transactional
    public SourceRepository.SourceRow createSource(String name, String identifier) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name_required");
        }
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier_required");
        }
        var key = identifier.trim();

        if (sourceRepository.findByIdentifier(key).isPresent()) {
            throw new ConflictException("source_identifier_exists");
        }

        String id;
        try {
            id = sourceRepository.create(name.trim(), key);
        } catch (DuplicateKeyException ex) {
            throw new ConflictException("source_identifier_exists", ex);
        }
        log.info("source_created sourceId={} identifier={}", id, key);
        return sourceRepository.findById(id)
                .orElseThrow(() -> new IllegalStateException("source_missing_after_create"));
    }

    @Transactional(readOnly = true)
    public List<SourceRepository.SourceRow> listSources() {
        return sourceRepository.listAll();
    }

    /**
     * Upserts one weight per operator for the source. Every entry is checked before anything is
     * written, so one bad entry leaves the stored weights untouched. When an operator is listed twice
     * the last weight wins.
     *
     * @return all weights configured for the source after the change
     */
    @Transactional
    public List<OperatorSourceWeightRepository.WeightRow> configureWeights(String sourceId, List<OperatorWeight> weights) {
        requireSource(sourceId);
        if (weights == null) {
            throw new IllegalArgumentException("weights_required");
        }

        var byOperator = new LinkedHashMap<String, Integer>();
        for (var w : weights) {
            if (w == null || w.operatorId() == null || w.operatorId().isBlank()) {
                throw new IllegalArgumentException("operator_id_required");
            }
            if (w.weight() < MIN_WEIGHT || w.weight() > MAX_WEIGHT) {
                throw new IllegalArgumentException("weight_out_of_range");
            }
            if (!operatorRepository.exists(w.operatorId())) {
                throw new NotFoundException("operator_not_found");
            }
            byOperator.put(w.operatorId(), w.weight());
        }

        byOperator.forEach((operatorId, weight) -> weightRepository.upsert(operatorId, sourceId, weight));
        log.info("source_weights_configured sourceId={} entries={}", sourceId, byOperator.size());
        return weightRepository.listForSource(sourceId);
    }

    @Transactional(readOnly = true)
    public List<OperatorSourceWeightRepository.WeightRow> listWeights(String sourceId) {
        requireSource(sourceId);
        return weightRepository.listForSource(sourceId);
    }

    /**
     * Refused while any request references the source; its weight rows go with it.
     */
    @Transactional
    public void deleteSource(String sourceId) {
        requireSource(sourceId);
        if (requestRepository.countBySource(sourceId) > 0) {
            throw new ConflictException("source_in_use");
        }
        sourceRepository.delete(sourceId);
        log.info("source_deleted sourceId={}", sourceId);
    }

    private SourceRepository.SourceRow requireSource(String sourceId) {
        return sourceRepository.findById(sourceId)
                .orElseThrow(() -> new NotFoundException("source_not_found"));
    }
}
