package com.minicrm.support.request.service;

import com.minicrm.support.common.api.NotFoundException;
import com.minicrm.support.operator.repo.OperatorRepository;
import com.minicrm.support.request.repo.RequestRepository;
import com.minicrm.support.request.service.distribution.WeightedCandidate;
import com.minicrm.support.request.service.distribution.WeightedSelector;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Routes a pending request to an operator of its source.
 * <p>
 * Filter, then weighted pick, then either {@link #assign} (load increment and request update in one
 * transaction) or {@link #markWaiting}. The capacity check happens in the filter query; with the default
 * settings two concurrent distributions may both pass it and push an operator past
 * {@code max_load_limit}. {@code app.distribution.strict-capacity=true} closes that window with a
 * conditional increment and re-picks among the remaining candidates when a slot was lost.
 */
@Service
public class DistributionService {

    private static final Logger log = LoggerFactory.getLogger(DistributionService.class);

    private final OperatorRepository operatorRepository;
    private final RequestRepository requestRepository;
    private final WeightedSelector weightedSelector;
    private final boolean strictCapacity;

    private final Counter assignedTotal;
    private final Counter waitingTotal;
    private final Counter capacityRaceTotal;
    private final Timer distributeDuration;

    public DistributionService(
            OperatorRepository operatorRepository,
            RequestRepository requestRepository,
            WeightedSelector weightedSelector,
            MeterRegistry meterRegistry,
            @Value("${app.distribution.strict-capacity:false}") boolean strictCapacity
    ) {
        this.operatorRepository = operatorRepository;
        this.requestRepository = requestRepository;
        this.weightedSelector = weightedSelector;
        this.strictCapacity = strictCapacity;

        // Low-cardinality metrics: do NOT tag by operator/source/request.
        this.assignedTotal = Counter.builder("minicrm.distribution.assigned")
                .description("Requests assigned to an operator")
                .register(meterRegistry);
        this.waitingTotal = Counter.builder("minicrm.distribution.waiting")
                .description("Requests left waiting because no operator was available")
                .register(meterRegistry);
        this.capacityRaceTotal = Counter.builder("minicrm.distribution.capacity_race")
                .description("Picked operators that filled up before the conditional increment")
                .register(meterRegistry);
        this.distributeDuration = Timer.builder("minicrm.distribution.duration")
                .description("Duration of a single request distribution")
                .register(meterRegistry);
    }

    /**
     * Operators eligible for a new request from the source, paired with their weight for it.
     */
    @Transactional(readOnly = true)
    public List<WeightedCandidate<OperatorRepository.OperatorRow>> availableOperators(String sourceId) {
        return operatorRepository.listAvailableForSource(sourceId).stream()
                .map(r -> new WeightedCandidate<>(r.operator(), r.weight()))
                .toList();
    }

    /**
     * @return the assigned operator id, or empty when the request was marked waiting
     */
    @Transactional
    public Optional<String> distribute(String requestId, String sourceId) {
        Timer.Sample sample = Timer.start();
        try {
            var candidates = new ArrayList<>(availableOperators(sourceId));

            while (!candidates.isEmpty()) {
                var picked = weightedSelector.select(candidates).orElse(null);
                if (picked == null) {
                    // all-zero weights
                    break;
                }

                if (assignWithinCapacity(requestId, picked.id())) {
                    assignedTotal.increment();
                    log.info("request_distributed requestId={} sourceId={} operatorId={} candidates={}",
                            requestId, sourceId, picked.id(), candidates.size());
                    return Optional.of(picked.id());
                }

                capacityRaceTotal.increment();
                log.info("operator_capacity_race requestId={} operatorId={}", requestId, picked.id());
                candidates.removeIf(c -> picked.id().equals(c.candidate().id()));
            }

            markWaiting(requestId);
            waitingTotal.increment();
            log.info("request_waiting requestId={} sourceId={}", requestId, sourceId);
            return Optional.empty();
        } finally {
            sample.stop(distributeDuration);
        }
    }

    /**
     * Sets the operator and {@code assigned} status on the request and adds one to the operator's load.
     * Both writes commit together or not at all.
     *
     * @throws NotFoundException {@code operator_not_found} or {@code request_not_found}
     */
    @Transactional
    public void assign(String requestId, String operatorId) {
        if (operatorRepository.incrementLoad(operatorId) == 0) {
            throw new NotFoundException("operator_not_found");
        }
        if (requestRepository.assignOperator(requestId, operatorId) == 0) {
            throw new NotFoundException("request_not_found");
        }
    }

    /**
     * @throws NotFoundException {@code request_not_found}
     */
    @Transactional
    public void markWaiting(String requestId) {
        if (requestRepository.markWaiting(requestId) == 0) {
            throw new NotFoundException("request_not_found");
        }
    }

    private boolean assignWithinCapacity(String requestId, String operatorId) {
        if (!strictCapacity) {
            assign(requestId, operatorId);
            return true;
        }

        if (operatorRepository.tryIncrementLoad(operatorId) == 0) {
            if (!operatorRepository.exists(operatorId)) {
                throw new NotFoundException("operator_not_found");
            }
            return false;
        }
        if (requestRepository.assignOperator(requestId, operatorId) == 0) {
            throw new NotFoundException("request_not_found");
        }
        return true;
    }
}
