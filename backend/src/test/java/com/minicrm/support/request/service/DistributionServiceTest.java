package com.minicrm.support.request.service;

import com.minicrm.support.bootstrap.MiniCrmApplication;
import com.minicrm.support.common.api.NotFoundException;
import com.minicrm.support.operator.repo.OperatorRepository;
import com.minicrm.support.request.repo.RequestRepository;
import com.minicrm.support.request.repo.RequestStatus;
import com.minicrm.support.source.repo.OperatorSourceWeightRepository;
import com.minicrm.support.source.repo.SourceRepository;
import com.minicrm.support.user.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;

@SpringBootTest(classes = MiniCrmApplication.class)
@ActiveProfiles("dev")
class DistributionServiceTest {

    @Autowired
    DistributionService distributionService;

    @Autowired
    OperatorRepository operatorRepository;

    @Autowired
    SourceRepository sourceRepository;

    @Autowired
    OperatorSourceWeightRepository weightRepository;

    @Autowired
    UserService userService;

    @SpyBean
    RequestRepository requestRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    private String sourceId;
    private String userId;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("delete from requests");
        jdbcTemplate.update("delete from operator_source_weights");
        jdbcTemplate.update("delete from users");
        jdbcTemplate.update("delete from sources");
        jdbcTemplate.update("delete from operators");

        sourceId = sourceRepository.create("Telegram bot", "tg-bot");
        userId = userService.getOrCreate("alice@example.com");
    }

    @Test
    void availability_requires_active_capacity_and_weight_in_every_combination() {
        var expectedIds = new ArrayList<String>();
        for (int mask = 0; mask < 8; mask++) {
            boolean active = (mask & 1) != 0;
            boolean underCapacity = (mask & 2) != 0;
            boolean weighted = (mask & 4) != 0;

            var id = operatorRepository.create("op-" + mask, 2);
            jdbcTemplate.update("update operators set is_active = ?, current_load = ? where id = ?",
                    active, underCapacity ? 1 : 2, id);
            if (weighted) {
                weightRepository.upsert(id, sourceId, 10 + mask);
            }
            if (active && underCapacity && weighted) {
                expectedIds.add(id);
            }
        }

        var available = distributionService.availableOperators(sourceId);

        assertThat(available).extracting(c -> c.candidate().id()).containsExactlyInAnyOrderElementsOf(expectedIds);
        assertThat(available).hasSize(1);
        assertThat(available.get(0).weight()).isEqualTo(17);
    }

    @Test
    void unknown_source_has_no_available_operators() {
        var op = operatorRepository.create("Bob", 3);
        weightRepository.upsert(op, sourceId, 50);

        assertThat(distributionService.availableOperators("src_missing")).isEmpty();
    }

    @Test
    void weight_for_another_source_does_not_count() {
        var other = sourceRepository.create("Email", "email");
        var op = operatorRepository.create("Bob", 3);
        weightRepository.upsert(op, other, 50);

        assertThat(distributionService.availableOperators(sourceId)).isEmpty();
    }

    @Test
    void distribute_assigns_and_increments_load_by_exactly_one() {
        var op = operatorRepository.create("Bob", 3);
        weightRepository.upsert(op, sourceId, 100);
        var requestId = requestRepository.createPending(userId, sourceId, "hello");

        var assigned = distributionService.distribute(requestId, sourceId);

        assertThat(assigned).contains(op);
        var request = requestRepository.findById(requestId).orElseThrow();
        assertThat(request.status()).isEqualTo(RequestStatus.ASSIGNED);
        assertThat(request.operatorId()).isEqualTo(op);
        assertThat(operatorRepository.findById(op).orElseThrow().currentLoad()).isEqualTo(1);
    }

    @Test
    void distribute_without_candidates_marks_waiting_and_leaves_loads_alone() {
        var busy = operatorRepository.create("Busy", 1);
        weightRepository.upsert(busy, sourceId, 100);
        jdbcTemplate.update("update operators set current_load = 1 where id = ?", busy);
        var inactive = operatorRepository.create("Away", 5);
        weightRepository.upsert(inactive, sourceId, 100);
        operatorRepository.toggleActive(inactive);

        var requestId = requestRepository.createPending(userId, sourceId, "anyone?");

        assertThat(distributionService.distribute(requestId, sourceId)).isEmpty();

        var request = requestRepository.findById(requestId).orElseThrow();
        assertThat(request.status()).isEqualTo(RequestStatus.WAITING);
        assertThat(request.operatorId()).isNull();
        assertThat(operatorRepository.findById(busy).orElseThrow().currentLoad()).isEqualTo(1);
        assertThat(operatorRepository.findById(inactive).orElseThrow().currentLoad()).isZero();
    }

    @Test
    void failed_request_update_rolls_back_the_load_increment() {
        var op = operatorRepository.create("Bob", 3);
        weightRepository.upsert(op, sourceId, 100);
        var requestId = requestRepository.createPending(userId, sourceId, "hello");

        doThrow(new IllegalStateException("storage_down")).when(requestRepository).assignOperator(anyString(), anyString());

        assertThatThrownBy(() -> distributionService.distribute(requestId, sourceId))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("storage_down");

        var request = requestRepository.findById(requestId).orElseThrow();
        assertThat(request.status()).isEqualTo(RequestStatus.PENDING);
        assertThat(request.operatorId()).isNull();
        assertThat(operatorRepository.findById(op).orElseThrow().currentLoad()).isZero();
    }

    @Test
    void assign_unknown_request_is_not_found_and_rolls_back() {
        var op = operatorRepository.create("Bob", 3);

        assertThatThrownBy(() -> distributionService.assign("req_missing", op))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("request_not_found");
        assertThat(operatorRepository.findById(op).orElseThrow().currentLoad()).isZero();
    }

    @Test
    void assign_unknown_operator_is_not_found() {
        var requestId = requestRepository.createPending(userId, sourceId, "hello");

        assertThatThrownBy(() -> distributionService.assign(requestId, "op_missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("operator_not_found");
        assertThat(requestRepository.findById(requestId).orElseThrow().status()).isEqualTo(RequestStatus.PENDING);
    }

    @Test
    void mark_waiting_unknown_request_is_not_found() {
        assertThatThrownBy(() -> distributionService.markWaiting("req_missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("request_not_found");
    }

    @Test
    void default_mode_does_not_recheck_capacity_at_increment() {
        var op = operatorRepository.create("Bob", 1);
        jdbcTemplate.update("update operators set current_load = 1 where id = ?", op);
        var requestId = requestRepository.createPending(userId, sourceId, "late");

        // caller already decided; the ledger only counts
        distributionService.assign(requestId, op);

        assertThat(operatorRepository.findById(op).orElseThrow().currentLoad()).isEqualTo(2);
    }
}
