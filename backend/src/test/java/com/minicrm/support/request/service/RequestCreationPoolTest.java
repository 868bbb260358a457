package com.minicrm.support.request.service;

import com.minicrm.support.bootstrap.MiniCrmApplication;
import com.minicrm.support.request.repo.RequestStatus;
import com.minicrm.support.source.repo.SourceRepository;
import com.minicrm.support.user.repo.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;

/**
 * First-contact requests use one pooled connection each, so as many of them as the pool holds can run
 * at once.
 */
@SpringBootTest(classes = MiniCrmApplication.class, properties = {
        "spring.datasource.hikari.maximum-pool-size=2",
        "spring.datasource.hikari.connection-timeout=1000"
})
@ActiveProfiles("dev")
class RequestCreationPoolTest {

    @Autowired
    RequestService requestService;

    @SpyBean
    UserRepository userRepository;

    @Autowired
    SourceRepository sourceRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    private String sourceId;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("delete from requests");
        jdbcTemplate.update("delete from operator_source_weights");
        jdbcTemplate.update("delete from users");
        jdbcTemplate.update("delete from sources");
        jdbcTemplate.update("delete from operators");

        sourceId = sourceRepository.create("Telegram", "tg");
    }

    @Test
    void new_users_fill_the_pool_without_waiting_for_extra_connections() throws Exception {
        int threads = 2;
        var barrier = new CyclicBarrier(threads);
        var lookups = new AtomicInteger();
        // hold both transactions open at the first user lookup
        doAnswer(inv -> {
            if (lookups.getAndIncrement() < threads) {
                barrier.await(10, TimeUnit.SECONDS);
            }
            return inv.callRealMethod();
        }).when(userRepository).findByIdentifier(anyString());

        var pool = Executors.newFixedThreadPool(threads);
        try {
            var futures = new ArrayList<Future<RequestStatus>>();
            for (int i = 0; i < threads; i++) {
                var identifier = "new-user-" + i;
                Callable<RequestStatus> task = () -> requestService.createRequest(identifier, sourceId, "hello").status();
                futures.add(pool.submit(task));
            }

            for (var f : futures) {
                assertThat(f.get(30, TimeUnit.SECONDS)).isEqualTo(RequestStatus.WAITING);
            }
        } finally {
            pool.shutdownNow();
        }

        var users = jdbcTemplate.queryForObject("select count(*) from users", Integer.class);
        var requests = jdbcTemplate.queryForObject("select count(*) from requests", Integer.class);
        assertThat(users).isEqualTo(2);
        assertThat(requests).isEqualTo(2);
    }
}
