package com.minicrm.support.common.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CorsConfigTest {

    @Test
    void parses_and_dedupes_origins() {
        assertThat(CorsConfig.parseOrigins(" http://a.test ,http://b.test,, http://a.test "))
                .containsExactly("http://a.test", "http://b.test");
    }

    @Test
    void blank_input_yields_no_origins() {
        assertThat(CorsConfig.parseOrigins(null)).isEmpty();
        assertThat(CorsConfig.parseOrigins("   ")).isEmpty();
    }

    @Test
    void wildcard_is_kept() {
        assertThat(CorsConfig.parseOrigins("*")).containsExactly("*");
    }
}
