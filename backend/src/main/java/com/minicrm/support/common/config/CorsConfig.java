package com.minicrm.support.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class CorsConfig {

    private final List<String> allowedOrigins;

    public CorsConfig(@Value("${app.cors.allowed-origins:*}") String allowedOriginsCsv) {
        this.allowedOrigins = parseOrigins(allowedOriginsCsv);
    }

    @Bean
    public FilterRegistrationBean<CorsFilter> apiCorsFilter() {
        var cfg = new CorsConfiguration();
        if (allowedOrigins.contains("*")) {
            cfg.setAllowedOriginPatterns(List.of("*"));
        } else {
            cfg.setAllowedOrigins(allowedOrigins);
        }
        cfg.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        cfg.setAllowedHeaders(List.of("*"));
        cfg.setMaxAge(3600L);
        cfg.setAllowCredentials(false);

        var source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/v1/**", cfg);

        var bean = new FilterRegistrationBean<>(new CorsFilter(source));
        bean.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return bean;
    }


    static List<String> parseOrigins(String csv) {
        var out = new ArrayList<String>();
        if (csv == null || csv.isBlank()) {
            return out;
        }
        for (var raw : csv.split(",")) {
            var t = raw == null ? "" : raw.trim();
            if (!t.isBlank() && !out.contains(t)) out.add(t);
        }
        return out;
    }
}
