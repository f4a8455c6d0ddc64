package com.flagship.account_service.config;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.header.HeaderWriter;
import org.springframework.security.web.header.writers.ContentSecurityPolicyHeaderWriter;
import org.springframework.security.web.header.writers.DelegatingRequestMatcherHeaderWriter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.security.web.header.writers.StaticHeadersWriter;
import org.springframework.security.web.header.writers.XContentTypeOptionsHeaderWriter;
import org.springframework.security.web.header.writers.frameoptions.XFrameOptionsHeaderWriter;
import org.springframework.security.web.header.writers.frameoptions.XFrameOptionsHeaderWriter.XFrameOptionsMode;
import org.springframework.security.web.util.matcher.RequestMatcher;

/**
 * Response header policy for every endpoint.
 *
 * The API is open (no authentication). Spring Security is only used for its header writers:
 * security headers are attached to requests that arrived over a secure transport, and the
 * wildcard CORS origin is attached to every response.
 */
@Configuration
public class SecurityConfig {

    public static final String CONTENT_SECURITY_POLICY = "default-src 'self'; object-src 'none'";

    private static final RequestMatcher SECURE_TRANSPORT = HttpServletRequest::isSecure;

    @Bean
    SecurityFilterChain apiSecurity(HttpSecurity http) throws Exception {
        http
            .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
            .csrf(csrf -> csrf.disable())
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .headers(headers -> headers
                .defaultsDisabled()
                .addHeaderWriter(secureOnly(new XFrameOptionsHeaderWriter(XFrameOptionsMode.SAMEORIGIN)))
                .addHeaderWriter(secureOnly(new XContentTypeOptionsHeaderWriter()))
                .addHeaderWriter(secureOnly(new ContentSecurityPolicyHeaderWriter(CONTENT_SECURITY_POLICY)))
                .addHeaderWriter(secureOnly(new ReferrerPolicyHeaderWriter(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)))
                .addHeaderWriter(new StaticHeadersWriter("Access-Control-Allow-Origin", "*"))
            );
        return http.build();
    }

    private static HeaderWriter secureOnly(HeaderWriter writer) {
        return new DelegatingRequestMatcherHeaderWriter(SECURE_TRANSPORT, writer);
    }
}
