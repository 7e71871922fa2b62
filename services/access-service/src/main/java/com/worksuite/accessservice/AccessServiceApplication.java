package com.worksuite.accessservice;

import com.worksuite.accessservice.config.AccessControlProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Reference service that puts the access control engine in front of a small HTTP API.
 * <p>
 * Every {@code /api/**} request is authenticated by {@link
 * com.worksuite.accessservice.infrastructure.web.AuthorizationFilter}; controllers then ask the
 * {@link com.worksuite.security.AccessDecisionPoint} for each check and let {@link
 * com.worksuite.accessservice.infrastructure.web.GlobalExceptionHandler} turn denials into RFC 7807
 * responses.
 */
@SpringBootApplication
@EnableConfigurationProperties(AccessControlProperties.class)
public class AccessServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessServiceApplication.class, args);
    }
}
