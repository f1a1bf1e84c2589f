package io.github.drompincen.bugflow.gateway.config;

import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.protocol.api.UserRole;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets query and path parameters use the wire labels ({@code In Progress},
 * {@code tester}) the JSON bodies use.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, BugStatus.class, (Converter<String, BugStatus>) BugStatus::fromLabel);
        registry.addConverter(String.class, UserRole.class, (Converter<String, UserRole>) UserRole::fromLabel);
    }
}
