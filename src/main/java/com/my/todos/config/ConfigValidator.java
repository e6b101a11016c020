package com.my.todos.config;

import io.quarkus.runtime.Startup;
import io.quarkus.runtime.configuration.ConfigUtils;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        validate(isStrict(ConfigUtils.getProfiles()));
    }

    static boolean isStrict(List<String> activeProfiles) {
        return activeProfiles.contains("prod");
    }

    void validate(boolean strict) {
        validateZone("APP_CLOCK_ZONE", appConfig.clock().zone(), strict);
        validatePositive("APP_IDEMPOTENCY_TTL_HOURS", appConfig.idempotency().ttlHours(), strict);
        validateRequired("APP_META_COMPONENT_VERSION", appConfig.meta().componentVersion(), strict);
    }

    private void validateZone(String name, String zone, boolean strict) {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            report("유효하지 않은 시간대입니다: " + name + "=" + zone, strict);
        }
    }

    private void validatePositive(String name, int value, boolean strict) {
        if (value < 1) {
            report("양수여야 하는 설정입니다: " + name + "=" + value, strict);
        }
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            report("필수 설정이 비어 있습니다: " + name, strict);
        }
    }

    private void report(String message, boolean strict) {
        if (strict) {
            throw new IllegalStateException(message);
        }
        log.warn(message);
    }
}
