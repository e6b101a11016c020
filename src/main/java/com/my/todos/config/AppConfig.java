package com.my.todos.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    MetaConfig meta();

    ClockConfig clock();

    IdempotencyConfig idempotency();

    interface MetaConfig {
        @WithName("component-version")
        @WithDefault("0.1.0")
        String componentVersion();

        @WithName("schema-version")
        @WithDefault("1")
        long schemaVersion();
    }

    interface ClockConfig {
        @WithName("zone")
        @WithDefault("UTC")
        String zone();
    }

    interface IdempotencyConfig {
        @WithName("ttl-hours")
        @WithDefault("24")
        int ttlHours();
    }
}
