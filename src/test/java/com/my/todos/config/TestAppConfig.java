package com.my.todos.config;

public class TestAppConfig implements AppConfig {

    private final String zone;
    private final int ttlHours;
    private final String componentVersion;

    public TestAppConfig() {
        this("UTC", 1, "0.1.0");
    }

    public TestAppConfig(String zone, int ttlHours, String componentVersion) {
        this.zone = zone;
        this.ttlHours = ttlHours;
        this.componentVersion = componentVersion;
    }

    @Override
    public MetaConfig meta() {
        return new MetaConfig() {
            @Override
            public String componentVersion() {
                return componentVersion;
            }

            @Override
            public long schemaVersion() {
                return 1;
            }
        };
    }

    @Override
    public ClockConfig clock() {
        return () -> zone;
    }

    @Override
    public IdempotencyConfig idempotency() {
        return () -> ttlHours;
    }
}
