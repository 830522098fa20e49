/*
 * どこで: Dispatcher テスト基盤
 * 何を: Testcontainers(Postgres) と DataSource/Flyway の共通設定を提供する
 * なぜ: claim の SKIP LOCKED や部分一意インデックスを本物の Postgres で検証するため
 */
package com.example.dispatcher;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

public abstract class AbstractPostgresContainerTest {

    // テスト全体で 1 つのコンテナを共有する
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    static {
        // @DynamicPropertySource が参照する前に起動しておく
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.hikari.schema", () -> "dispatch");

        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.flyway.locations", () -> "classpath:db/migration");
        registry.add("spring.flyway.default-schema", () -> "dispatch");
        registry.add("spring.flyway.schemas", () -> "dispatch");
        registry.add("spring.flyway.create-schemas", () -> "true");
        registry.add("spring.flyway.table", () -> "flyway_schema_history_dispatch");
    }
}
