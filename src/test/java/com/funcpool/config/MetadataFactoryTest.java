package com.funcpool.config;

import com.funcpool.storage.FunctionMetadata;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetadataFactoryTest {

    @Test
    void testMetadataCarriesIdentityAndUtcTime() {
        PoolConfig config = PoolConfig.builder()
                .author("alice")
                .userName("Alice Martin")
                .userEmail("alice@example.org")
                .build();
        Clock clock = Clock.fixed(Instant.parse("2025-02-14T23:59:59.999Z"), ZoneId.of("Europe/Paris"));
        String parent = "a".repeat(64);

        FunctionMetadata metadata = new MetadataFactory(config, clock).create(parent, List.of("b".repeat(64)));

        assertThat(metadata.getCreated()).isEqualTo("2025-02-14T23:59:59Z");
        assertThat(metadata.getAuthor()).isEqualTo("alice");
        assertThat(metadata.getName()).isEqualTo("Alice Martin");
        assertThat(metadata.getEmail()).isEqualTo("alice@example.org");
        assertThat(metadata.getParent()).isEqualTo(parent);
        assertThat(metadata.getChecks()).containsExactly("b".repeat(64));
    }

    @Test
    void testNullChecksBecomeEmpty() {
        FunctionMetadata metadata = new MetadataFactory(PoolConfig.builder().build()).create(null, null);

        assertThat(metadata.getChecks()).isEmpty();
        assertThat(metadata.getParent()).isNull();
        assertThat(metadata.getCreated()).endsWith("Z");
    }
}
