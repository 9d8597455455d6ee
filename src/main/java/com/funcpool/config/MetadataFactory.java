package com.funcpool.config;

import com.funcpool.storage.FunctionMetadata;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Creates the metadata of newly written objects from the configured user identity.
 */
public class MetadataFactory {

    private static final DateTimeFormatter CREATED = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'")
            .withZone(ZoneOffset.UTC);

    private final PoolConfig config;
    private final Clock clock;

    public MetadataFactory(PoolConfig config) {
        this(config, Clock.systemUTC());
    }

    public MetadataFactory(PoolConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public FunctionMetadata create(String parent, List<String> checks) {
        return FunctionMetadata.builder()
                .created(CREATED.format(clock.instant().truncatedTo(ChronoUnit.SECONDS)))
                .author(config.getAuthor())
                .name(config.getUserName())
                .email(config.getUserEmail())
                .parent(parent)
                .checks(checks == null ? List.of() : List.copyOf(checks))
                .build();
    }
}
