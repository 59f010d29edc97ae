package com.hivemind.core.config;

import com.hivemind.core.state.HierarchyStore;
import com.hivemind.core.state.InMemoryStateRepository;
import com.hivemind.core.state.JsonFileStateRepository;
import com.hivemind.core.state.StateMapper;
import com.hivemind.core.state.StateRepository;
import com.hivemind.core.sync.ExternalSync;
import com.hivemind.core.sync.LoggingExternalSync;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class HivemindConfig {

    private static final Logger log = LoggerFactory.getLogger(HivemindConfig.class);

    @Bean
    public StateMapper stateMapper() {
        return new StateMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * File-backed state shared between agent processes, or in-memory when
     * {@code hivemind.store.state-file} is blank.
     */
    @Bean
    public StateRepository stateRepository(HivemindProperties properties, StateMapper mapper) {
        String stateFile = properties.getStore().getStateFile();
        if (stateFile == null || stateFile.isBlank()) {
            log.info("No state file configured, keeping hierarchy state in memory");
            return new InMemoryStateRepository(mapper);
        }
        log.info("Hierarchy state file: {}", stateFile);
        return new JsonFileStateRepository(Path.of(stateFile), mapper);
    }

    @Bean
    public HierarchyStore hierarchyStore(StateRepository repository, StateMapper mapper, Clock clock,
                                         HivemindProperties properties) {
        return new HierarchyStore(repository, mapper, clock,
                properties.getStore().getConflictRetries(), properties.getStore().getConflictBackoffMs());
    }

    @Bean
    @ConditionalOnMissingBean(ExternalSync.class)
    public ExternalSync externalSync() {
        return new LoggingExternalSync();
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
