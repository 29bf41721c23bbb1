package io.github.drompincen.remindpal.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.remindpal.persistence.store.ReminderStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/** Loads the store at startup and writes it one last time on shutdown. */
@Configuration
public class StoreConfig {

    @Bean(initMethod = "load", destroyMethod = "save")
    ReminderStore reminderStore(@Value("${remindpal.data-dir:data}") String dataDir,
                                ObjectMapper objectMapper, Clock clock) {
        return new ReminderStore(Path.of(dataDir), objectMapper, clock);
    }
}
