package io.github.drompincen.remindpal.gateway.config;

import io.github.drompincen.remindpal.runtime.assistant.AiFallback;
import io.github.drompincen.remindpal.runtime.assistant.CannedAiFallback;
import io.github.drompincen.remindpal.runtime.notify.LoggingNotifier;
import io.github.drompincen.remindpal.runtime.notify.Notifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Defaults for the outbound channel and the answerer when no real ones are wired in. */
@Configuration
public class ChannelConfig {

    @Bean
    @ConditionalOnMissingBean(Notifier.class)
    Notifier notifier() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean(AiFallback.class)
    AiFallback aiFallback() {
        return new CannedAiFallback();
    }
}
