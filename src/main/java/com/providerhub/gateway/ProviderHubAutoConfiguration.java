package com.providerhub.gateway;

import com.providerhub.observability.LlmTrafficLog;
import com.providerhub.observability.MetricsConfig;
import com.providerhub.providers.ProviderFactory;
import com.providerhub.routing.ProviderManager;
import com.providerhub.routing.Sleeper;
import com.providerhub.shared.config.ConfigLoader;
import com.providerhub.shared.config.ProviderHubConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * Exposes a {@link ProviderManager} built from the YAML config and every
 * {@link ProviderFactory} bean in the context; the bean name is the
 * provider identity.
 */
@AutoConfiguration
public class ProviderHubAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ProviderHubAutoConfiguration.class);

    @Bean
    public ProviderHubConfig providerHubConfig(@Value("${providerhub.config:}") String configPath) {
        if (configPath == null || configPath.isBlank()) {
            return ConfigLoader.load();
        }
        log.info("Loading provider config from {}", configPath);
        return ConfigLoader.load(Path.of(configPath));
    }

    @Bean
    public LlmTrafficLog llmTrafficLog() {
        return new LlmTrafficLog();
    }

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public ProviderManager providerManager(ProviderHubConfig config,
                                           ListableBeanFactory beanFactory,
                                           ObjectProvider<MeterRegistry> meterRegistry,
                                           LlmTrafficLog traffic) {
        var registry = meterRegistry.getIfAvailable();
        var meters = registry != null ? new MetricsConfig(registry) : new MetricsConfig();
        Map<String, ProviderFactory> factories = beanFactory.getBeansOfType(ProviderFactory.class);
        return new ProviderManager(config, factories, meters, traffic, Sleeper.THREAD, Clock.systemUTC());
    }
}
