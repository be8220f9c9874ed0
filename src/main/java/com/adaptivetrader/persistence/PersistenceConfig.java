package com.adaptivetrader.persistence;

import java.nio.file.Path;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine state persistence settings. Properties prefix: {@code adaptivetrader.persistence.*}.
 *
 * <p>Disabled by default so tests and throwaway runs start with empty memory.
 */
@Data
@Component
@ConfigurationProperties(prefix = "adaptivetrader.persistence")
public class PersistenceConfig {

    private boolean enabled = false;
    private Path file = Path.of("data", "engine-state.json");
    private Duration flushInterval = Duration.ofMinutes(1);
}
