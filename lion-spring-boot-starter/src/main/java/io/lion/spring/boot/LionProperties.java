package io.lion.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Lion.
 *
 * @see LionAutoConfiguration
 */
@ConfigurationProperties(prefix = "lion")
public class LionProperties {

    private final Mappers mappers = new Mappers();

    public Mappers getMappers() {
        return mappers;
    }

    public static class Mappers {

        /**
         * Whether event mappers are scanned and registered automatically.
         */
        private boolean enabled = true;

        /**
         * Packages to scan for event mappers. Defaults to the auto-configuration
         * packages of the application (the package of {@code @SpringBootApplication}).
         */
        private List<String> basePackages = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getBasePackages() {
            return basePackages;
        }

        public void setBasePackages(List<String> basePackages) {
            this.basePackages = basePackages;
        }
    }
}
