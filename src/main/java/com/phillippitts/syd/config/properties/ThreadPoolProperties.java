package com.phillippitts.syd.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The star pool runs one task per star group in parallel mode. Sizing is clamped to the
 * requested worker count at dispatch time, so these values act as an upper bound.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private StarPoolProperties star = new StarPoolProperties();

    public StarPoolProperties getStar() {
        return star;
    }

    public void setStar(StarPoolProperties star) {
        this.star = star;
    }

    /**
     * Star executor pool configuration.
     */
    public static class StarPoolProperties {
        @Min(1)
        private int corePoolSize = Runtime.getRuntime().availableProcessors();
        @Min(1)
        private int maxPoolSize = Runtime.getRuntime().availableProcessors();
        @Min(0)
        private int queueCapacity = 100;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "star-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
