package com.netcracker.core.ddisync.configuration;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DdiClientSettingsTest {

    @Test
    void defaultsShouldMatchDocumentedValues() {
        DdiClientSettings settings = DdiClientSettings.defaults();

        assertThat(settings.getRateLimitPerSecond()).isEqualTo(10);
        assertThat(settings.getMaxConnections()).isEqualTo(100);
        assertThat(settings.getMaxConnectionsPerHost()).isEqualTo(30);
        assertThat(settings.getDnsCacheTtl()).isEqualTo(Duration.ofSeconds(300));
        assertThat(settings.getConnectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(settings.getRequestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.getMaxAttempts()).isEqualTo(3);
        assertThat(settings.getRetryDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(settings.getBatchSize()).isEqualTo(10);
        assertThat(settings.getBatchPause()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void builderShouldKeepExplicitValues() {
        DdiClientSettings settings = DdiClientSettings.builder()
                .rateLimitPerSecond(50)
                .batchSize(3)
                .retryDelay(Duration.ZERO)
                .build();

        assertThat(settings.getRateLimitPerSecond()).isEqualTo(50);
        assertThat(settings.getBatchSize()).isEqualTo(3);
        assertThat(settings.getRetryDelay()).isZero();
        assertThat(settings.getPageSize()).isEqualTo(DdiClientSettings.DEFAULT_PAGE_SIZE);
    }

    @Test
    void builderShouldRejectInconsistentValues() {
        assertThatThrownBy(() -> DdiClientSettings.builder().rateLimitPerSecond(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DdiClientSettings.builder().maxConnections(10).maxConnectionsPerHost(20).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DdiClientSettings.builder().maxAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DdiClientSettings.builder().requestTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builderShouldRejectNonPositiveTimeouts() {
        assertThatThrownBy(() -> DdiClientSettings.builder().connectTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Timeouts");
        assertThatThrownBy(() -> DdiClientSettings.builder().connectTimeout(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DdiClientSettings.builder().requestTimeout(Duration.ofMillis(-5)).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(DdiClientSettings.builder().connectTimeout(Duration.ofMillis(1)).requestTimeout(Duration.ofMillis(1))
                .build().getRequestTimeout()).isEqualTo(Duration.ofMillis(1));
    }

    @Test
    void syncSettingsShouldValidate() {
        assertThat(SyncSettings.defaults().getItemDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(SyncSettings.defaults().getMaxNetworksPerRequest()).isEqualTo(10_000);
        assertThatThrownBy(() -> SyncSettings.builder().workerThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(SyncSettings.defaults().getMappingThreshold()).isEqualTo(0.8);
        assertThatThrownBy(() -> SyncSettings.builder().mappingThreshold(0.0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SyncSettings.builder().mappingThreshold(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
