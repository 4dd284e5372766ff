package com.netcracker.core.ddisync.configuration;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

class DdiTargetConfigTest {

    @Test
    void baseUrlShouldDefaultToHttpsAndVersionedRoot() {
        DdiTargetConfig config = DdiTargetConfig.builder()
                .host("ddi.example.com")
                .username("admin")
                .password("secret")
                .build();

        assertThat(config.baseUrl()).isEqualTo("https://ddi.example.com/wapi/v2.13.1/");
    }

    @Test
    void baseUrlShouldKeepExplicitSchemeAndDropTrailingSlash() {
        DdiTargetConfig config = DdiTargetConfig.builder()
                .host("http://127.0.0.1:8080/")
                .username("admin")
                .password("secret")
                .apiVersion("2.12")
                .build();

        assertThat(config.baseUrl()).isEqualTo("http://127.0.0.1:8080/wapi/v2.12/");
    }

    @Test
    void toStringShouldNotExposePassword() {
        DdiTargetConfig config = DdiTargetConfig.builder().host("h").username("u").password("top-secret").build();

        assertThat(config.toString()).doesNotContain("top-secret");
    }

    @Test
    void builderShouldRejectBlankCredentials() {
        assertThatThrownBy(() -> DdiTargetConfig.builder().host("h").username(" ").password("p").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DdiTargetConfig.builder().host("h").username("u").password("").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void initialTargetShouldBeEmptyWithoutHost() {
        DdiSyncProperties.Target target = mock(DdiSyncProperties.Target.class);
        doReturn(Optional.empty()).when(target).host();

        assertThat(DdiSyncConfiguration.initialTarget(target)).isEmpty();
    }

    @Test
    void initialTargetShouldCarryConfiguredValues() {
        DdiSyncProperties.Target target = mock(DdiSyncProperties.Target.class);
        doReturn(Optional.of("ddi.example.com")).when(target).host();
        doReturn(Optional.of("admin")).when(target).username();
        doReturn(Optional.of("secret")).when(target).password();
        doReturn("wapi").when(target).apiRoot();
        doReturn("2.13.1").when(target).apiVersion();
        doReturn(true).when(target).trustAll();

        Optional<DdiTargetConfig> config = DdiSyncConfiguration.initialTarget(target);

        assertThat(config).isPresent();
        assertThat(config.get().isTrustAll()).isTrue();
        assertThat(config.get().getUsername()).isEqualTo("admin");
    }
}
