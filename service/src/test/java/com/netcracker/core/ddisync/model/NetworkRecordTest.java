package com.netcracker.core.ddisync.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NetworkRecordTest {

    @Test
    void comparableAttributesShouldFallBackToTagsUntilMapped() {
        NetworkRecord network = new NetworkRecord("10.0.0.0/24", "123", "us-east-1", Map.of("Environment", "prod"));

        assertThat(network.isMapped()).isFalse();
        assertThat(network.comparableAttributes()).containsExactly(Map.entry("Environment", "prod"));

        NetworkRecord mapped = network.withMappedAttributes(Map.of("environment", new AttributeValue("prod")));

        assertThat(mapped.isMapped()).isTrue();
        assertThat(mapped.comparableAttributes()).containsExactly(Map.entry("environment", "prod"));
        assertThat(mapped.tags()).isEqualTo(network.tags());
    }

    @Test
    void emptyMappingStillCountsAsMapped() {
        NetworkRecord mapped = new NetworkRecord("10.0.0.0/24", "123", "us-east-1", Map.of("Environment", "prod"))
                .withMappedAttributes(Map.of());

        assertThat(mapped.isMapped()).isTrue();
        assertThat(mapped.comparableAttributes()).isEmpty();
    }

    @Test
    void generatedCommentShouldNameAccountAndRegion() {
        NetworkRecord network = new NetworkRecord("10.0.0.0/24", "123456789012", "eu-west-1", Map.of());

        assertThat(network.generatedComment()).isEqualTo("AWS Account: 123456789012, Region: eu-west-1");
    }

    @Test
    void unwrapShouldReadEnvelopedValues() {
        assertThat(AttributeValue.unwrap(Map.of("value", 10, "inheritance_source", "x"))).isEqualTo("10");
        assertThat(AttributeValue.unwrap(new AttributeValue("prod"))).isEqualTo("prod");
        assertThat(AttributeValue.unwrap("plain")).isEqualTo("plain");
        assertThat(AttributeValue.unwrap(null)).isNull();
    }
}
