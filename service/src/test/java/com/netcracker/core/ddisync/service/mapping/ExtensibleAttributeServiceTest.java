package com.netcracker.core.ddisync.service.mapping;

import com.netcracker.core.ddisync.client.ddi.DdiClient;
import com.netcracker.core.ddisync.client.ddi.DdiTargetRegistry;
import com.netcracker.core.ddisync.exception.ValidationException;
import com.netcracker.core.ddisync.model.AttributeValue;
import com.netcracker.core.ddisync.model.ExtensibleAttributeDefinition;
import com.netcracker.core.ddisync.model.MappingSuggestions;
import com.netcracker.core.ddisync.model.NetworkRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ExtensibleAttributeServiceTest {
    private DdiClient client;
    private DdiTargetRegistry registry;
    private ExtensibleAttributeService service;

    @BeforeEach
    void setUp() {
        client = mock(DdiClient.class);
        registry = mock(DdiTargetRegistry.class);
        doReturn(client).when(registry).requireClient();
        service = new ExtensibleAttributeService(registry, new AttributeMapper());
    }

    @Test
    void createAttributeShouldValidateBeforeCallingStore() {
        assertThatThrownBy(() -> service.createAttribute("comment", "STRING", ""))
                .isInstanceOf(ValidationException.class);

        verify(client, never()).createExtensibleAttribute(any());
    }

    @Test
    void createAttributeShouldSendNormalizedDefinition() throws Exception {
        doReturn(CompletableFuture.completedFuture("extensibleattributedef/x:CostCenter"))
                .when(client).createExtensibleAttribute(any());

        String ref = service.createAttribute("CostCenter", "integer", null).get(1, TimeUnit.SECONDS);

        assertThat(ref).isEqualTo("extensibleattributedef/x:CostCenter");
        verify(client).createExtensibleAttribute(new ExtensibleAttributeDefinition("CostCenter", "INTEGER", ""));
    }

    @Test
    void suggestMappingsShouldUseStoreDefinitions() throws Exception {
        doReturn(CompletableFuture.completedFuture(List.of(
                new ExtensibleAttributeDefinition("created_by", "STRING", ""),
                new ExtensibleAttributeDefinition("owner", "EMAIL", ""))))
                .when(client).getExtensibleAttributes();

        Map<String, MappingSuggestions> suggestions = service.suggestMappings(List.of("createdby"))
                .get(1, TimeUnit.SECONDS);

        assertThat(suggestions.get("createdby").suggestions().get(0).targetKey()).isEqualTo("created_by");
    }

    @Test
    void validateMappedValuesShouldCheckDeclaredTypes() {
        List<ExtensibleAttributeDefinition> definitions = List.of(
                new ExtensibleAttributeDefinition("vlan", "INTEGER", ""),
                new ExtensibleAttributeDefinition("owner", "EMAIL", ""));
        NetworkRecord valid = new NetworkRecord("10.0.0.0/24", "1", "r", Map.of())
                .withMappedAttributes(Map.of("vlan", new AttributeValue("10"), "owner", new AttributeValue("a@b.io")));
        NetworkRecord invalid = new NetworkRecord("10.0.1.0/24", "1", "r", Map.of())
                .withMappedAttributes(Map.of("vlan", new AttributeValue("ten"), "free", new AttributeValue("?")));

        List<String> errors = service.validateMappedValues(List.of(valid, invalid), definitions);

        assertThat(errors).containsExactly("10.0.1.0/24, attribute vlan: Value 'ten' is not a valid integer");
    }

    @Test
    void validateValueShouldTreatUnknownTypeAsString() {
        assertThat(service.validateValue("anything", "COLOR")).isEmpty();
        assertThat(service.validateValue("x", "url")).isPresent();
    }
}
