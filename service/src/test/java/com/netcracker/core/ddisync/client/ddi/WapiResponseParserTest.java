package com.netcracker.core.ddisync.client.ddi;

import com.netcracker.core.ddisync.model.TargetNetwork;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WapiResponseParserTest {

    @Test
    void pageShouldReadPagedObject() {
        WapiResponseParser.Page page = WapiResponseParser.page(WapiResponseParser.readBody("""
                {"result": [{"_ref": "network/a:10.0.0.0/24/default", "network": "10.0.0.0/24"}],
                 "next_page_id": "789c"}
                """));

        assertThat(page.networks()).extracting(TargetNetwork::cidr).containsExactly("10.0.0.0/24");
        assertThat(page.nextPageId()).isEqualTo("789c");
    }

    @Test
    void pageShouldTreatPlainArrayAsLastPage() {
        WapiResponseParser.Page page = WapiResponseParser.page(WapiResponseParser.readBody("""
                [{"network": "10.0.0.0/24"}, {"network": "10.0.1.0/24"}]
                """));

        assertThat(page.networks()).hasSize(2);
        assertThat(page.nextPageId()).isNull();
    }

    @Test
    void networkShouldKeepAttributeEnvelopes() {
        List<TargetNetwork> networks = WapiResponseParser.networks(WapiResponseParser.readBody("""
                [{"_ref": "network/a", "network": "10.0.0.0/24", "comment": "c",
                  "extattrs": {"environment": {"value": "prod"}, "vlan": {"value": 10}}}]
                """));

        TargetNetwork network = networks.get(0);
        assertThat(network.ref()).isEqualTo("network/a");
        assertThat(network.comment()).isEqualTo("c");
        assertThat(network.attributeValue("environment")).isEqualTo("prod");
        assertThat(network.attributeValue("vlan")).isEqualTo("10");
    }

    @Test
    void readRefShouldPreferLocationThenBody() {
        assertThat(WapiResponseParser.readRef("network/x", "\"network/y\"")).isEqualTo("network/x");
        assertThat(WapiResponseParser.readRef(null, "\"network/y\"")).isEqualTo("network/y");
        assertThat(WapiResponseParser.readRef(null, "{\"_ref\": \"network/z\"}")).isEqualTo("network/z");
        assertThat(WapiResponseParser.readRef(null, "")).isEmpty();
    }

    @Test
    void readBodyShouldKeepNonJsonAsText() {
        assertThat(WapiResponseParser.readBody("network/raw").asText()).isEqualTo("network/raw");
        assertThat(WapiResponseParser.readBody(null).isNull()).isTrue();
    }
}
