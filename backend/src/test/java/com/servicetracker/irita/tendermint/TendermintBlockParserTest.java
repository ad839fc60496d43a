package com.servicetracker.irita.tendermint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicetracker.irita.event.Block;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TendermintBlockParserTest {

    private final TendermintBlockParser parser = new TendermintBlockParser(new ObjectMapper());

    @Test
    @DisplayName("status: latest height is read from sync_info")
    void latestHeight() {
        String json = """
                {"jsonrpc":"2.0","id":1,"result":{"node_info":{},"sync_info":{"latest_block_height":"1234","catching_up":false}}}
                """;
        assertThat(parser.parseLatestHeight(json)).isEqualTo(1234L);
    }

    @Test
    @DisplayName("block_results: base64 attribute keys and values are decoded")
    void base64Attributes() {
        String json = """
                {"jsonrpc":"2.0","id":2,"result":{"height":"57","end_block_events":[
                  {"type":"new_batch_request_provider","attributes":[
                    {"key":"cHJvdmlkZXI=","value":"aWFhMXA=","index":true},
                    {"key":"c2VydmljZV9uYW1l","value":"b3JhY2xl","index":true},
                    {"key":"cmVxdWVzdHM=","value":"WyJyZXEtMSIsInJlcS0yIl0=","index":true}
                  ]}
                ]}}
                """;

        Block block = parser.parseBlockResults(json, true);

        assertThat(block.height()).isEqualTo(57L);
        assertThat(block.endBlockEvents()).hasSize(1);
        assertThat(block.endBlockEvents().get(0).type()).isEqualTo("new_batch_request_provider");
        assertThat(block.endBlockEvents().get(0).attribute("provider")).isEqualTo("iaa1p");
        assertThat(block.endBlockEvents().get(0).attribute("service_name")).isEqualTo("oracle");
        assertThat(block.endBlockEvents().get(0).attribute("requests")).isEqualTo("[\"req-1\",\"req-2\"]");
    }

    @Test
    @DisplayName("block_results: null end_block_events gives an empty block; finalize_block_events is read instead")
    void missingEndBlockEvents() {
        String empty = """
                {"jsonrpc":"2.0","id":3,"result":{"height":"58","end_block_events":null}}
                """;
        assertThat(parser.parseBlockResults(empty, false).endBlockEvents()).isEmpty();

        String finalize = """
                {"jsonrpc":"2.0","id":4,"result":{"height":59,"finalize_block_events":[
                  {"type":"new_batch_request","attributes":[{"key":"service_name","value":"oracle"}]}
                ]}}
                """;
        Block block = parser.parseBlockResults(finalize, false);
        assertThat(block.height()).isEqualTo(59L);
        assertThat(block.endBlockEvents().get(0).attribute("service_name")).isEqualTo("oracle");
    }

    @Test
    @DisplayName("block_results: a null attribute value decodes to an empty string")
    void nullAttributeValue() {
        String json = """
                {"jsonrpc":"2.0","id":6,"result":{"height":"60","end_block_events":[
                  {"type":"new_batch_request_provider","attributes":[
                    {"key":"bWVtbw==","value":null,"index":true},
                    {"key":"c2VydmljZV9uYW1l","value":"b3JhY2xl","index":true}
                  ]}
                ]}}
                """;

        Block block = parser.parseBlockResults(json, true);

        assertThat(block.endBlockEvents().get(0).attribute("memo")).isEmpty();
        assertThat(block.endBlockEvents().get(0).attribute("service_name")).isEqualTo("oracle");
    }

    @Test
    @DisplayName("JSON-RPC error and garbage bodies raise RpcException")
    void errors() {
        String error = """
                {"jsonrpc":"2.0","id":5,"error":{"code":-32603,"message":"Internal error","data":"height 99 must be less than or equal to the current blockchain height 58"}}
                """;
        assertThatThrownBy(() -> parser.parseBlockResults(error, true))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("-32603");
        assertThatThrownBy(() -> parser.parseLatestHeight("not json"))
                .isInstanceOf(RpcException.class);
        assertThatThrownBy(() -> parser.parseLatestHeight("{\"result\":{\"sync_info\":{}}}"))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("latest_block_height");
    }
}
