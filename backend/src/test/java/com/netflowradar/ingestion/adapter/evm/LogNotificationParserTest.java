package com.netflowradar.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflowradar.ingestion.adapter.RpcException;
import com.netflowradar.ingestion.decoder.RawLog;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogNotificationParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LogNotificationParser parser = new LogNotificationParser(objectMapper);

    @Test
    void subscribeRequest_filtersByContractAndTopic() throws Exception {
        JsonNode request = objectMapper.readTree(parser.subscribeRequest("0xabc", "0xddf2"));

        assertThat(request.path("method").asText()).isEqualTo("eth_subscribe");
        assertThat(request.path("id").asInt()).isEqualTo(LogNotificationParser.SUBSCRIBE_REQUEST_ID);
        assertThat(request.path("params").get(0).asText()).isEqualTo("logs");
        assertThat(request.path("params").get(1).path("address").asText()).isEqualTo("0xabc");
        assertThat(request.path("params").get(1).path("topics").get(0).asText()).isEqualTo("0xddf2");
    }

    @Test
    void parse_subscriptionAck_subscribed() {
        SubscriptionFrame frame = parser.parse("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0xcd0c3e8af590364c09d0fa6a1210faf5\"}");

        assertThat(frame.kind()).isEqualTo(SubscriptionFrame.Kind.SUBSCRIBED);
        assertThat(frame.subscriptionId()).isEqualTo("0xcd0c3e8af590364c09d0fa6a1210faf5");
    }

    @Test
    void parse_notification_log() {
        String json = """
                {"jsonrpc":"2.0","method":"eth_subscription","params":{"subscription":"0xcd0c","result":{
                  "address":"0x0000000000000000000000000000000000001010",
                  "topics":["0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef",
                            "0x00000000000000000000000028c6c06298d514db089934071355e5743bf21d60",
                            "0x000000000000000000000000f977814e90da44bfa03b6295a0616a897441acec"],
                  "data":"0x00000000000000000000000000000000000000000000000000000000000003e8",
                  "blockNumber":"0x1b4","transactionHash":"0xdf829c5a","logIndex":"0x2","removed":false}}}
                """;

        SubscriptionFrame frame = parser.parse(json);

        assertThat(frame.kind()).isEqualTo(SubscriptionFrame.Kind.LOG);
        RawLog log = frame.log();
        assertThat(log.topics()).hasSize(3);
        assertThat(log.blockNumber()).isEqualTo(436L);
        assertThat(log.logIndex()).isEqualTo(2L);
        assertThat(log.transactionHash()).isEqualTo("0xdf829c5a");
        assertThat(log.data()).endsWith("03e8");
    }

    @Test
    void parse_errorResponse_error() {
        SubscriptionFrame frame = parser.parse("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32601,\"message\":\"not supported\"}}");

        assertThat(frame.kind()).isEqualTo(SubscriptionFrame.Kind.ERROR);
        assertThat(frame.error()).contains("not supported");
    }

    @Test
    void parse_unrelatedFrame_ignored() {
        assertThat(parser.parse("{\"jsonrpc\":\"2.0\",\"id\":7,\"result\":true}").kind())
                .isEqualTo(SubscriptionFrame.Kind.IGNORED);
    }

    @Test
    void parse_notJson_throwsRpcException() {
        assertThatThrownBy(() -> parser.parse("not json"))
                .isInstanceOf(RpcException.class);
    }
}
