package com.netflowradar.ingestion.adapter.evm;

import com.netflowradar.ingestion.adapter.RpcException;
import com.netflowradar.ingestion.decoder.RawLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * eth_subscribe("logs") over a WebSocket. One socket per subscription; the socket is closed when the
 * returned Flux terminates or is cancelled.
 */
@Slf4j
public class WebSocketEvmLogSubscriptionClient implements EvmLogSubscriptionClient {

    private final WebSocketClient webSocketClient;
    private final URI endpoint;
    private final LogNotificationParser parser;

    public WebSocketEvmLogSubscriptionClient(WebSocketClient webSocketClient, URI endpoint, LogNotificationParser parser) {
        this.webSocketClient = webSocketClient;
        this.endpoint = endpoint;
        this.parser = parser;
    }

    @Override
    public Flux<RawLog> subscribeLogs(String contractAddress, String eventSignatureHash) {
        String request = parser.subscribeRequest(contractAddress, eventSignatureHash);
        return Flux.create(sink -> {
            Disposable connection = webSocketClient.execute(endpoint, session ->
                            session.send(Mono.just(session.textMessage(request)))
                                    .thenMany(session.receive()
                                            .map(WebSocketMessage::getPayloadAsText)
                                            .doOnNext(frame -> dispatch(frame, sink)))
                                    .then())
                    .subscribe(
                            ignored -> { },
                            error -> sink.error(asRpcException(error)),
                            () -> {
                                log.warn("Log subscription socket closed by {}", endpoint);
                                sink.complete();
                            });
            sink.onDispose(connection);
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    private void dispatch(String frame, FluxSink<RawLog> sink) {
        SubscriptionFrame parsed = parser.parse(frame);
        switch (parsed.kind()) {
            case SUBSCRIBED -> log.info("Log subscription {} open on {}", parsed.subscriptionId(), endpoint);
            case LOG -> sink.next(parsed.log());
            case ERROR -> sink.error(new RpcException("eth_subscribe error: " + parsed.error()));
            case IGNORED -> log.debug("Ignoring subscription frame");
        }
    }

    private RpcException asRpcException(Throwable error) {
        if (error instanceof RpcException rpc) {
            return rpc;
        }
        return new RpcException("Log subscription to " + endpoint + " failed: " + error.getMessage(), error);
    }
}
