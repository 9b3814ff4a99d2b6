package com.pubsubrelay.broker.ws;

import com.pubsubrelay.broker.channel.ChannelBroker;
import com.pubsubrelay.broker.channel.Connection;
import com.pubsubrelay.broker.channel.ConnectionLink;
import com.pubsubrelay.broker.channel.JoinRejectedException;
import com.pubsubrelay.broker.channel.JoinRequest;
import com.pubsubrelay.broker.config.BrokerConfig;
import com.pubsubrelay.broker.metrics.MetricsService;
import com.pubsubrelay.core.msg.CloseCode;
import com.pubsubrelay.core.msg.WireFrame;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket handler for broker connections.
 * <p>
 * Protocol (server → client): {@code replay}, {@code persisted}, {@code ephemeral}, {@code ready},
 * {@code error} frames, text or binary.
 * </p>
 * <p>
 * Protocol (client → server): {@code publish}, {@code update-metadata}.
 * </p>
 * <p>
 * Rejected joins end with a close frame carrying the rejection code; nothing else is sent.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final BrokerConfig config;
    private final ChannelBroker broker;
    private final MetricsService metricsService;

    public WebSocketHandler(BrokerConfig config, ChannelBroker broker, MetricsService metricsService) {
        this.config = config;
        this.broker = broker;
        this.metricsService = metricsService;
    }

    /**
     * Handles a WebSocket connection lifecycle.
     *
     * @param inbound  WebSocket inbound
     * @param outbound WebSocket outbound
     * @param request  join parameters extracted before the upgrade
     * @return Publisher completing when the connection is done
     */
    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, JoinRequest request) {
        ConnectionLink link = code -> outbound.sendClose(code.code(), code.reason())
                .subscribe(null, err -> log.debug("Close frame not sent: {}", err.getMessage()));

        return broker.join(request, link)
                .flatMap(connection -> serve(inbound, outbound, connection))
                .onErrorResume(JoinRejectedException.class, err -> close(outbound, err.getCloseCode()))
                .onErrorResume(err -> {
                    log.error("WebSocket join failed for channel {}", request.getChannel(), err);
                    return close(outbound, CloseCode.INTERNAL_ERROR);
                });
    }

    private Mono<Void> serve(WebsocketInbound inbound, WebsocketOutbound outbound, Connection connection) {
        MDC.put("clientId", connection.getClientId());
        log.debug("Serving connection {} on channel {}", connection.getId(), connection.getChannel());

        handleConnectionStateUpdates(inbound, connection);

        return Mono.when(
                outbound.sendObject(connection.outbound().map(this::toNettyFrame)),
                handleInboundFrames(inbound, connection)
        );
    }

    private void handleConnectionStateUpdates(WebsocketInbound inbound, Connection connection) {
        inbound.withConnection(conn -> {
            long pingIntervalMillis = config.getPingInterval() * 1000L;
            long idleTimeoutMillis = config.getIdleTimeout() * 1000L;

            conn.onWriteIdle(pingIntervalMillis, () -> conn.outbound()
                            .sendObject(Mono.just(new PingWebSocketFrame()))
                            .then()
                            .subscribe(null, err -> log.debug("Ping failed for {}: {}", connection.getId(),
                                    err.getMessage())))
                    .onReadIdle(idleTimeoutMillis, () -> {
                        log.info("Connection {} idle for {}s, closing", connection.getId(), config.getIdleTimeout());
                        conn.dispose();
                    })
                    // Runs immediately when the socket closed while the join was in flight
                    .onDispose(() -> broker.disconnect(connection)
                            .subscribe(null, err -> log.debug("Disconnect bookkeeping skipped for {}: {}",
                                    connection.getId(), err.getMessage())));
        });
    }

    private Mono<Void> handleInboundFrames(WebsocketInbound inbound, Connection connection) {
        return inbound.aggregateFrames(config.getMaxFrameSize())
                .receiveFrames()
                // Copy out of the pooled buffer before it is released
                .mapNotNull(WebSocketHandler::toWireFrame)
                .concatMap(frame -> broker.handleFrame(connection, frame).onErrorResume(err -> {
                    log.warn("Error processing frame from {}: {}", connection.getClientId(), err.getMessage());
                    return Mono.empty();
                }))
                .doOnError(err -> {
                    if (!(err instanceof AbortedException)) {
                        log.error("Fatal error in inbound stream for {}", connection.getClientId(), err);
                    }
                })
                .onErrorResume(err -> Mono.empty())
                .then();
    }

    private WebSocketFrame toNettyFrame(WireFrame frame) {
        metricsService.recordNetworkOutboundWs(frame.size());
        if (frame.isBinary()) {
            return new BinaryWebSocketFrame(Unpooled.wrappedBuffer(frame.getBinary()));
        }
        return new TextWebSocketFrame(frame.getText());
    }

    private static WireFrame toWireFrame(WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame) {
            return WireFrame.text(((TextWebSocketFrame) frame).text());
        }
        if (frame instanceof BinaryWebSocketFrame) {
            return WireFrame.binary(ByteBufUtil.getBytes(frame.content()));
        }
        return null;
    }

    private static Mono<Void> close(WebsocketOutbound outbound, CloseCode code) {
        return outbound.sendClose(code.code(), code.reason());
    }
}
