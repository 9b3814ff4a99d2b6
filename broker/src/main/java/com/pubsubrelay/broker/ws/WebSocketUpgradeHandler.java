package com.pubsubrelay.broker.ws;

import com.pubsubrelay.broker.channel.ChannelBroker;
import com.pubsubrelay.broker.channel.JoinRequest;
import com.pubsubrelay.broker.config.BrokerConfig;
import com.pubsubrelay.broker.metrics.MetricsService;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.WebsocketServerSpec;

/**
 * Extracts join parameters from the upgrade request and hands the socket to {@link WebSocketHandler}.
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final WebSocketHandler wsHandler;
    private final ChannelBroker broker;
    private final WebsocketServerSpec websocketSpec;

    public WebSocketUpgradeHandler(BrokerConfig config, ChannelBroker broker, MetricsService metricsService) {
        this.wsHandler = new WebSocketHandler(config, broker, metricsService);
        this.broker = broker;
        this.websocketSpec = WebsocketServerSpec.builder()
                .maxFramePayloadLength(config.getMaxFrameSize())
                .build();
    }

    /**
     * Handles a WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (broker.isShuttingDown()) {
            log.warn("Rejecting new WebSocket connection - broker is shutting down");
            return res.status(503)
                    .sendString(Mono.just("Service unavailable - shutting down"))
                    .then();
        }

        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        JoinRequest request = JoinRequest.fromQuery(decoder.parameters());

        return res.sendWebsocket((inbound, outbound) -> wsHandler.handle(inbound, outbound, request), websocketSpec);
    }
}
