package com.pubsubrelay.broker.http;

import com.pubsubrelay.broker.channel.ChannelBroker;
import com.pubsubrelay.broker.config.BrokerConfig;
import com.pubsubrelay.broker.metrics.MetricsService;
import com.pubsubrelay.broker.metrics.PrometheusMetricsExporter;
import com.pubsubrelay.broker.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.Set;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    /**
     * Upgrade paths; matched on the path alone so query strings never affect routing.
     */
    private static final Set<String> WEBSOCKET_PATHS = Set.of("/", "/ws");

    private final BrokerConfig config;
    private final ChannelBroker broker;
    private final MetricsService metricsService;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Starts the HTTP server and blocks until it is bound.
     */
    public DisposableServer start() {
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(config, broker, metricsService);

        server = reactor.netty.http.server.HttpServer.create()
            .host(config.getHost())
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness - fails once shutdown started
                .get("/healthz", (req, res) -> {
                    if (broker.isShuttingDown()) {
                        return res.status(503).sendString(Mono.just("Shutting down"));
                    }
                    return res.status(200).sendString(Mono.just("OK"));
                })
                .get("/readyz", (req, res) -> {
                    if (broker.isShuttingDown()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Shutting down"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", PrometheusMetricsExporter.CONTENT_TYPE)
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .route(req -> req.method().equals(HttpMethod.GET)
                        && WEBSOCKET_PATHS.contains(new QueryStringDecoder(req.uri()).path()),
                    upgradeHandler::handle)
            )
            .bindNow(Duration.ofSeconds(45));

        log.info("HTTP server listening on {}:{}", config.getHost(), server.port());
        return server;
    }

    public int port() {
        return server.port();
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
            log.info("HTTP server stopped");
        }
    }
}
