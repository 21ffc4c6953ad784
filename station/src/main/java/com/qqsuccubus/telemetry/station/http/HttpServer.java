package com.qqsuccubus.telemetry.station.http;

import com.qqsuccubus.telemetry.station.config.StationConfig;
import com.qqsuccubus.telemetry.station.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.telemetry.station.mqtt.ITelemetryTransport;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics and the JSON control surface.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final StationConfig config;
    private final ControlApi api;
    private final PrometheusMetricsExporter metricsExporter;
    private final ITelemetryTransport measurementTransport;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness only; broker outages are reported, not fatal
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just(
                    measurementTransport.isConnected() ? "OK" : "OK (broker disconnected)")))
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/api/v1/sensors", (req, res) -> send(res, api.listSensors()))
                .get("/api/v1/selection", (req, res) -> send(res, api.getSelection()))
                .put("/api/v1/selection", (req, res) -> withBody(req, res, api::putSelection))
                .put("/api/v1/selection/{sensorId}/channels", (req, res) ->
                    withBody(req, res, body -> api.putChannels(req.param("sensorId"), body)))
                .post("/api/v1/session/start", (req, res) -> send(res, api.start()))
                .post("/api/v1/session/stop", (req, res) -> send(res, api.stop()))
                .post("/api/v1/session/save", (req, res) -> send(res, api.save()))
                .put("/api/v1/session/duration", (req, res) -> withBody(req, res, api::putDuration))
                .get("/api/v1/view", (req, res) -> send(res, api.view()))
                .get("/api/v1/series", (req, res) -> send(res, api.listSeries()))
                .get("/api/v1/series/export", (req, res) -> send(res, api.exportSeries()))
                .put("/api/v1/series/display", (req, res) -> withBody(req, res, api::putDisplay))
                .delete("/api/v1/series", (req, res) -> send(res, api.clearSeries()))
            )
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(10));
        }
    }

    private static Mono<Void> withBody(HttpServerRequest req,
                                       HttpServerResponse res,
                                       Function<String, ApiResponse> handler) {
        return req.receive().aggregate().asString()
            .defaultIfEmpty("")
            .flatMap(body -> send(res, handler.apply(body)));
    }

    private static Mono<Void> send(HttpServerResponse res, ApiResponse response) {
        res.status(response.getStatus());
        if (response.getBody().isEmpty()) {
            return res.send().then();
        }
        return res.header("Content-Type", response.getContentType())
            .sendString(Mono.just(response.getBody()))
            .then();
    }
}
