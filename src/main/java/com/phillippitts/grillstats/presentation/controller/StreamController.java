package com.phillippitts.grillstats.presentation.controller;

import com.phillippitts.grillstats.config.properties.StreamProperties;
import com.phillippitts.grillstats.service.auth.RateLimiter;
import com.phillippitts.grillstats.service.auth.SessionTokenStore;
import com.phillippitts.grillstats.service.device.DeviceDirectory;
import com.phillippitts.grillstats.service.stream.SseClientConnection;
import com.phillippitts.grillstats.service.stream.StreamDispatcher;
import com.phillippitts.grillstats.service.stream.SubscriptionHandle;
import com.phillippitts.grillstats.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-Sent Events stream of one device.
 *
 * <p>The first event is a {@code snapshot}; {@code reading}, {@code status}, {@code alert} and
 * {@code heartbeat} events follow. Event ids are the per-device sequence numbers. A client that
 * reconnects gets a fresh snapshot.
 */
@RestController
@RequestMapping("/api/stream")
class StreamController {

    private static final Logger LOG = LogManager.getLogger(StreamController.class);

    static final String CLIENT_ID_HEADER = "X-Client-ID";

    private final StreamDispatcher dispatcher;
    private final DeviceDirectory directory;
    private final SessionTokenStore tokens;
    private final RateLimiter rateLimiter;
    private final StreamProperties props;

    StreamController(StreamDispatcher dispatcher,
                     DeviceDirectory directory,
                     SessionTokenStore tokens,
                     RateLimiter rateLimiter,
                     StreamProperties props) {
        this.dispatcher = dispatcher;
        this.directory = directory;
        this.tokens = tokens;
        this.rateLimiter = rateLimiter;
        this.props = props;
    }

    @GetMapping(path = "/{deviceId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    SseEmitter stream(@PathVariable String deviceId,
                      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                      @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientHeader) {
        String clientId = resolveClient(authorization, clientHeader);
        rateLimiter.acquire("subscribe:" + clientId, props.getSubscribeLimit());
        directory.getDevice(deviceId);

        SseEmitter emitter = new SseEmitter(props.getEmitterTimeout().toMillis());
        SseClientConnection connection = new SseClientConnection(emitter);
        AtomicReference<SubscriptionHandle> handle = new AtomicReference<>();
        connection.onTermination(() -> {
            SubscriptionHandle h = handle.get();
            if (h != null) {
                dispatcher.unsubscribe(h);
            }
        });
        handle.set(dispatcher.subscribe(clientId, deviceId, connection));
        LOG.debug("Opened SSE stream for {} on {}", LogSanitizer.id(clientId), deviceId);
        return emitter;
    }

    private String resolveClient(String authorization, String clientHeader) {
        String token = AuthController.bearerToken(authorization);
        if (props.isRequireAuth() || token != null) {
            return tokens.requireClient(token);
        }
        if (clientHeader != null && !clientHeader.isBlank()) {
            return LogSanitizer.id(clientHeader);
        }
        return "anonymous-" + UUID.randomUUID();
    }
}
