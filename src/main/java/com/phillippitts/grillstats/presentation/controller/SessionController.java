package com.phillippitts.grillstats.presentation.controller;

import com.phillippitts.grillstats.service.session.CookingEvent;
import com.phillippitts.grillstats.service.session.CookingSession;
import com.phillippitts.grillstats.service.session.EventType;
import com.phillippitts.grillstats.service.session.SessionManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simulated cooking sessions: start, stop and event injection per channel.
 */
@RestController
@RequestMapping("/api/devices/{deviceId}")
class SessionController {

    private final SessionManager sessions;

    SessionController(SessionManager sessions) {
        this.sessions = sessions;
    }

    @GetMapping("/sessions")
    List<SessionView> list(@PathVariable String deviceId) {
        return sessions.sessions(deviceId).stream().map(SessionView::of).toList();
    }

    @PostMapping("/channels/{channelId}/session")
    @ResponseStatus(HttpStatus.CREATED)
    SessionView start(@PathVariable String deviceId,
                      @PathVariable String channelId,
                      @Valid @RequestBody StartSessionRequest request) {
        return SessionView.of(sessions.startSession(deviceId, channelId, request.profileId(), request.startTemperature()));
    }

    @DeleteMapping("/channels/{channelId}/session")
    Map<String, Object> stop(@PathVariable String deviceId, @PathVariable String channelId) {
        return Map.of("stopped", sessions.stopSession(deviceId, channelId));
    }

    @PostMapping("/channels/{channelId}/events")
    @ResponseStatus(HttpStatus.ACCEPTED)
    CookingEvent inject(@PathVariable String deviceId,
                        @PathVariable String channelId,
                        @Valid @RequestBody InjectEventRequest request) {
        Duration decay = request.decaySeconds() == null ? null : Duration.ofMillis(Math.round(request.decaySeconds() * 1000));
        return sessions.injectEvent(deviceId, channelId, request.type(), request.magnitude(), decay, request.phases());
    }

    record StartSessionRequest(@NotBlank String profileId, Double startTemperature) {}

    record InjectEventRequest(@NotNull EventType type,
                              @Positive Double magnitude,
                              @Positive Double decaySeconds,
                              Set<String> phases) {}

    record SessionView(String sessionId,
                       String deviceId,
                       String channelId,
                       String profileId,
                       String phase,
                       double baseTemperatureF,
                       boolean complete,
                       Instant startedAt) {

        static SessionView of(CookingSession s) {
            return new SessionView(s.id(), s.deviceId(), s.channel().id(), s.profile().id(),
                    s.currentPhase().map(p -> p.name()).orElse(null),
                    s.baseTemperature(), s.isComplete(), s.startedAt());
        }
    }
}
