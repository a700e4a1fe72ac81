package com.phillippitts.voicecalc.service.health;

import com.phillippitts.voicecalc.domain.SessionState;
import com.phillippitts.voicecalc.service.session.SessionStatus;
import com.phillippitts.voicecalc.service.session.VoiceSession;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the voice capture session.
 *
 * <ul>
 *   <li>UP: a capture device is present and the session is not in error</li>
 *   <li>DOWN: the session is in ERROR (service failure, calibration failure, device loss)</li>
 *   <li>OUT_OF_SERVICE: no capture device on this host</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class VoiceSessionHealthIndicator implements HealthIndicator {

    private final VoiceSession session;

    public VoiceSessionHealthIndicator(VoiceSession session) {
        this.session = session;
    }

    @Override
    public Health health() {
        SessionStatus status = session.status();
        Health.Builder builder;
        if (!status.micAvailable()) {
            builder = Health.outOfService()
                    .withDetail("status", "No microphone detected")
                    .withDetail("micError", status.micError() == null ? "unknown" : status.micError());
        } else if (status.state() == SessionState.ERROR) {
            builder = Health.down().withDetail("status", "Voice session failed");
        } else {
            builder = Health.up().withDetail("status", "Voice session operational");
        }
        return builder
                .withDetail("state", status.state().wireName())
                .withDetail("micAvailable", status.micAvailable())
                .build();
    }
}
