package com.phillippitts.callengine.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for call event processing and DTMF validation ({@code call.events.*}).
 */
@Validated
@ConfigurationProperties(prefix = "call.events")
public class CallEventProperties {

    private final boolean dtmfValidationEnabled;

    @Min(1)
    private final long validationTimeoutMs;

    @Min(1)
    private final int pinLength;

    @Min(1)
    private final int challengeLength;

    private final boolean broadcastEnabled;

    @ConstructorBinding
    public CallEventProperties(Boolean dtmfValidationEnabled,
                               Long validationTimeoutMs,
                               Integer pinLength,
                               Integer challengeLength,
                               Boolean broadcastEnabled) {
        this.dtmfValidationEnabled = dtmfValidationEnabled != null && dtmfValidationEnabled;
        this.validationTimeoutMs = validationTimeoutMs == null ? 30_000L : validationTimeoutMs;
        this.pinLength = pinLength == null ? 4 : pinLength;
        this.challengeLength = challengeLength == null ? 3 : challengeLength;
        this.broadcastEnabled = broadcastEnabled == null || broadcastEnabled;
    }

    public boolean isDtmfValidationEnabled() {
        return dtmfValidationEnabled;
    }

    public long getValidationTimeoutMs() {
        return validationTimeoutMs;
    }

    public Duration getValidationTimeout() {
        return Duration.ofMillis(validationTimeoutMs);
    }

    public int getPinLength() {
        return pinLength;
    }

    public int getChallengeLength() {
        return challengeLength;
    }

    public boolean isBroadcastEnabled() {
        return broadcastEnabled;
    }
}
