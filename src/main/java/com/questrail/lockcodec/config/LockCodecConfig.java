package com.questrail.lockcodec.config;

import com.questrail.lockcodec.observability.CodecObservabilitySink;
import com.questrail.lockcodec.observability.NullObservabilitySink;

import java.time.Clock;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Aggregated configuration for a {@code LockCodec}.
 *
 * <p>{@code defaultLock} may be {@code null}, in which case every call must
 * pass a lock explicitly.</p>
 */
public record LockCodecConfig(
    Integer defaultLock,
    OverflowPolicy overflowPolicy,
    CodecObservabilitySink observabilitySink,
    Clock clock
) {
    public LockCodecConfig {
        Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(clock, "clock");
    }

    public OptionalInt defaultLockIfPresent() {
        return defaultLock == null ? OptionalInt.empty() : OptionalInt.of(defaultLock);
    }

    /**
     * @return strict overflow checking, no default lock, no observability
     */
    public static LockCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer defaultLock;
        private OverflowPolicy overflowPolicy = OverflowPolicy.STRICT;
        private CodecObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Clock clock = Clock.systemUTC();

        public Builder withDefaultLock(int defaultLock) {
            this.defaultLock = defaultLock;
            return this;
        }

        public Builder withoutDefaultLock() {
            this.defaultLock = null;
            return this;
        }

        public Builder withOverflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = overflowPolicy;
            return this;
        }

        public Builder withObservabilitySink(CodecObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public LockCodecConfig build() {
            return new LockCodecConfig(defaultLock, overflowPolicy, observabilitySink, clock);
        }
    }
}
