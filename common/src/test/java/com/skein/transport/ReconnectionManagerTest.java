package com.skein.transport;

import com.skein.config.PipelineConfig;
import com.skein.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectionManagerTest {

    private final PipelineConfig.ReconnectSection config = new PipelineConfig.ReconnectSection();
    private final MutableClock clock = MutableClock.atEpoch();
    private final List<Duration> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        config.setBaseDelayMs(1_000);
        config.setMaxDelayMs(30_000);
        config.setJitter(0.0);
        config.setStableAfterMs(30_000);
        config.setOutageThreshold(3);
    }

    private ReconnectionManager manager(double random) {
        return new ReconnectionManager(config, clock, sleeps::add, () -> random);
    }

    @Test
    @DisplayName("Delays double from the base and are capped at the maximum")
    void exponentialWithCap() {
        ReconnectionManager manager = manager(0.0);
        List<Long> delays = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            delays.add(manager.nextDelay().toMillis());
        }
        assertThat(delays).containsExactly(1_000L, 2_000L, 4_000L, 8_000L, 16_000L, 30_000L, 30_000L, 30_000L);
    }

    @Test
    @DisplayName("Jitter randomises only its share of the delay")
    void jitterBounds() {
        config.setJitter(0.5);
        assertThat(manager(0.0).nextDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(manager(1.0).nextDelay()).isEqualTo(Duration.ofMillis(1_000));
        assertThat(manager(0.5).nextDelay()).isEqualTo(Duration.ofMillis(750));
    }

    @Test
    void rejectsJitterOutsideUnitRange() {
        config.setJitter(1.5);
        assertThatThrownBy(() -> manager(0.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Backoff resets only after the connection has been stable")
    void resetAfterStablePeriod() throws Exception {
        ReconnectionManager manager = manager(0.0);
        manager.onFailure(new IOException("refused"));
        manager.awaitNextAttempt();
        manager.onFailure(new IOException("refused"));
        manager.awaitNextAttempt();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(manager.getState()).isEqualTo(ConnectionState.BACKOFF);

        manager.onConnected();
        manager.onFrame();
        assertThat(manager.getAttempt()).isEqualTo(2);

        clock.advance(Duration.ofSeconds(31));
        manager.onFrame();
        assertThat(manager.getAttempt()).isZero();
        assertThat(manager.getState()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(manager.getFailedAttempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("A connection that drops before becoming stable keeps escalating")
    void flappingConnectionEscalates() {
        ReconnectionManager manager = manager(0.0);
        assertThat(manager.nextDelay()).isEqualTo(Duration.ofSeconds(1));
        manager.onConnected();
        clock.advance(Duration.ofSeconds(5));
        manager.onFrame();
        manager.onFailure(new IOException("reset"));

        assertThat(manager.nextDelay()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Consecutive failures past the threshold flag a sustained outage until recovery")
    void sustainedOutage() {
        ReconnectionManager manager = manager(0.0);
        manager.onFailure(new IOException("1"));
        manager.onFailure(new IOException("2"));
        assertThat(manager.isSustainedOutage()).isFalse();
        manager.onFailure(new IOException("3"));
        assertThat(manager.isSustainedOutage()).isTrue();

        manager.onConnected();
        clock.advance(Duration.ofSeconds(30));
        manager.onFrame();
        assertThat(manager.isSustainedOutage()).isFalse();
    }
}
