package com.phillippitts.voicedaemon.service.session;

import com.phillippitts.voicedaemon.config.DaemonProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry(new DaemonProperties());

    @Test
    void openRegistersFreshSession() {
        Session a = registry.open();
        Session b = registry.open();

        assertThat(a.id()).isNotEqualTo(b.id());
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.isLive(a.id())).isTrue();
        assertThat(registry.find(b.id())).containsSame(b);
    }

    @Test
    void unregisterClosesExactlyOnce() {
        Session session = registry.open();

        assertThat(registry.unregister(session.id())).isTrue();
        assertThat(registry.unregister(session.id())).isFalse();
        assertThat(session.isAlive()).isFalse();
        assertThat(registry.isLive(session.id())).isFalse();
        assertThat(registry.isLive(null)).isFalse();
    }

    @Test
    void rejectsDuplicateRegistration() {
        Session session = registry.open();

        assertThatThrownBy(() -> registry.register(session)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closeAllEmptiesRegistry() {
        Session a = registry.open();
        registry.open();

        registry.closeAll();

        assertThat(registry.size()).isZero();
        assertThat(a.isAlive()).isFalse();
    }
}
