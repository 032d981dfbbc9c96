package fr.lapetina.loadbalancer.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendPoolTest {

    @Test
    @DisplayName("should preserve configured order")
    void shouldPreserveOrder() {
        BackendPool pool = BackendPool.fromAddresses(List.of(
                "http://b:9001", "http://a:9000", "http://c:9002"));

        assertThat(pool.size()).isEqualTo(3);
        assertThat(pool.get(0).getName()).isEqualTo("http://b:9001");
        assertThat(pool.get(1).getName()).isEqualTo("http://a:9000");
        assertThat(pool.get(2).getName()).isEqualTo("http://c:9002");
        assertThat(pool).extracting(Backend::getName)
                .containsExactly("http://b:9001", "http://a:9000", "http://c:9002");
    }

    @Test
    @DisplayName("should reject duplicate addresses")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> BackendPool.fromAddresses(List.of("http://a:9000", "http://a:9000")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("should treat a trailing slash as the same backend")
    void shouldRejectTrailingSlashVariant() {
        assertThatThrownBy(() -> BackendPool.of(Backend.of("http://a:9000"), Backend.of("http://a:9000/")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate backend address: http://a:9000");
    }

    @Test
    @DisplayName("should fail on first malformed address")
    void shouldFailOnMalformedAddress() {
        assertThatThrownBy(() -> BackendPool.fromAddresses(List.of("http://a:9000", "not a url")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a url");
    }

    @Test
    @DisplayName("should be unmodifiable")
    void shouldBeUnmodifiable() {
        BackendPool pool = BackendPool.of(Backend.of("http://a:9000"));

        assertThatThrownBy(() -> pool.getBackends().add(Backend.of("http://b:9001")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should count alive backends")
    void shouldCountAlive() {
        Backend a = Backend.of("http://a:9000");
        Backend b = Backend.of("http://b:9001");
        Backend c = Backend.of("http://c:9002");
        BackendPool pool = BackendPool.of(a, b, c);

        assertThat(pool.aliveCount()).isEqualTo(3);

        b.setAlive(false);
        c.setAlive(false);
        assertThat(pool.aliveCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should find backends by name")
    void shouldFindByName() {
        BackendPool pool = BackendPool.fromAddresses(List.of("http://a:9000/", "http://b:9001"));

        assertThat(pool.findByName("http://a:9000")).isPresent();
        assertThat(pool.findByName("http://a:9000/")).isPresent();
        assertThat(pool.findByName("http://z:9999")).isEmpty();
    }

    @Test
    @DisplayName("should allow an empty pool")
    void shouldAllowEmptyPool() {
        BackendPool pool = BackendPool.empty();

        assertThat(pool.isEmpty()).isTrue();
        assertThat(pool.aliveCount()).isZero();
        assertThat(BackendPool.fromAddresses(List.of()).isEmpty()).isTrue();
    }
}
