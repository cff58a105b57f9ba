package com.orderdesk.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.orderdesk.oms.OrderForm;
import com.orderdesk.oms.OrderIntent;
import com.orderdesk.oms.OrderIntentService;
import com.orderdesk.oms.OrderSide;
import com.orderdesk.oms.OrderType;
import com.orderdesk.oms.TimeInForce;
import com.orderdesk.repository.redis.PendingOrderFormRedisRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class OrderIntentServiceTest {

    private static final String SESSION = "session-1";
    private static final Instant NOW = Instant.parse("2025-03-14T15:00:00Z");

    @Mock
    private PendingOrderFormRedisRepository repository;

    private OrderIntentService service;

    @BeforeEach
    void setUp() {
        service = new OrderIntentService(SESSION, repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static OrderForm form(String qty) {
        return OrderForm.builder()
                .symbol("AAPL")
                .side(OrderSide.BUY)
                .quantity(new BigDecimal(qty))
                .orderType(OrderType.MARKET)
                .timeInForce(TimeInForce.DAY)
                .build();
    }

    @Test
    @DisplayName("Same form reuses the intent ID and persists it once")
    void sameFormReusesIntent() {
        OrderIntent first = service.getOrCreate(form("10"));
        OrderIntent second = service.getOrCreate(form("10.0"));

        assertThat(second.intentId()).isEqualTo(first.intentId());
        assertThat(first.intentId()).hasSize(32).matches("[0-9a-f]+");
        assertThat(first.createdAt()).isEqualTo(NOW);
        verify(repository, times(1)).save(eq(SESSION), any(OrderIntent.class));
    }

    @Test
    @DisplayName("Changed form gets a new intent ID")
    void changedFormGetsNewIntent() {
        OrderIntent first = service.getOrCreate(form("10"));
        OrderIntent second = service.getOrCreate(form("11"));

        assertThat(second.intentId()).isNotEqualTo(first.intentId());
        assertThat(service.current()).contains(second);
    }

    @Test
    @DisplayName("Discard forgets the intent so the same form gets a new ID")
    void discardIssuesNewId() {
        OrderIntent first = service.getOrCreate(form("10"));

        service.discard();
        OrderIntent second = service.getOrCreate(form("10"));

        assertThat(second.intentId()).isNotEqualTo(first.intentId());
        verify(repository).clear(SESSION);
    }

    @Test
    @DisplayName("Redis failure while saving does not prevent issuing the intent")
    void saveFailureIsTolerated() {
        doThrow(new DataAccessResourceFailureException("redis down"))
                .when(repository).save(eq(SESSION), any(OrderIntent.class));

        OrderIntent intent = service.getOrCreate(form("10"));

        assertThat(service.current()).contains(intent);
    }

    @Test
    @DisplayName("Restored draft becomes current and keeps its intent ID")
    void restoreSetsCurrent() {
        OrderIntent saved = new OrderIntent("abc123", form("10"), NOW.minusSeconds(600));
        when(repository.restore(SESSION)).thenReturn(Optional.of(saved));

        assertThat(service.restore()).contains(saved);
        assertThat(service.getOrCreate(form("10")).intentId()).isEqualTo("abc123");
    }

    @Test
    @DisplayName("Redis failure while restoring yields no draft")
    void restoreFailure() {
        when(repository.restore(SESSION)).thenThrow(new DataAccessResourceFailureException("redis down"));

        assertThat(service.restore()).isEmpty();
        assertThat(service.current()).isEmpty();
    }
}
