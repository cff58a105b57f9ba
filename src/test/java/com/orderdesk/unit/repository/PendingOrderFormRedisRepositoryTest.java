package com.orderdesk.unit.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.orderdesk.config.OrderEntryConfig;
import com.orderdesk.config.RedisConfig;
import com.orderdesk.oms.OrderForm;
import com.orderdesk.oms.OrderIntent;
import com.orderdesk.oms.OrderSide;
import com.orderdesk.oms.OrderType;
import com.orderdesk.oms.TimeInForce;
import com.orderdesk.repository.redis.PendingOrderFormRedisRepository;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class PendingOrderFormRedisRepositoryTest {

    private static final String SESSION = "session-1";
    private static final String KEY = RedisConfig.KEY_PREFIX_PENDING_FORM + SESSION;

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    private PendingOrderFormRedisRepository repository;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        OrderEntryConfig config = new OrderEntryConfig();
        config.setPendingFormTtl(Duration.ofHours(2));
        repository = new PendingOrderFormRedisRepository(redisTemplate, config);
    }

    @Test
    @DisplayName("Save writes the form as strings with the configured TTL")
    @SuppressWarnings("unchecked")
    void saveWritesStrings() {
        OrderForm form = OrderForm.builder()
                .symbol("AAPL")
                .side(OrderSide.SELL)
                .quantity(new BigDecimal("25"))
                .orderType(OrderType.STOP_LIMIT)
                .limitPrice(new BigDecimal("99.50"))
                .stopPrice(new BigDecimal("100"))
                .timeInForce(TimeInForce.GTC)
                .build();

        repository.save(SESSION, new OrderIntent("intent-1", form, Instant.parse("2025-03-14T15:00:00Z")));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(valueOperations).set(eq(KEY), captor.capture(), eq(Duration.ofHours(2)));
        Map<String, Object> data = (Map<String, Object>) captor.getValue();
        assertThat(data)
                .containsEntry("client_order_id", "intent-1")
                .containsEntry("symbol", "AAPL")
                .containsEntry("side", "sell")
                .containsEntry("quantity", "25")
                .containsEntry("order_type", "stop_limit")
                .containsEntry("limit_price", "99.5")
                .containsEntry("stop_price", "100")
                .containsEntry("time_in_force", "gtc")
                .containsEntry("created_at", "2025-03-14T15:00:00Z");
    }

    @Test
    @DisplayName("Restore rebuilds the intent with the saved client order ID")
    void restoreRebuildsIntent() {
        Map<String, Object> data = new HashMap<>();
        data.put("client_order_id", "intent-1");
        data.put("symbol", "aapl");
        data.put("side", "sell");
        data.put("quantity", "25");
        data.put("order_type", "limit");
        data.put("limit_price", "101.25");
        data.put("time_in_force", "ioc");
        data.put("created_at", "2025-03-14T15:00:00Z");
        when(valueOperations.get(KEY)).thenReturn(data);

        Optional<OrderIntent> restored = repository.restore(SESSION);

        assertThat(restored).isPresent();
        assertThat(restored.get().intentId()).isEqualTo("intent-1");
        OrderForm form = restored.get().form();
        assertThat(form.symbol()).isEqualTo("AAPL");
        assertThat(form.side()).isEqualTo(OrderSide.SELL);
        assertThat(form.quantity()).isEqualByComparingTo("25");
        assertThat(form.orderType()).isEqualTo(OrderType.LIMIT);
        assertThat(form.limitPrice()).isEqualByComparingTo("101.25");
        assertThat(form.stopPrice()).isNull();
        assertThat(form.timeInForce()).isEqualTo(TimeInForce.IOC);
        assertThat(restored.get().createdAt()).isEqualTo(Instant.parse("2025-03-14T15:00:00Z"));
    }

    @Test
    @DisplayName("Absent fields restore as blank, not as defaults")
    void absentFieldsStayBlank() {
        Map<String, Object> data = new HashMap<>();
        data.put("client_order_id", "intent-2");
        data.put("symbol", "MSFT");
        data.put("created_at", "later");
        when(valueOperations.get(KEY)).thenReturn(data);

        OrderIntent restored = repository.restore(SESSION).orElseThrow();

        assertThat(restored.intentId()).isEqualTo("intent-2");
        assertThat(restored.form().symbol()).isEqualTo("MSFT");
        assertThat(restored.form().side()).isNull();
        assertThat(restored.form().quantity()).isNull();
        assertThat(restored.form().orderType()).isNull();
        assertThat(restored.form().timeInForce()).isNull();
        assertThat(restored.createdAt()).isEqualTo(Instant.EPOCH);
        verify(redisTemplate, never()).delete(any(String.class));
    }

    @ParameterizedTest
    @CsvSource({
        "side, short",
        "order_type, trailing",
        "time_in_force, forever",
        "quantity, -3",
        "limit_price, abc",
        "symbol, NOT A SYMBOL"
    })
    @DisplayName("Record with an unreadable field is discarded instead of reusing its intent ID")
    void unreadableFieldDiscards(String field, String raw) {
        Map<String, Object> data = new HashMap<>();
        data.put("client_order_id", "intent-2");
        data.put("symbol", "AAPL");
        data.put("side", "sell");
        data.put("quantity", "25");
        data.put("order_type", "limit");
        data.put("limit_price", "101.25");
        data.put("time_in_force", "day");
        data.put(field, raw);
        when(valueOperations.get(KEY)).thenReturn(data);

        assertThat(repository.restore(SESSION)).isEmpty();
        verify(redisTemplate).delete(KEY);
    }

    @Test
    @DisplayName("Record without a client order ID is deleted and treated as absent")
    void corruptRecordDeleted() {
        when(valueOperations.get(KEY)).thenReturn(Map.of("symbol", "AAPL"));

        assertThat(repository.restore(SESSION)).isEmpty();
        verify(redisTemplate).delete(KEY);
    }

    @Test
    @DisplayName("Non-map value is deleted and treated as absent")
    void nonMapDeleted() {
        when(valueOperations.get(KEY)).thenReturn("garbage");

        assertThat(repository.restore(SESSION)).isEmpty();
        verify(redisTemplate).delete(KEY);
    }

    @Test
    @DisplayName("Missing key restores nothing and deletes nothing")
    void missingKey() {
        when(valueOperations.get(KEY)).thenReturn(null);

        assertThat(repository.restore(SESSION)).isEmpty();
        verify(redisTemplate, never()).delete(any(String.class));
    }
}
