package com.accountbroker.capacity;

import com.accountbroker.exception.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisCounterStoreTest {

    private StringRedisTemplate template;
    private HashOperations<String, Object, Object> ops;
    private RedisCounterStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        template = mock(StringRedisTemplate.class);
        ops = mock(HashOperations.class);
        when(template.<Object, Object>opsForHash()).thenReturn(ops);
        store = new RedisCounterStore(template, "broker:");
    }

    @Test
    void incrementUsesHashFieldPerBucketAndRefreshesTtl() {
        store.increment("cap:a:rpm", 42, 3, Duration.ofMinutes(2));

        verify(ops).increment("broker:cap:a:rpm", "42", 3L);
        verify(template).expire("broker:cap:a:rpm", Duration.ofMinutes(2));
    }

    @Test
    void sumSinceSumsLiveBucketsAndDropsStaleOnes() {
        Map<Object, Object> fields = new LinkedHashMap<>();
        fields.put("1", "4");
        fields.put("5", "6");
        fields.put("7", "1");
        when(ops.entries("broker:cap:a:tpm")).thenReturn(fields);

        assertThat(store.sumSince("cap:a:tpm", 3)).isEqualTo(7);
        verify(ops).delete("broker:cap:a:tpm", "1");
    }

    @Test
    void connectionFailureBecomesStoreUnavailable() {
        when(ops.entries("broker:cap:a:rpm")).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> store.sumSince("cap:a:rpm", 0))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("broker:cap:a:rpm");
    }
}
