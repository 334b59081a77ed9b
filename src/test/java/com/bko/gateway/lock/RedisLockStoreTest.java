package com.bko.gateway.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RedisLockStoreTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private RedisLockStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        store = new RedisLockStore(redisTemplate);
    }

    @Test
    void testSetIfAbsentUsesSentinelAndTtl() {
        when(valueOperations.setIfAbsent("k", RedisLockStore.LOCK_VALUE, Duration.ofHours(1))).thenReturn(true);

        assertTrue(store.setIfAbsent("k", Duration.ofHours(1)));
        verify(valueOperations).setIfAbsent("k", "1", Duration.ofHours(1));
    }

    @Test
    void testNullReplyMeansNotAcquired() {
        when(valueOperations.setIfAbsent("k", "1", Duration.ofHours(1))).thenReturn(null);

        assertFalse(store.setIfAbsent("k", Duration.ofHours(1)));
    }

    @Test
    void testDeleteRemovesKey() {
        store.delete("k");
        verify(redisTemplate).delete("k");
    }
}
