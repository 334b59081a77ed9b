package com.bko.gateway.lock;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

public class RedisLockStore implements LockStore {

    static final String LOCK_VALUE = "1";

    private final StringRedisTemplate redisTemplate;

    public RedisLockStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean setIfAbsent(String key, Duration ttl) {
        Boolean created = redisTemplate.opsForValue().setIfAbsent(key, LOCK_VALUE, ttl);
        return Boolean.TRUE.equals(created);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }
}
