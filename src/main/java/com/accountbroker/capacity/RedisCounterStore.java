package com.accountbroker.capacity;

import com.accountbroker.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Redis 共享计数存储
 * <p>
 * 每个 key 是一个 hash，field 为桶序号。自增使用服务端 HINCRBY，多实例并发写入无需客户端读改写。
 */
public class RedisCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCounterStore.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisCounterStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "broker:";
    }

    @Override
    public void increment(String key, long bucket, long amount, Duration ttl) {
        String redisKey = keyPrefix + key;
        try {
            redisTemplate.opsForHash().increment(redisKey, Long.toString(bucket), amount);
            redisTemplate.expire(redisKey, ttl);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis 计数写入失败: " + redisKey, e);
        }
    }

    @Override
    public long sumSince(String key, long fromBucket) {
        String redisKey = keyPrefix + key;
        try {
            HashOperations<String, String, String> ops = redisTemplate.opsForHash();
            Map<String, String> fields = ops.entries(redisKey);
            long sum = 0;
            List<String> stale = new ArrayList<>();
            for (Map.Entry<String, String> e : fields.entrySet()) {
                long bucket = parseLong(e.getKey());
                if (bucket < fromBucket) {
                    stale.add(e.getKey());
                    continue;
                }
                sum += parseLong(e.getValue());
            }
            if (!stale.isEmpty()) {
                ops.delete(redisKey, stale.toArray());
            }
            return sum;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis 计数读取失败: " + redisKey, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(keyPrefix + key);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis 计数删除失败: " + keyPrefix + key, e);
        }
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.debug("忽略非法计数字段: {}", value);
            return 0;
        }
    }
}
