package com.accountbroker.capacity;

import com.accountbroker.exception.StoreUnavailableException;

import java.time.Duration;

/**
 * 分桶计数存储
 * <p>
 * 每个 key 下按桶序号累加计数。多实例部署时必须使用服务端原子自增的共享实现。
 */
public interface CounterStore {

    /**
     * 原子地为 key 的指定桶累加 amount
     *
     * @param ttl key 的过期时间，每次写入刷新
     */
    void increment(String key, long bucket, long amount, Duration ttl) throws StoreUnavailableException;

    /**
     * 汇总 bucket >= fromBucket 的计数，并顺带清理更早的桶
     */
    long sumSince(String key, long fromBucket) throws StoreUnavailableException;

    void delete(String key) throws StoreUnavailableException;
}
