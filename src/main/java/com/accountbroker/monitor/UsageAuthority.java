package com.accountbroker.monitor;

import com.accountbroker.exception.UsageSyncException;

import java.time.Duration;

/**
 * 外部用量权威源
 */
public interface UsageAuthority {

    /**
     * 拉取用量
     *
     * @param usageKeyId 账号在用量系统中的 key
     * @param window     统计窗口
     * @throws UsageSyncException 拉取或解析失败
     */
    UsageReport fetchUsage(String usageKeyId, Duration window);
}
