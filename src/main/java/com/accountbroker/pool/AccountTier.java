package com.accountbroker.pool;

import com.accountbroker.capacity.CapacityLimits;
import com.accountbroker.exception.ConfigurationException;

import java.util.Locale;

/**
 * 账号档位，声明顺序即档位高低，决定默认限额
 */
public enum AccountTier {

    TIER_1("tier1", new CapacityLimits(50, 40_000, 20_000)),
    TIER_2("tier2", new CapacityLimits(500, 60_000, 30_000)),
    TIER_3("tier3", new CapacityLimits(1_000, 80_000, 40_000)),
    TIER_4("tier4", new CapacityLimits(4_000, 400_000, 200_000));

    private final String value;
    private final CapacityLimits defaultLimits;

    AccountTier(String value, CapacityLimits defaultLimits) {
        this.value = value;
        this.defaultLimits = defaultLimits;
    }

    public String value() {
        return value;
    }

    public CapacityLimits defaultLimits() {
        return defaultLimits;
    }

    public boolean atLeast(AccountTier other) {
        return compareTo(other) >= 0;
    }

    /**
     * 解析档位，接受 tier1 / TIER_1 / tier_1
     */
    public static AccountTier parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("档位不能为空");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace("_", "");
        for (AccountTier tier : values()) {
            if (tier.value.equals(normalized)) {
                return tier;
            }
        }
        throw new ConfigurationException("未知档位: " + raw + ", 可选值 tier1 ~ tier4");
    }
}
