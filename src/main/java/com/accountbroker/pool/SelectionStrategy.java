package com.accountbroker.pool;

import java.util.List;
import java.util.Optional;

/**
 * 账号选择策略接口
 * <p>
 * 实现必须是纯函数式的选择逻辑：不做 I/O，不修改账号状态。
 */
public interface SelectionStrategy {

    /**
     * 注册名，如 round-robin
     */
    String name();

    /**
     * 从可用账号列表中选择一个
     *
     * @param eligible 已过滤状态、熔断、容量与租户权限的账号，按注册顺序排列
     * @param context  本次选择的容量快照
     * @return 选中的账号，列表为空时返回 empty
     */
    Optional<Account> select(List<Account> eligible, SelectionContext context);
}
