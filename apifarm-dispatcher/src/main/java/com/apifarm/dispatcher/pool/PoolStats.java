package com.apifarm.dispatcher.pool;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 凭证池各状态数量快照。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PoolStats {

    private int total;

    private int active;

    private int coolingDown;

    private int disabled;
}
