package com.flowgate.dispatcher.concurrency;

import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.dto.Token;

/**
 * 单账号并发准入控制。
 * <p>
 * 非阻塞：拿不到槽位立即返回 false，不排队。
 * 并发上限为 -1 时总是放行，但仍然计数。
 */
public interface ConcurrencyManager {

    /**
     * 登记或更新账号的并发上限（取自 Token 的 imageConcurrency / videoConcurrency）。
     */
    void registerToken(Token token);

    /**
     * 账号删除后清理其计数。
     */
    void forgetToken(long tokenId);

    /**
     * 尝试占用一个槽位。
     *
     * @return true 表示占用成功，调用方必须在结束时 {@link #release}
     */
    boolean acquire(long tokenId, GenerationType type);

    /**
     * 释放槽位，计数最低为 0。
     */
    void release(long tokenId, GenerationType type);

    /**
     * 是否还有空闲槽位（不占用）。
     */
    boolean hasFreeSlot(long tokenId, GenerationType type);

    /**
     * 当前进行中的任务数。
     */
    int inFlight(long tokenId, GenerationType type);
}
