package com.flowgate.dispatcher.concurrency;

import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.dto.Token;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于内存的并发计数器。
 * <p>
 * 每个 (账号, 媒体类型) 维护一个上限和进行中计数，所有读写在同一把锁内完成。
 * 未登记的账号按不限并发处理。
 */
@Slf4j
public class InMemoryConcurrencyManager implements ConcurrencyManager {

    private final ReentrantLock lock = new ReentrantLock();

    /** tokenId -> (类型 -> 槽位) */
    private final Map<Long, Map<GenerationType, Slot>> slots = new HashMap<>();

    @Override
    public void registerToken(Token token) {
        lock.lock();
        try {
            Map<GenerationType, Slot> bySlot = slotsOf(token.getId());
            bySlot.get(GenerationType.IMAGE).limit = token.getImageConcurrency();
            bySlot.get(GenerationType.VIDEO).limit = token.getVideoConcurrency();
            log.debug("登记账号并发上限: token={}, image={}, video={}",
                    token.getId(), token.getImageConcurrency(), token.getVideoConcurrency());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void forgetToken(long tokenId) {
        lock.lock();
        try {
            slots.remove(tokenId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean acquire(long tokenId, GenerationType type) {
        lock.lock();
        try {
            Slot slot = slotsOf(tokenId).get(type);
            if (!slot.hasRoom()) {
                log.debug("账号 {} 的{}并发已满 ({}/{})", tokenId, type.getLabel(), slot.inFlight, slot.limit);
                return false;
            }
            slot.inFlight++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(long tokenId, GenerationType type) {
        lock.lock();
        try {
            Map<GenerationType, Slot> bySlot = slots.get(tokenId);
            if (bySlot == null) {
                return;
            }
            Slot slot = bySlot.get(type);
            slot.inFlight = Math.max(0, slot.inFlight - 1);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hasFreeSlot(long tokenId, GenerationType type) {
        lock.lock();
        try {
            Map<GenerationType, Slot> bySlot = slots.get(tokenId);
            return bySlot == null || bySlot.get(type).hasRoom();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int inFlight(long tokenId, GenerationType type) {
        lock.lock();
        try {
            Map<GenerationType, Slot> bySlot = slots.get(tokenId);
            return bySlot == null ? 0 : bySlot.get(type).inFlight;
        } finally {
            lock.unlock();
        }
    }

    private Map<GenerationType, Slot> slotsOf(long tokenId) {
        return slots.computeIfAbsent(tokenId, id -> {
            Map<GenerationType, Slot> created = new EnumMap<>(GenerationType.class);
            for (GenerationType type : GenerationType.values()) {
                created.put(type, new Slot());
            }
            return created;
        });
    }

    private static final class Slot {
        private int limit = Token.UNLIMITED;
        private int inFlight;

        private boolean hasRoom() {
            return limit < 0 || inFlight < limit;
        }
    }
}
