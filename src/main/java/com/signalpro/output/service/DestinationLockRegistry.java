package com.signalpro.output.service;

import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-destination 互斥鎖註冊表
 *
 * API 與範例套組可能同時寫同一個檔名（例如 CRCL_ipo_debut.html），
 * 所有寫入都先 {@link #acquire} 該路徑的鎖，寫完再 {@link #release}。
 *
 * API 每次都寫新的時間戳記檔名，所以鎖不能常駐：
 * 每個 entry 記錄目前持有 + 等待中的執行緒數，歸零就從 map 移除。
 * 計數只在 compute 內修改，同一路徑同時間只會有一把鎖。
 */
@Component
public class DestinationLockRegistry {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * 取得並鎖住指定路徑（路徑先正規化成絕對路徑），必須搭配 finally 裡的 release
     */
    public void acquire(Path destination) {
        LockEntry entry = locks.compute(key(destination), (k, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.users++;
            return e;
        });
        entry.lock.lock();
    }

    /**
     * 解鎖；沒有其他執行緒在用就移除 entry
     *
     * @throws IllegalStateException 這個路徑目前沒有被 acquire
     */
    public void release(Path destination) {
        locks.compute(key(destination), (k, e) -> {
            if (e == null) {
                throw new IllegalStateException("路徑未上鎖: " + k);
            }
            e.lock.unlock();
            return --e.users == 0 ? null : e;
        });
    }

    /** 目前仍在使用中的路徑數 */
    int activeCount() {
        return locks.size();
    }

    private static String key(Path destination) {
        return destination.toAbsolutePath().normalize().toString();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
