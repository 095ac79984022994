package service;

import lombok.extern.slf4j.Slf4j;
import model.ByteString;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 모든 연결이 공유하는 키-값 저장소.
 *
 * <p>내부 맵은 하나의 락으로 보호되며, 각 메서드는 맵 연산 하나 동안만 락을 잡습니다.
 * 맵 자체는 밖으로 노출하지 않습니다.
 */
@Slf4j
public class StorageService {

    private final Map<ByteString, ByteString> keyValueStore = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * 키에 해당하는 값을 가져옵니다. 없으면 null.
     */
    public ByteString get(ByteString key) {
        lock.lock();
        try {
            return keyValueStore.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 키-값을 저장합니다. 기존 값은 덮어씁니다.
     */
    public void set(ByteString key, ByteString value) {
        lock.lock();
        try {
            keyValueStore.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 키를 삭제합니다.
     * @return 실제로 삭제되었으면 true
     */
    public boolean delete(ByteString key) {
        lock.lock();
        try {
            return keyValueStore.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 여러 키를 하나씩 삭제하고 삭제된 개수를 반환합니다.
     * 키마다 락을 따로 잡으므로 전체가 원자적이지는 않습니다.
     */
    public long delete(List<ByteString> keys) {
        long removed = 0;
        for (ByteString key : keys) {
            if (delete(key)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * 저장소를 비웁니다.
     */
    public void clear() {
        int cleared;
        lock.lock();
        try {
            cleared = keyValueStore.size();
            keyValueStore.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Flushed {} keys", cleared);
    }

    public int size() {
        lock.lock();
        try {
            return keyValueStore.size();
        } finally {
            lock.unlock();
        }
    }
}
