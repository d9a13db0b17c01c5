package com.memkv.storage;

import java.util.HashMap;
import java.util.Map;

// Not thread-safe, owned by the StorageEngine loop.
class KVStore {
    private Map<String, String> map = new HashMap<>();
    private int deletionsSinceCompaction = 0;

    void set(String key, String value) {
        map.put(key, value);
    }

    String get(String key) {
        return map.get(key);
    }

    void delete(String key) {
        map.remove(key);
        deletionsSinceCompaction++;
    }

    int size() {
        return map.size();
    }

    int getDeletionsSinceCompaction() {
        return deletionsSinceCompaction;
    }

    // a fresh table drops the slack left behind by removed entries
    void compact() {
        map = new HashMap<>(map);
        deletionsSinceCompaction = 0;
    }
}
