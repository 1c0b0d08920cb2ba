package com.demo.tokenauth.store;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的吊销名单，适用于单实例部署与测试。
 */
public class InMemoryRevocationStore implements RevocationStore {

    private final Set<String> keys = ConcurrentHashMap.newKeySet();

    @Override
    public boolean exists(String key) {
        requireKey(key);
        return keys.contains(key);
    }

    @Override
    public void insert(String key) {
        requireKey(key);
        keys.add(key);
    }

    @Override
    public void delete(String key) {
        requireKey(key);
        keys.remove(key);
    }

    public int size() {
        return keys.size();
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }
}
