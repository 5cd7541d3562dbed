package io.chariot.session;

import java.util.HashMap;
import java.util.Map;

/**
 * One instance per (entity family, id) within a session.
 */
final class IdentityMap {

    record Key(Class<?> family, Object id) {
        Key {
            if (family == null) {
                throw new IllegalArgumentException("family required");
            }
            if (id == null) {
                throw new IllegalArgumentException("id required");
            }
        }
    }

    private final Map<Key, Object> entities = new HashMap<>();

    Object get(Key key) {
        return entities.get(key);
    }

    /**
     * @return true if the key was absent and the entity is now mapped
     */
    boolean putIfAbsent(Key key, Object entity) {
        return entities.putIfAbsent(key, entity) == null;
    }

    void evict(Key key) {
        entities.remove(key);
    }

    int size() {
        return entities.size();
    }

    void clear() {
        entities.clear();
    }
}
