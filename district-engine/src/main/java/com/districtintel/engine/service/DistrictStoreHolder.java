package com.districtintel.engine.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current snapshot. Readers take the reference once per request and
 * keep using it even if a newer snapshot is published meanwhile.
 */
@Component
public class DistrictStoreHolder {

    private final AtomicReference<StoreSnapshot> current = new AtomicReference<>(StoreSnapshot.empty());

    public StoreSnapshot current() {
        return current.get();
    }

    /** @return the snapshot that was replaced */
    public StoreSnapshot publish(StoreSnapshot snapshot) {
        if (snapshot == null) throw new IllegalArgumentException("snapshot must not be null");
        return current.getAndSet(snapshot);
    }
}
