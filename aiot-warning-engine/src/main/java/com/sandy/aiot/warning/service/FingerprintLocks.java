package com.sandy.aiot.warning.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped in-process locks keyed by warning signature. Two fingerprints may share a stripe;
 * one fingerprint always maps to the same stripe.
 */
@Component
public class FingerprintLocks {

    private final ReentrantLock[] stripes;

    public FingerprintLocks(@Value("${warning.lock.stripes:64}") int stripeCount) {
        if (stripeCount < 1) throw new IllegalArgumentException("warning.lock.stripes must be >= 1");
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(String signature) {
        return stripes[Math.floorMod(signature.hashCode(), stripes.length)];
    }
}
