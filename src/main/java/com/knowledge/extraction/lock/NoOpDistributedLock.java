package com.knowledge.extraction.lock;

/**
 * Lock that always succeeds immediately. For single-writer setups and tests.
 */
public class NoOpDistributedLock implements DistributedLock {

    @Override
    public boolean tryLock(String key) {
        return true;
    }

    @Override
    public void unlock(String key) {
        // no-op
    }
}
