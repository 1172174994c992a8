package com.openrangelabs.donpetre.issuesync.importer;

import com.openrangelabs.donpetre.issuesync.exception.ImportAlreadyRunningException;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Admits at most one active import run at a time
 */
class ActiveSessionGuard {

    private final ReentrantLock lock = new ReentrantLock();
    private ImportRun active;

    void acquire(ImportRun run) {
        lock.lock();
        try {
            if (active != null) {
                throw new ImportAlreadyRunningException(active.session().getSessionId());
            }
            active = run;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the guard if {@code run} still holds it
     */
    void release(ImportRun run) {
        lock.lock();
        try {
            if (active == run) {
                active = null;
            }
        } finally {
            lock.unlock();
        }
    }

    ImportRun current() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }
}
