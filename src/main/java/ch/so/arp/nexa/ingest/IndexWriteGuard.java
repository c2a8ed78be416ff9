package ch.so.arp.nexa.ingest;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Orders document writes against whole-index maintenance. Ingesting or
 * deleting a document holds the shared lock, so documents are still written
 * in parallel. Clearing and rebuilding the index hold the exclusive lock and
 * wait until every in-flight document has reached both the index and the
 * catalog.
 */
public class IndexWriteGuard {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Lock shared() {
        return lock.readLock();
    }

    public Lock exclusive() {
        return lock.writeLock();
    }
}
