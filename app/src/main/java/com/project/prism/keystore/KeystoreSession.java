package com.project.prism.keystore;

import com.project.prism.ledger.OwnerId;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive write access to a keystore file.
 * <p>
 * Obtained from {@link KeyCustodian#openForWrite()}; holds an in-process lock and an
 * OS file lock until {@link #close()}. Every mutation is persisted before it returns.
 */
public final class KeystoreSession implements AutoCloseable {

    private final KeystoreFile file;
    private final ReentrantLock processLock;
    private final FileChannel lockChannel;
    private final FileLock fileLock;
    private final TreeMap<String, KeystoreEntry> entries;
    private boolean closed;

    KeystoreSession(KeystoreFile file, ReentrantLock processLock, FileChannel lockChannel, FileLock fileLock)
            throws KeystoreException {
        this.file = file;
        this.processLock = processLock;
        this.lockChannel = lockChannel;
        this.fileLock = fileLock;
        this.entries = file.read();
    }

    public boolean contains(OwnerId ownerId) {
        ensureOpen();
        return entries.containsKey(ownerId.value());
    }

    void put(OwnerId ownerId, KeystoreEntry entry) throws KeystoreException {
        ensureOpen();
        KeystoreEntry previous = entries.put(ownerId.value(), entry);
        try {
            file.write(entries);
        } catch (KeystoreException e) {
            restore(ownerId, previous);
            throw e;
        }
    }

    boolean remove(OwnerId ownerId) throws KeystoreException {
        ensureOpen();
        KeystoreEntry previous = entries.remove(ownerId.value());
        if (previous == null) {
            return false;
        }
        try {
            file.write(entries);
        } catch (KeystoreException e) {
            restore(ownerId, previous);
            throw e;
        }
        return true;
    }

    private void restore(OwnerId ownerId, KeystoreEntry previous) {
        if (previous == null) {
            entries.remove(ownerId.value());
        } else {
            entries.put(ownerId.value(), previous);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Keystore session already closed");
        }
    }

    @Override
    public void close() throws KeystoreException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            fileLock.release();
            lockChannel.close();
        } catch (IOException e) {
            throw new KeystoreException("Failed to release keystore lock for " + file.path(), e);
        } finally {
            processLock.unlock();
        }
    }
}
