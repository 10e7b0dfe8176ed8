package com.project.prism.keystore;

import com.project.prism.crypto.DataKey;
import com.project.prism.ledger.OwnerId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local custody of per-owner data keys.
 * <p>
 * Each owner's key is wrapped with AES-256-GCM under a key derived from a passphrase
 * and a per-entry random salt ({@link PassphraseKeyDerivation}). The entries live in a
 * single JSON file bound to this custodian. Writers go through {@link #openForWrite()};
 * {@link #save} and {@link #delete} open a short session themselves.
 */
public class KeyCustodian {
    private static final Logger LOG = LoggerFactory.getLogger(KeyCustodian.class);

    private static final int NONCE_BYTES = 12;
    private static final int GCM_TAG_BITS = 128;
    private static final Map<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final KeystoreFile file;
    private final Path lockPath;
    private final SecureRandom random;

    public KeyCustodian(Path keystorePath) {
        this(keystorePath, new SecureRandom());
    }

    public KeyCustodian(Path keystorePath, SecureRandom random) {
        Objects.requireNonNull(keystorePath, "keystorePath must not be null");
        Path absolute = keystorePath.toAbsolutePath().normalize();
        this.file = new KeystoreFile(absolute);
        this.lockPath = absolute.resolveSibling(absolute.getFileName() + ".lock");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public Path keystorePath() {
        return file.path();
    }

    public SecretKeySpec derive(char[] passphrase, byte[] salt) {
        return PassphraseKeyDerivation.derive(passphrase, salt);
    }

    /**
     * Acquires exclusive write access to the keystore. Close the session to release it.
     *
     * @throws IllegalStateException if the calling thread already holds a session on this file
     */
    public KeystoreSession openForWrite() throws KeystoreException {
        ReentrantLock processLock = PROCESS_LOCKS.computeIfAbsent(file.path(), p -> new ReentrantLock());
        if (processLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("A keystore session is already open on this thread for " + file.path());
        }
        processLock.lock();
        FileChannel channel = null;
        try {
            Files.createDirectories(lockPath.getParent());
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.lock();
            return new KeystoreSession(file, processLock, channel, lock);
        } catch (IOException | RuntimeException e) {
            closeQuietly(channel, e);
            processLock.unlock();
            if (e instanceof KeystoreException ke) {
                throw ke;
            }
            if (e instanceof RuntimeException re) {
                throw re;
            }
            throw new KeystoreException("Failed to lock keystore " + file.path(), e);
        }
    }

    public void save(OwnerId ownerId, DataKey key, char[] passphrase) throws KeystoreException {
        try (KeystoreSession session = openForWrite()) {
            save(session, ownerId, key, passphrase);
        }
    }

    /**
     * Wraps {@code key} with a fresh salt and nonce and writes or overwrites the owner's entry.
     */
    public void save(KeystoreSession session, OwnerId ownerId, DataKey key, char[] passphrase)
            throws KeystoreException {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(key, "key must not be null");

        byte[] salt = new byte[PassphraseKeyDerivation.SALT_BYTES];
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(salt);
        random.nextBytes(nonce);
        byte[] raw = key.getEncoded();
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, derive(passphrase, salt), new GCMParameterSpec(GCM_TAG_BITS, nonce));
            byte[] wrapped = cipher.doFinal(raw);
            session.put(ownerId, KeystoreEntry.of(salt, nonce, wrapped));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM key wrapping unavailable", e);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
        LOG.info("Key saved for owner {}", ownerId);
    }

    /**
     * @throws KeyNotFoundException       if the keystore has no entry for the owner
     * @throws InvalidPassphraseException if the entry does not unwrap under this passphrase
     */
    public DataKey load(OwnerId ownerId, char[] passphrase)
            throws KeystoreException, InvalidPassphraseException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        KeystoreEntry entry = file.read().get(ownerId.value());
        if (entry == null) {
            throw new KeyNotFoundException(ownerId);
        }
        byte[] raw = null;
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, derive(passphrase, entry.saltBytes()),
                    new GCMParameterSpec(GCM_TAG_BITS, entry.nonceBytes()));
            raw = cipher.doFinal(entry.encryptedKeyBytes());
            return DataKey.of(raw);
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new IllegalStateException("AES-GCM key unwrapping unavailable", e);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            // Bad tag, unusable nonce or salt: all read the same to the caller.
            throw new InvalidPassphraseException(e);
        } finally {
            if (raw != null) {
                Arrays.fill(raw, (byte) 0);
            }
        }
    }

    /**
     * Irreversibly removes the owner's entry.
     *
     * @return {@code false} if there was nothing to delete
     */
    public boolean delete(OwnerId ownerId) throws KeystoreException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        boolean removed;
        try (KeystoreSession session = openForWrite()) {
            removed = session.remove(ownerId);
        }
        if (removed) {
            LOG.info("Key deleted for owner {}", ownerId);
        }
        return removed;
    }

    public Set<OwnerId> list() throws KeystoreException {
        Set<OwnerId> owners = new TreeSet<>();
        for (String id : file.read().keySet()) {
            owners.add(OwnerId.of(id));
        }
        return Collections.unmodifiableSet(owners);
    }

    private static void closeQuietly(FileChannel channel, Exception primary) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException suppressed) {
            primary.addSuppressed(suppressed);
        }
    }
}
