package com.project.prism.ipfs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Content-addressed blob directory for offline runs and tests. Each blob is stored as a file named
 * after {@link ContentIds#deriveLocal(byte[])}; unpinning deletes the file.
 */
public class LocalDirectoryBlobStore implements BlobStore {
    private static final Logger LOG = LoggerFactory.getLogger(LocalDirectoryBlobStore.class);

    private final Path directory;

    public LocalDirectoryBlobStore(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public String put(byte[] bytes, String name) throws BlobStoreException {
        String cid = ContentIds.deriveLocal(bytes);
        Path target = directory.resolve(cid);
        try {
            Files.createDirectories(directory);
            if (!Files.exists(target)) {
                Path tmp = Files.createTempFile(directory, cid, ".tmp");
                Files.write(tmp, bytes);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot write blob " + cid + ": " + e.getMessage(), e);
        }
        LOG.info("Stored {} ({} bytes) as {}", name, bytes.length, cid);
        return cid;
    }

    @Override
    public byte[] get(String contentId) throws BlobStoreException {
        String cid = ContentIds.normalize(contentId);
        try {
            return Files.readAllBytes(directory.resolve(cid));
        } catch (NoSuchFileException e) {
            throw new BlobNotFoundException(cid);
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot read blob " + cid + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void unpin(String contentId) throws BlobStoreException {
        String cid = ContentIds.normalize(contentId);
        try {
            if (!Files.deleteIfExists(directory.resolve(cid))) {
                throw new BlobNotFoundException(cid);
            }
        } catch (IOException e) {
            if (e instanceof BlobStoreException blobError) {
                throw blobError;
            }
            throw new StoreUnavailableException("Cannot delete blob " + cid + ": " + e.getMessage(), e);
        }
        LOG.info("Unpinned {}", cid);
    }

    @Override
    public Set<String> list() throws BlobStoreException {
        Set<String> cids = new TreeSet<>();
        if (!Files.isDirectory(directory)) {
            return cids;
        }
        try (Stream<Path> files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                    .filter(n -> n.startsWith(ContentIds.LOCAL_PREFIX) && !n.endsWith(".tmp"))
                    .forEach(cids::add);
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot list " + directory + ": " + e.getMessage(), e);
        }
        return cids;
    }

    @Override
    public boolean testAuth() {
        try {
            Files.createDirectories(directory);
            return Files.isWritable(directory);
        } catch (IOException e) {
            LOG.debug("Blob directory {} unusable: {}", directory, e.getMessage());
            return false;
        }
    }
}
