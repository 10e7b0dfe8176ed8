package com.project.prism;

import com.project.prism.config.EnvSettings;
import com.project.prism.core.RetrieveService;
import com.project.prism.core.UploadService;
import com.project.prism.crypto.AuthenticatedCipher;
import com.project.prism.crypto.ContentFingerprinter;
import com.project.prism.eth.Web3jAccessLedger;
import com.project.prism.eth.Web3jSigner;
import com.project.prism.ipfs.BlobStore;
import com.project.prism.ipfs.BlobStores;
import com.project.prism.keystore.KeyCustodian;
import com.project.prism.ledger.AccessLedger;
import com.project.prism.ledger.LedgerUnavailableException;
import com.project.prism.ledger.Signer;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Components shared by the command-line entry points. The blob store, ledger and signer are
 * created on first use so that key management commands work without network settings.
 */
public final class PrismContext implements AutoCloseable {

    private final KeyCustodian custodian;
    private final Supplier<BlobStore> blobStoreFactory;
    private final LedgerFactory ledgerFactory;
    private final Supplier<Signer> signerFactory;
    private final boolean unpinSuperseded;
    private final AuthenticatedCipher cipher = new AuthenticatedCipher();
    private final ContentFingerprinter fingerprinter = new ContentFingerprinter();

    private BlobStore blobStore;
    private AccessLedger ledger;
    private Signer signer;

    private PrismContext(KeyCustodian custodian, Supplier<BlobStore> blobStoreFactory, LedgerFactory ledgerFactory,
                         Supplier<Signer> signerFactory, boolean unpinSuperseded) {
        this.custodian = custodian;
        this.blobStoreFactory = blobStoreFactory;
        this.ledgerFactory = ledgerFactory;
        this.signerFactory = signerFactory;
        this.unpinSuperseded = unpinSuperseded;
    }

    public static PrismContext fromSettings(EnvSettings settings) {
        return new PrismContext(
                new KeyCustodian(Path.of(settings.get("PRISM_KEYSTORE_PATH", ".keystore.json"))),
                () -> BlobStores.fromSettings(settings),
                () -> Web3jAccessLedger.connect(settings),
                () -> Web3jSigner.fromSettings(settings),
                settings.getBoolean("PRISM_UNPIN_SUPERSEDED", false));
    }

    public static PrismContext of(KeyCustodian custodian, BlobStore blobStore, AccessLedger ledger, Signer signer) {
        return new PrismContext(custodian, () -> blobStore, () -> ledger, () -> signer, false);
    }

    public KeyCustodian custodian() {
        return custodian;
    }

    public AuthenticatedCipher cipher() {
        return cipher;
    }

    public synchronized BlobStore blobStore() {
        if (blobStore == null) {
            blobStore = blobStoreFactory.get();
        }
        return blobStore;
    }

    public synchronized AccessLedger ledger() throws LedgerUnavailableException {
        if (ledger == null) {
            ledger = ledgerFactory.create();
        }
        return ledger;
    }

    public synchronized Signer signer() {
        if (signer == null) {
            signer = signerFactory.get();
        }
        return signer;
    }

    public UploadService uploadService() throws LedgerUnavailableException {
        return new UploadService(cipher, fingerprinter, blobStore(), ledger(), unpinSuperseded);
    }

    public RetrieveService retrieveService() throws LedgerUnavailableException {
        return new RetrieveService(cipher, fingerprinter, blobStore(), ledger());
    }

    @Override
    public synchronized void close() throws IOException {
        if (ledger instanceof Closeable closeable) {
            closeable.close();
        }
    }

    @FunctionalInterface
    private interface LedgerFactory {
        AccessLedger create() throws LedgerUnavailableException;
    }
}
