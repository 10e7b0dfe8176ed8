package com.project.prism.core;

/**
 * The blob is stored but its pointer did not reach the ledger. Retry with
 * {@link UploadService#publish(com.project.prism.ledger.Signer, UploadReceipt)} using {@link #receipt()}.
 */
public class PublishFailedException extends Exception {

    private final UploadReceipt receipt;

    public PublishFailedException(UploadReceipt receipt, Throwable cause) {
        super("Blob " + receipt.contentId() + " stored but pointer not published: " + cause.getMessage(), cause);
        this.receipt = receipt;
    }

    public UploadReceipt receipt() {
        return receipt;
    }
}
