package com.project.prism.eth;

import com.project.prism.config.ConfigurationException;
import com.project.prism.config.EnvSettings;
import com.project.prism.ledger.OwnerId;
import com.project.prism.ledger.Signer;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;

/**
 * Signs ledger transactions with an Ethereum key. The key never leaves this object;
 * the ledger only receives a {@link TransactionManager} bound to it.
 */
public final class Web3jSigner implements Signer {

    private final Credentials credentials;
    private final OwnerId identity;

    private Web3jSigner(Credentials credentials) {
        this.credentials = credentials;
        this.identity = OwnerId.of(credentials.getAddress());
    }

    public static Web3jSigner fromPrivateKey(String privateKeyHex) {
        return new Web3jSigner(Credentials.create(privateKeyHex));
    }

    /**
     * @throws ConfigurationException if {@code ETH_PRIVATE_KEY} is not set
     */
    public static Web3jSigner fromSettings(EnvSettings settings) {
        return fromPrivateKey(settings.require("ETH_PRIVATE_KEY"));
    }

    @Override
    public OwnerId identity() {
        return identity;
    }

    TransactionManager transactionManager(Web3j web3j, long chainId) {
        return new RawTransactionManager(web3j, credentials, chainId);
    }

    @Override
    public String toString() {
        return "Web3jSigner[" + identity + "]";
    }
}
