package com.project.prism.eth;

import com.project.prism.config.ConfigurationException;
import com.project.prism.config.EnvSettings;
import com.project.prism.crypto.Fingerprint;
import com.project.prism.ipfs.ContentIds;
import com.project.prism.ledger.AccessLedger;
import com.project.prism.ledger.AccessStatus;
import com.project.prism.ledger.GenomicRecordPointer;
import com.project.prism.ledger.LedgerEvent;
import com.project.prism.ledger.LedgerRejectedException;
import com.project.prism.ledger.LedgerRejectedException.Reason;
import com.project.prism.ledger.LedgerUnavailableException;
import com.project.prism.ledger.OwnerId;
import com.project.prism.ledger.PointerRetention;
import com.project.prism.ledger.Signer;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGetCode;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.gas.DefaultGasProvider;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.io.Closeable;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AccessLedger} backed by the {@code PatientRegistry} and {@code DataAccess} contracts.
 * <p>
 * Reads are {@code eth_call}s, with {@code from} set to the caller where the contract checks
 * {@code msg.sender}. Writes are first simulated with {@code eth_call} so reverts surface with their reason,
 * then signed by the caller's {@link Web3jSigner} and awaited until mined. The audit stream is rebuilt
 * from contract logs.
 */
public class Web3jAccessLedger implements AccessLedger, Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(Web3jAccessLedger.class);
    private static final long POLL_INTERVAL_MS = 500;
    private static final int EXECUTION_REVERTED = 3;

    private final Web3j web3j;
    private final String registryAddress;
    private final String dataAccessAddress;
    private final long chainId;
    private final TransactionReceiptProcessor receiptProcessor;
    private final PointerRetention retention;

    public Web3jAccessLedger(Web3j web3j, DeploymentMetadata deployment, long chainId,
                             Duration timeout, PointerRetention retention) {
        this.web3j = web3j;
        this.registryAddress = deployment.patientRegistry();
        this.dataAccessAddress = deployment.dataAccess();
        this.chainId = chainId;
        this.retention = retention;
        int attempts = (int) Math.max(1, timeout.toMillis() / POLL_INTERVAL_MS);
        this.receiptProcessor = new PollingTransactionReceiptProcessor(web3j, POLL_INTERVAL_MS, attempts);
    }

    /**
     * Connects using {@code ETH_RPC_URL}, {@code ETH_NETWORK}, {@code DEPLOYMENTS_DIR}, {@code ETH_CHAIN_ID},
     * {@code LEDGER_TIMEOUT_SECONDS} and {@code PRISM_POINTER_RETENTION}, and checks both contracts are deployed.
     */
    public static Web3jAccessLedger connect(EnvSettings settings) throws LedgerUnavailableException {
        String rpcUrl = settings.get("ETH_RPC_URL", "http://127.0.0.1:8545");
        String network = settings.get("ETH_NETWORK", "localhost");
        DeploymentMetadata deployment = new DeploymentRegistry(Path.of(settings.get("DEPLOYMENTS_DIR", "deployments")))
                .require(network);
        Duration timeout = Duration.ofSeconds(settings.getLong("LEDGER_TIMEOUT_SECONDS", 60L));
        PointerRetention retention = PointerRetention.parse(settings.get("PRISM_POINTER_RETENTION", "latest"));

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .build();
        Web3j web3j = Web3j.build(new HttpService(rpcUrl, httpClient));

        long chainId = chainId(settings, deployment).orElseGet(() -> queryChainId(web3j));
        Web3jAccessLedger ledger = new Web3jAccessLedger(web3j, deployment, chainId, timeout, retention);
        ledger.checkContractsExist();
        LOG.info("Connected to {} (chain {}): registry={} dataAccess={}",
                rpcUrl, chainId, deployment.patientRegistry(), deployment.dataAccess());
        return ledger;
    }

    // ----- Mutations -----

    @Override
    public void registerOwner(Signer signer) throws LedgerUnavailableException {
        transact(signer, registryAddress, ContractAbi.register());
        LOG.info("Registered owner {}", signer.identity());
    }

    @Override
    public void publishPointer(Signer signer, String contentId, Fingerprint fingerprint)
            throws LedgerUnavailableException {
        String cid = ContentIds.normalize(contentId);
        transact(signer, dataAccessAddress, ContractAbi.uploadData(cid, fingerprint.toHex()));
        LOG.info("Published pointer for {}: cid={} fingerprint={}", signer.identity(), cid, fingerprint.abbreviated());
    }

    @Override
    public void requestAccess(Signer signer, OwnerId ownerId) throws LedgerUnavailableException {
        if (signer.identity().equals(ownerId)) {
            throw new LedgerRejectedException(Reason.INVALID_TRANSITION, "Owner cannot request access to its own data");
        }
        transact(signer, dataAccessAddress, ContractAbi.requestAccess(address(ownerId)));
        LOG.info("{} requested access to {}", signer.identity(), ownerId);
    }

    @Override
    public void approve(Signer signer, OwnerId requesterId) throws LedgerUnavailableException {
        transact(signer, dataAccessAddress, ContractAbi.approveAccess(address(requesterId)));
        LOG.info("{} approved access for {}", signer.identity(), requesterId);
    }

    @Override
    public void revoke(Signer signer, OwnerId requesterId) throws LedgerUnavailableException {
        transact(signer, dataAccessAddress, ContractAbi.revokeAccess(address(requesterId)));
        LOG.info("{} revoked access for {}", signer.identity(), requesterId);
    }

    // ----- Queries -----

    @Override
    public boolean isOwner(OwnerId id) throws LedgerUnavailableException {
        @SuppressWarnings("rawtypes")
        List<Type> decoded = call(registryAddress, ContractAbi.isPatient(address(id)), null);
        return !decoded.isEmpty() && Boolean.TRUE.equals(decoded.get(0).getValue());
    }

    @Override
    public boolean checkAccess(OwnerId ownerId, OwnerId requesterId) throws LedgerUnavailableException {
        @SuppressWarnings("rawtypes")
        List<Type> decoded = call(dataAccessAddress,
                ContractAbi.checkAccess(address(ownerId), address(requesterId)), null);
        return !decoded.isEmpty() && Boolean.TRUE.equals(decoded.get(0).getValue());
    }

    /**
     * {@code APPROVED} comes from the contract; the other states are derived from the pair's last access event.
     */
    @Override
    public AccessStatus accessStatus(OwnerId ownerId, OwnerId requesterId) throws LedgerUnavailableException {
        if (checkAccess(ownerId, requesterId)) {
            return AccessStatus.APPROVED;
        }
        AccessStatus status = AccessStatus.NONE;
        for (LedgerEvent event : events()) {
            if (event instanceof LedgerEvent.AccessRequested requested
                    && requested.owner().equals(ownerId) && requested.requester().equals(requesterId)) {
                status = AccessStatus.REQUESTED;
            } else if (event instanceof LedgerEvent.AccessRevoked revoked
                    && revoked.owner().equals(ownerId) && revoked.requester().equals(requesterId)) {
                status = AccessStatus.REVOKED;
            }
        }
        return status;
    }

    @Override
    public GenomicRecordPointer readPointer(OwnerId ownerId, OwnerId callerId) throws LedgerUnavailableException {
        @SuppressWarnings("rawtypes")
        List<Type> decoded = call(dataAccessAddress, ContractAbi.getGenomicData(address(ownerId)), callerId);
        String cid = decoded.size() < 2 ? "" : (String) decoded.get(0).getValue();
        String hash = decoded.size() < 2 ? "" : (String) decoded.get(1).getValue();
        if (cid == null || cid.isEmpty()) {
            throw new LedgerRejectedException(Reason.NO_DATA, "No data published by " + ownerId);
        }
        return new GenomicRecordPointer(ownerId, cid, parseFingerprint(hash), null);
    }

    @Override
    public List<GenomicRecordPointer> readPointerHistory(OwnerId ownerId, OwnerId callerId)
            throws LedgerUnavailableException {
        GenomicRecordPointer live;
        try {
            live = readPointer(ownerId, callerId);
        } catch (LedgerRejectedException e) {
            if (e.reason() == Reason.NO_DATA) {
                return List.of();
            }
            throw e;
        }
        List<GenomicRecordPointer> history = new ArrayList<>();
        for (LedgerEvent event : events()) {
            if (event instanceof LedgerEvent.DataPublished published && published.owner().equals(ownerId)) {
                history.add(published.pointer());
            }
        }
        if (history.isEmpty()) {
            return List.of(live);
        }
        if (retention == PointerRetention.LATEST_ONLY) {
            return List.of(history.get(history.size() - 1));
        }
        return history;
    }

    @Override
    public List<LedgerEvent> events() throws LedgerUnavailableException {
        EthFilter filter = new EthFilter(DefaultBlockParameterName.EARLIEST, DefaultBlockParameterName.LATEST,
                List.of(registryAddress, dataAccessAddress));
        EthLog ethLog;
        try {
            ethLog = web3j.ethGetLogs(filter).send();
        } catch (IOException e) {
            throw new LedgerUnavailableException("Failed to fetch ledger logs: " + e.getMessage(), e);
        }
        if (ethLog.hasError()) {
            throw new LedgerUnavailableException("Ledger RPC error: " + ethLog.getError().getMessage());
        }

        List<Log> logs = new ArrayList<>();
        for (EthLog.LogResult<?> result : ethLog.getLogs()) {
            if (result.get() instanceof Log log) {
                logs.add(log);
            }
        }
        logs.sort(Comparator.comparing(Log::getBlockNumber).thenComparing(Log::getLogIndex));

        Map<BigInteger, Instant> blockTimes = new HashMap<>();
        List<LedgerEvent> events = new ArrayList<>();
        for (Log log : logs) {
            Instant timestamp = blockTime(log.getBlockNumber(), blockTimes);
            decode(log, events.size() + 1, timestamp).ifPresent(events::add);
        }
        return events;
    }

    @Override
    public PointerRetention retention() {
        return retention;
    }

    @Override
    public void close() {
        web3j.shutdown();
    }

    // ----- Internal helpers -----

    private void transact(Signer signer, String contract, Function function) throws LedgerUnavailableException {
        if (!(signer instanceof Web3jSigner ethSigner)) {
            throw new IllegalArgumentException("On-chain writes need a Web3jSigner, got " + signer);
        }
        // Surfaces the revert reason before any gas is spent.
        call(contract, function, signer.identity());

        String data = FunctionEncoder.encode(function);
        TransactionManager transactionManager = ethSigner.transactionManager(web3j, chainId);
        try {
            EthSendTransaction sent = transactionManager.sendTransaction(
                    DefaultGasProvider.GAS_PRICE, DefaultGasProvider.GAS_LIMIT, contract, data, BigInteger.ZERO);
            if (sent.hasError()) {
                String message = sent.getError().getMessage();
                if (isRevert(message)) {
                    throw RevertReasons.toException(message);
                }
                throw new LedgerUnavailableException("Transaction " + function.getName() + " rejected by node: " + message);
            }
            TransactionReceipt receipt = receiptProcessor.waitForTransactionReceipt(sent.getTransactionHash());
            if (!receipt.isStatusOK()) {
                String reason = receipt.getRevertReason();
                throw RevertReasons.toException(reason != null ? reason : "");
            }
            LOG.debug("{} mined in block {} ({})", function.getName(), receipt.getBlockNumber(), receipt.getTransactionHash());
        } catch (TransactionException e) {
            throw new LedgerUnavailableException("Timed out waiting for " + function.getName() + " receipt", e);
        } catch (IOException e) {
            throw new LedgerUnavailableException("Failed to send " + function.getName() + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("rawtypes")
    private List<Type> call(String contract, Function function, OwnerId from) throws LedgerUnavailableException {
        Transaction callTx = Transaction.createEthCallTransaction(
                from == null ? null : address(from), contract, FunctionEncoder.encode(function));
        EthCall response;
        try {
            response = web3j.ethCall(callTx, DefaultBlockParameterName.LATEST).send();
        } catch (IOException e) {
            throw new LedgerUnavailableException("Ledger call " + function.getName() + " failed: " + e.getMessage(), e);
        }
        if (response.hasError()) {
            // Nodes report every JSON-RPC failure through the same error object; only reverts are rejections.
            Response.Error error = response.getError();
            if (error.getCode() == EXECUTION_REVERTED || isRevert(error.getMessage())) {
                throw RevertReasons.toException(error.getMessage());
            }
            throw new LedgerUnavailableException("Ledger RPC error " + error.getCode() + ": " + error.getMessage());
        }
        if (response.isReverted()) {
            throw RevertReasons.toException(response.getRevertReason());
        }
        return FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
    }

    private Optional<LedgerEvent> decode(Log log, long sequence, Instant timestamp) {
        List<String> topics = log.getTopics();
        if (topics == null || topics.isEmpty()) {
            return Optional.empty();
        }
        String topic = topics.get(0);
        if (ContractAbi.PATIENT_REGISTERED_TOPIC.equals(topic)) {
            return Optional.of(new LedgerEvent.OwnerRegistered(sequence, indexedAddress(topics, 1), timestamp));
        }
        if (ContractAbi.DATA_UPLOADED_TOPIC.equals(topic)) {
            @SuppressWarnings("rawtypes")
            List<Type> values = FunctionReturnDecoder.decode(log.getData(),
                    ContractAbi.DATA_UPLOADED.getNonIndexedParameters());
            return Optional.of(new LedgerEvent.DataPublished(sequence, indexedAddress(topics, 1),
                    (String) values.get(0).getValue(), parseFingerprint((String) values.get(1).getValue()), timestamp));
        }
        if (ContractAbi.ACCESS_REQUESTED_TOPIC.equals(topic)) {
            return Optional.of(new LedgerEvent.AccessRequested(sequence,
                    indexedAddress(topics, 1), indexedAddress(topics, 2), timestamp));
        }
        if (ContractAbi.ACCESS_APPROVED_TOPIC.equals(topic)) {
            return Optional.of(new LedgerEvent.AccessApproved(sequence,
                    indexedAddress(topics, 1), indexedAddress(topics, 2), timestamp));
        }
        if (ContractAbi.ACCESS_REVOKED_TOPIC.equals(topic)) {
            return Optional.of(new LedgerEvent.AccessRevoked(sequence,
                    indexedAddress(topics, 1), indexedAddress(topics, 2), timestamp));
        }
        return Optional.empty();
    }

    private Instant blockTime(BigInteger blockNumber, Map<BigInteger, Instant> cache) throws LedgerUnavailableException {
        Instant cached = cache.get(blockNumber);
        if (cached != null) {
            return cached;
        }
        try {
            EthBlock block = web3j.ethGetBlockByNumber(DefaultBlockParameter.valueOf(blockNumber), false).send();
            if (block.hasError() || block.getBlock() == null) {
                throw new LedgerUnavailableException("Block " + blockNumber + " not available");
            }
            Instant time = Instant.ofEpochSecond(block.getBlock().getTimestamp().longValueExact());
            cache.put(blockNumber, time);
            return time;
        } catch (IOException e) {
            throw new LedgerUnavailableException("Failed to fetch block " + blockNumber + ": " + e.getMessage(), e);
        }
    }

    private void checkContractsExist() throws LedgerUnavailableException {
        for (String contract : List.of(registryAddress, dataAccessAddress)) {
            EthGetCode code;
            try {
                code = web3j.ethGetCode(contract, DefaultBlockParameterName.LATEST).send();
            } catch (IOException e) {
                throw new LedgerUnavailableException("Ledger node unreachable: " + e.getMessage(), e);
            }
            if (code.hasError()) {
                throw new LedgerUnavailableException(String.format(
                        "Error checking contract code at %s: %s", contract, code.getError().getMessage()));
            }
            String bytecode = code.getCode();
            if (bytecode == null || bytecode.isEmpty() || bytecode.equals("0x")) {
                throw new ConfigurationException(String.format(
                        "No contract code found at %s. If the node was restarted, redeploy the contracts "
                                + "and update the deployment metadata.", contract));
            }
        }
    }

    /**
     * {@code ETH_CHAIN_ID} if set, else the deployment file's chain id.
     *
     * @throws ConfigurationException if {@code ETH_CHAIN_ID} is not a number
     */
    static Optional<Long> chainId(EnvSettings settings, DeploymentMetadata deployment) {
        Optional<String> configured = settings.get("ETH_CHAIN_ID");
        if (configured.isEmpty()) {
            return deployment.chainId();
        }
        try {
            return Optional.of(Long.parseLong(configured.get()));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("ETH_CHAIN_ID must be a number, got '" + configured.get() + "'", e);
        }
    }

    private static long queryChainId(Web3j web3j) {
        try {
            return web3j.ethChainId().send().getChainId().longValueExact();
        } catch (IOException e) {
            throw new ConfigurationException("ETH_CHAIN_ID not set and the node did not report one", e);
        }
    }

    private static OwnerId indexedAddress(List<String> topics, int index) {
        Type<?> value = FunctionReturnDecoder.decodeIndexedValue(topics.get(index), new TypeReference<Address>() {});
        return OwnerId.of(((Address) value).getValue());
    }

    private static Fingerprint parseFingerprint(String hex) {
        try {
            return Fingerprint.fromHex(hex);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Ledger holds a malformed fingerprint: '" + hex + "'", e);
        }
    }

    private static String address(OwnerId id) {
        if (!id.isAddress()) {
            throw new IllegalArgumentException("On-chain identities must be Ethereum addresses: " + id);
        }
        return id.value();
    }

    private static boolean isRevert(String message) {
        return message != null && message.toLowerCase(Locale.ROOT).contains("revert");
    }
}
