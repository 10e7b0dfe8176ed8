package com.project.prism.eth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Contents of {@code deployments/<network>.json} written by the contract deployment.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeploymentMetadata {

    @JsonProperty("patientRegistry")
    private String patientRegistry;

    @JsonProperty("dataAccess")
    private String dataAccess;

    @JsonProperty("network")
    private String network;

    @JsonProperty("chainId")
    private Long chainId;

    @JsonProperty("deployedAt")
    private String deployedAt;

    public DeploymentMetadata() {
    }

    public DeploymentMetadata(String patientRegistry, String dataAccess, String network, Long chainId) {
        this.patientRegistry = patientRegistry;
        this.dataAccess = dataAccess;
        this.network = network;
        this.chainId = chainId;
    }

    public String patientRegistry() {
        return patientRegistry;
    }

    public String dataAccess() {
        return dataAccess;
    }

    public String network() {
        return network;
    }

    public Optional<Long> chainId() {
        return Optional.ofNullable(chainId);
    }

    public String deployedAt() {
        return deployedAt;
    }
}
