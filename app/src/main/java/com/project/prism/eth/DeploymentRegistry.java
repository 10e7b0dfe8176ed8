package com.project.prism.eth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.prism.config.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public class DeploymentRegistry {

    private final Path deploymentsDirectory;
    private final ObjectMapper mapper = new ObjectMapper();

    public DeploymentRegistry(Path deploymentsDirectory) {
        this.deploymentsDirectory = deploymentsDirectory;
    }

    public Optional<DeploymentMetadata> load(String networkName) {
        Path file = deploymentsDirectory.resolve(networkName + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), DeploymentMetadata.class));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read deployment metadata: " + file, e);
        }
    }

    /**
     * @throws ConfigurationException if the file is missing or lacks a contract address
     */
    public DeploymentMetadata require(String networkName) {
        DeploymentMetadata metadata = load(networkName).orElseThrow(() -> new ConfigurationException(
                "No deployment metadata for network '" + networkName + "' in " + deploymentsDirectory));
        if (isBlank(metadata.patientRegistry()) || isBlank(metadata.dataAccess())) {
            throw new ConfigurationException(
                    "Deployment metadata for '" + networkName + "' must name patientRegistry and dataAccess");
        }
        return metadata;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
