package com.project.prism.eth;

import com.project.prism.config.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeploymentRegistryTest {

    @TempDir
    Path dir;

    @Test
    void loadsDeploymentFile() throws Exception {
        Files.writeString(dir.resolve("localhost.json"), "{"
                + "\"patientRegistry\":\"0x5FbDB2315678afecb367f032d93F642f64180aa3\","
                + "\"dataAccess\":\"0xe7f1725E7734CE288F8367e1Bb143E90bb3F0512\","
                + "\"network\":\"localhost\",\"chainId\":31337,"
                + "\"deployedAt\":\"2026-01-01T00:00:00Z\",\"deployer\":\"ignored\"}");

        DeploymentMetadata metadata = new DeploymentRegistry(dir).require("localhost");

        assertEquals("0x5FbDB2315678afecb367f032d93F642f64180aa3", metadata.patientRegistry());
        assertEquals("0xe7f1725E7734CE288F8367e1Bb143E90bb3F0512", metadata.dataAccess());
        assertEquals(31337L, metadata.chainId().orElseThrow());
    }

    @Test
    void missingFileIsEmptyOrConfigurationError() {
        DeploymentRegistry registry = new DeploymentRegistry(dir);

        assertTrue(registry.load("sepolia").isEmpty());
        assertThrows(ConfigurationException.class, () -> registry.require("sepolia"));
    }

    @Test
    void incompleteOrMalformedFilesAreRejected() throws Exception {
        Files.writeString(dir.resolve("partial.json"), "{\"patientRegistry\":\"0xabc\"}");
        Files.writeString(dir.resolve("broken.json"), "{not json");
        DeploymentRegistry registry = new DeploymentRegistry(dir);

        assertThrows(ConfigurationException.class, () -> registry.require("partial"));
        assertThrows(ConfigurationException.class, () -> registry.load("broken"));
    }
}
