package com.pgpulse.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgpulse.model.ConnectionProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Durable record of the profile being monitored: a single JSON file under the data directory.
 *
 * <p>The file exists exactly while monitoring is active, so a restarted process can resume it.
 */
@Component
public class ProfileRepository {
    private static final Logger log = LoggerFactory.getLogger(ProfileRepository.class);

    public static final String CONFIG_FILE = "monitoring_config.json";

    private final ObjectMapper objectMapper;
    private final Path configFile;

    @Autowired
    public ProfileRepository(ObjectMapper objectMapper, @Value("${pgpulse.data-dir:data}") String dataDir) {
        this(objectMapper, Paths.get(dataDir));
    }

    public ProfileRepository(ObjectMapper objectMapper, Path dataDir) {
        this.objectMapper = objectMapper;
        this.configFile = dataDir.resolve(CONFIG_FILE);
    }

    /**
     * Overwrites the stored profile.
     *
     * @param profile profile to persist
     */
    public void save(ConnectionProfile profile) {
        try {
            Files.createDirectories(configFile.getParent());
            Path tmp = configFile.resolveSibling(CONFIG_FILE + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), profile);
            Files.move(tmp, configFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist monitoring config: " + configFile, e);
        }
    }

    /**
     * Reads the stored profile.
     *
     * @return the profile, or empty if none is stored
     * @throws UncheckedIOException if the file exists but cannot be read or parsed
     */
    public Optional<ConnectionProfile> load() {
        if (!Files.exists(configFile)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(configFile.toFile(), ConnectionProfile.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read monitoring config: " + configFile, e);
        }
    }

    /**
     * Removes the stored profile. No-op when none is stored.
     */
    public void delete() {
        try {
            if (Files.deleteIfExists(configFile)) {
                log.debug("Deleted monitoring config: path={}", configFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete monitoring config: " + configFile, e);
        }
    }

    public boolean exists() {
        return Files.exists(configFile);
    }

    public Path getConfigFile() {
        return configFile;
    }
}
