package io.mersel.services.media.infrastructure.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * App Store Connect API anahtar bilgileri.
 * <p>
 * {@code asc.credentials} prefix'i altındaki değerleri okur. Değerler boşsa
 * {@code ~/.asc-client/config.json} dosyasından ({@code keyId}, {@code issuerId},
 * {@code privateKeyPath}) tamamlanır.
 * <p>
 * Env:
 * <ul>
 *   <li>{@code ASC_CREDENTIALS_KEY_ID}</li>
 *   <li>{@code ASC_CREDENTIALS_ISSUER_ID}</li>
 *   <li>{@code ASC_CREDENTIALS_PRIVATE_KEY_PATH} — .p8 dosyası</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "asc.credentials")
public class AscCredentialsProperties {

    private static final Logger log = LoggerFactory.getLogger(AscCredentialsProperties.class);

    static final Path DEFAULT_CONFIG_FILE = Path.of(System.getProperty("user.home"), ".asc-client", "config.json");

    private String keyId = "";
    private String issuerId = "";
    private String privateKeyPath = "";
    private int tokenLifetimeMinutes = 20;
    private String configFile = DEFAULT_CONFIG_FILE.toString();

    /**
     * Eksik alanları yapılandırma dosyasından tamamlar ve eksik kalanları bildirir.
     *
     * @throws IllegalStateException anahtar bilgileri hiçbir kaynaktan bulunamazsa
     */
    public void requireComplete() {
        if (isBlank(keyId) || isBlank(issuerId) || isBlank(privateKeyPath)) {
            loadFromConfigFile(Path.of(configFile));
        }
        if (isBlank(keyId) || isBlank(issuerId) || isBlank(privateKeyPath)) {
            throw new IllegalStateException("API anahtar bilgileri bulunamadı. "
                    + "asc.credentials.key-id / issuer-id / private-key-path ayarlayın veya "
                    + configFile + " dosyasını oluşturun.");
        }
        if (tokenLifetimeMinutes <= 0 || tokenLifetimeMinutes > 20) {
            log.warn("token-lifetime-minutes 1-20 aralığında olmalı (verilen: {}), 20 kullanılıyor", tokenLifetimeMinutes);
            tokenLifetimeMinutes = 20;
        }
    }

    void loadFromConfigFile(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("Yapılandırma dosyası yok: {}", file);
            return;
        }
        try {
            JsonNode root = new ObjectMapper().readTree(file.toFile());
            if (isBlank(keyId) && root.hasNonNull("keyId")) {
                keyId = root.get("keyId").asText();
            }
            if (isBlank(issuerId) && root.hasNonNull("issuerId")) {
                issuerId = root.get("issuerId").asText();
            }
            if (isBlank(privateKeyPath) && root.hasNonNull("privateKeyPath")) {
                privateKeyPath = root.get("privateKeyPath").asText();
            }
            log.debug("Anahtar bilgileri {} dosyasından okundu", file);
        } catch (IOException e) {
            throw new IllegalStateException("Yapılandırma dosyası okunamadı: " + file + " — " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getKeyId() {
        return keyId;
    }

    public void setKeyId(String keyId) {
        this.keyId = keyId;
    }

    public String getIssuerId() {
        return issuerId;
    }

    public void setIssuerId(String issuerId) {
        this.issuerId = issuerId;
    }

    public String getPrivateKeyPath() {
        return privateKeyPath;
    }

    public void setPrivateKeyPath(String privateKeyPath) {
        this.privateKeyPath = privateKeyPath;
    }

    public int getTokenLifetimeMinutes() {
        return tokenLifetimeMinutes;
    }

    public void setTokenLifetimeMinutes(int tokenLifetimeMinutes) {
        this.tokenLifetimeMinutes = tokenLifetimeMinutes;
    }

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }
}
