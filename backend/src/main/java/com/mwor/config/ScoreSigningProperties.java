package com.mwor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "mwor.signing")
public class ScoreSigningProperties {

    /**
     * Hex-encoded 32-byte Ed25519 private key seed. When blank an ephemeral key is generated.
     */
    private String privateKeyHex = "";
}
