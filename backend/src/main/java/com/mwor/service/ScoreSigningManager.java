package com.mwor.service;

import com.mwor.config.ScoreSigningProperties;
import com.mwor.error.FairnessException;
import com.mwor.model.ScoreProof;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;

/**
 * Signs final scores with the platform Ed25519 key so any third party holding the public key
 * can check a score was issued by this service.
 */
@Service
public class ScoreSigningManager {

    private static final Logger log = LoggerFactory.getLogger(ScoreSigningManager.class);

    private final Ed25519PrivateKeyParameters privateKey;
    private final Ed25519PublicKeyParameters publicKey;
    private final Clock clock;

    public ScoreSigningManager(ScoreSigningProperties signingProperties, Clock clock) {
        this.clock = clock;
        String configuredKey = signingProperties.getPrivateKeyHex();
        if (StringUtils.hasText(configuredKey)) {
            this.privateKey = new Ed25519PrivateKeyParameters(FairnessCrypto.decodeHex32(configuredKey), 0);
        } else {
            log.warn("No score signing key configured; generated an ephemeral Ed25519 key. "
                    + "Signatures will not verify after a restart.");
            this.privateKey = new Ed25519PrivateKeyParameters(new SecureRandom());
        }
        this.publicKey = privateKey.generatePublicKey();
    }

    public ScoreProof signScore(String walletAddress, long score, String seedHash, int moveCount) {
        if (!StringUtils.hasText(walletAddress)) {
            throw new IllegalArgumentException("Wallet is required");
        }
        if (score < 0) {
            throw new IllegalArgumentException("score must not be negative");
        }
        if (moveCount < 0) {
            throw new IllegalArgumentException("moveCount must not be negative");
        }
        String normalizedSeedHash = FairnessCrypto.normalizeHex32(seedHash);
        long timestamp = clock.millis();
        byte[] message = signedMessage(walletAddress, score, normalizedSeedHash, moveCount, timestamp);

        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        String signature = Hex.toHexString(signer.generateSignature());

        return new ScoreProof(walletAddress, score, normalizedSeedHash, moveCount, signature, timestamp);
    }

    /**
     * True when the proof's signature verifies under the platform public key. Never throws.
     */
    public boolean verifyScoreSignature(ScoreProof proof) {
        if (proof == null || proof.walletAddress() == null || proof.seedHash() == null || proof.signature() == null) {
            return false;
        }
        try {
            byte[] signature = Hex.decode(proof.signature());
            byte[] message = signedMessage(
                    proof.walletAddress(), proof.score(), proof.seedHash(), proof.moveCount(), proof.timestamp());
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, publicKey);
            verifier.update(message, 0, message.length);
            return verifier.verifySignature(signature);
        } catch (RuntimeException ex) {
            return false;
        }
    }

    /**
     * @throws FairnessException SIGNATURE_INVALID when the proof does not verify
     */
    public void requireValidSignature(ScoreProof proof) {
        if (!verifyScoreSignature(proof)) {
            throw FairnessException.signatureInvalid(proof == null ? null : proof.walletAddress());
        }
    }

    public String getPublicKeyHex() {
        return Hex.toHexString(publicKey.getEncoded());
    }

    private static byte[] signedMessage(String walletAddress, long score, String seedHash, int moveCount, long timestamp) {
        return (walletAddress + ":" + score + ":" + seedHash + ":" + moveCount + ":" + timestamp)
                .getBytes(StandardCharsets.UTF_8);
    }
}
