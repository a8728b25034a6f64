package com.mwor.model;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Setter
@Getter
public class Commitment {

    private String sessionId;

    private String walletAddress;

    private String seedHash;

    /**
     * AES-GCM storage envelope holding the raw round seed.
     */
    private String encryptedSeed;

    private String revealedSeed;

    private boolean sessionEnded = false;

    private boolean verifiable = true;

    private String vrfSignature;

    private LocalDate seedDay;

    private OffsetDateTime committedAt = OffsetDateTime.now();

    private OffsetDateTime sessionEndedAt;

    private OffsetDateTime revealedAt;

    private OffsetDateTime completedAt;

    public boolean isRevealed() {
        return revealedSeed != null;
    }

    public boolean isCompleted() {
        return completedAt != null;
    }
}
