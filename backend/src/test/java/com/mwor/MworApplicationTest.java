package com.mwor;

import com.mwor.health.SeedAuthorityHealthIndicator;
import com.mwor.model.GeneratedPiece;
import com.mwor.model.SessionSnapshot;
import com.mwor.oracle.MockVrfOracleClient;
import com.mwor.oracle.VrfOracleClient;
import com.mwor.service.PieceGenerationEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

@SpringBootTest(properties = {
        "mwor.seed.oracle-initial-backoff-ms=0",
        "mwor.seed.scheduled-rotation-enabled=false"
})
class MworApplicationTest {

    @Autowired
    private PieceGenerationEngine pieceGenerationEngine;

    @Autowired
    private VrfOracleClient vrfOracleClient;

    @Autowired
    private SeedAuthorityHealthIndicator healthIndicator;

    @Test
    void contextWiresMockOracleAndServesPieces() {
        assertInstanceOf(MockVrfOracleClient.class, vrfOracleClient);

        SessionSnapshot snapshot = pieceGenerationEngine.initializeSession("context-wallet", "context-session");
        GeneratedPiece piece = pieceGenerationEngine.generateNextPiece(snapshot.sessionId());

        assertEquals(0, piece.pieceIndex());
        assertEquals(Status.UP, healthIndicator.health().getStatus());
    }
}
