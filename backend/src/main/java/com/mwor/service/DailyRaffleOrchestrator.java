package com.mwor.service;

import com.mwor.config.RaffleProperties;
import com.mwor.error.FairnessException;
import com.mwor.model.DailyRaffleResult;
import com.mwor.model.MerkleTree;
import com.mwor.model.PlayRecord;
import com.mwor.model.QualifiedWallet;
import com.mwor.model.RaffleDrawResult;
import com.mwor.model.RaffleQualification;
import com.mwor.model.VrfRandomness;
import com.mwor.repository.PlayRecordSource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class DailyRaffleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DailyRaffleOrchestrator.class);

    private final PlayRecordSource playRecordSource;
    private final RaffleTicketManager raffleTicketManager;
    private final RaffleDrawManager raffleDrawManager;
    private final SeedAuthority seedAuthority;
    private final RaffleProperties raffleProperties;

    /**
     * Qualifies the UTC day's plays, commits the qualified set to a Merkle root and draws winners
     * from fresh oracle randomness.
     *
     * @throws FairnessException EMPTY_QUALIFICATION_SET when nobody qualified, ORACLE_UNAVAILABLE
     *                           when draw randomness cannot be obtained
     */
    public DailyRaffleResult executeDailyRaffle(LocalDate day) {
        Instant from = day.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        List<PlayRecord> plays = playRecordSource.findPlaysBetween(from, to);
        log.info("Running daily raffle for {} over {} plays", day, plays.size());

        List<QualifiedWallet> qualified = raffleTicketManager.getDailyQualifiedWallets(plays);
        if (qualified.isEmpty()) {
            throw FairnessException.emptyQualificationSet("No wallets qualified for the raffle on " + day);
        }

        MerkleTree tree = MerkleAuditTree.buildTree(qualified);
        List<RaffleQualification> qualifications = new ArrayList<>(qualified.size());
        for (int i = 0; i < qualified.size(); i++) {
            qualifications.add(new RaffleQualification(
                    qualified.get(i), MerkleAuditTree.generateMerkleProof(tree.leaves(), i)));
        }

        VrfRandomness randomness = seedAuthority.requestDrawRandomness(day);
        RaffleDrawResult drawResult = raffleDrawManager.draw(
                qualified,
                raffleProperties.getNumberOfWinners(),
                randomness.value(),
                randomness.signature(),
                tree.root(),
                randomness.verifiable()
        );

        log.info("Daily raffle for {} complete: root={}..., winners={}",
                day, tree.root().substring(0, 16), drawResult.winners().size());
        return new DailyRaffleResult(
                day,
                List.copyOf(qualifications),
                tree.root(),
                raffleTicketManager.summarizeDistribution(qualified),
                drawResult
        );
    }
}
