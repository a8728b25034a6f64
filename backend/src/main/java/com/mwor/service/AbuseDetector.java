package com.mwor.service;

import com.mwor.config.MworRuntimeProperties;
import com.mwor.model.BotAssessment;
import com.mwor.model.GameMove;
import com.mwor.model.MoveType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a move sequence for bot-like timing. The result is advisory and never blocks a play.
 */
@Service
public class AbuseDetector {

    private static final Logger log = LoggerFactory.getLogger(AbuseDetector.class);

    public static final String LOW_TIMING_VARIANCE = "low_timing_variance";
    public static final String FAST_MOVES = "fast_moves";
    public static final String DROP_HEAVY = "drop_heavy";

    private final MworRuntimeProperties runtimeProperties;

    public AbuseDetector(MworRuntimeProperties runtimeProperties) {
        this.runtimeProperties = runtimeProperties;
    }

    public BotAssessment detectBot(List<GameMove> moves) {
        if (moves == null || moves.size() < 2) {
            return BotAssessment.inconclusive();
        }
        MworRuntimeProperties.Abuse thresholds = runtimeProperties.getAbuse();

        int intervals = moves.size() - 1;
        long[] deltas = new long[intervals];
        double sum = 0;
        for (int i = 0; i < intervals; i++) {
            deltas[i] = moves.get(i + 1).timestamp() - moves.get(i).timestamp();
            sum += deltas[i];
        }
        double mean = sum / intervals;
        double variance = 0;
        int fastMoves = 0;
        for (long delta : deltas) {
            variance += (delta - mean) * (delta - mean);
            if (delta < thresholds.getFastMoveThresholdMs()) {
                fastMoves++;
            }
        }
        variance = variance / intervals;

        long drops = moves.stream().filter(move -> move.type() == MoveType.DROP).count();

        List<String> signals = new ArrayList<>();
        double confidence = 0;
        if (variance < thresholds.getVarianceThresholdMs2()) {
            signals.add(LOW_TIMING_VARIANCE);
            confidence += thresholds.getVarianceWeight();
        }
        if ((double) fastMoves / intervals > thresholds.getFastMoveRatio()) {
            signals.add(FAST_MOVES);
            confidence += thresholds.getFastMoveWeight();
        }
        if ((double) drops / moves.size() > thresholds.getDropRatio()) {
            signals.add(DROP_HEAVY);
            confidence += thresholds.getDropWeight();
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        boolean isBot = confidence > thresholds.getBotThreshold();

        if (isBot) {
            log.debug("Move sequence of {} moves flagged: confidence={}, signals={}", moves.size(), confidence, signals);
        }
        return new BotAssessment(isBot, confidence, List.copyOf(signals));
    }
}
