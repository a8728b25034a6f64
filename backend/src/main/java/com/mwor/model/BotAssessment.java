package com.mwor.model;

import java.util.List;

/**
 * Advisory bot-likeness signal for a move sequence.
 */
public record BotAssessment(boolean isBot, double confidence, List<String> signals) {

    public static BotAssessment inconclusive() {
        return new BotAssessment(false, 0.0, List.of());
    }
}
