package com.swisspair.service;

import com.swisspair.model.MatchOutcome;
import com.swisspair.model.ScoreDelta;
import org.springframework.stereotype.Component;

/**
 * Point values for match outcomes. Pure: callers apply the returned deltas to standings.
 */
@Component
public class ScoringRules {

    public static final int WIN_POINTS = 2;
    public static final int LOSS_POINTS = 0;
    public static final int TIE_POINTS = 1;
    public static final int BYE_POINTS = 1;

    private static final ScoreDelta WIN = new ScoreDelta(WIN_POINTS, 1, 0, 0, 0, 1);
    private static final ScoreDelta LOSS = new ScoreDelta(LOSS_POINTS, 0, 1, 0, 0, 1);
    private static final ScoreDelta TIE = new ScoreDelta(TIE_POINTS, 0, 0, 1, 0, 1);
    private static final ScoreDelta BYE = new ScoreDelta(BYE_POINTS, 0, 0, 0, 1, 0);

    public ResultDeltas applyResult(MatchOutcome outcome) {
        return outcome.tie() ? applyTie() : applyWin();
    }

    public ResultDeltas applyWin() {
        return new ResultDeltas(WIN, LOSS);
    }

    public ResultDeltas applyTie() {
        return new ResultDeltas(TIE, TIE);
    }

    public ScoreDelta applyBye() {
        return BYE;
    }

    /**
     * Deltas for both sides of a match. For a tie the two sides are interchangeable.
     */
    public record ResultDeltas(
            ScoreDelta winner,
            ScoreDelta loser
    ) {
    }
}
