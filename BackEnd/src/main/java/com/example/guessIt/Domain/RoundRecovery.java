package com.example.guessIt.Domain;

/**
 * Where a round stands when the process starts, derived from the persisted meta flags.
 */
public enum RoundRecovery {

    /** No playable snapshot; a new word has to be drawn. */
    FRESH,

    /** A word was in play at shutdown and is restored as is. */
    RESUMING,

    /** The round ended and its tokens were paid out. */
    ENDED,

    /** The round ended but the payout did not complete. */
    ENDED_PENDING_PAYOUT;

    public static RoundRecovery of(boolean roundEnd, boolean distributePoints, boolean snapshotSaved) {
        if (roundEnd) {
            return distributePoints ? ENDED_PENDING_PAYOUT : ENDED;
        }
        return snapshotSaved ? RESUMING : FRESH;
    }
}
