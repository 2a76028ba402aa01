package com.example.guessIt.Domain;

/**
 * Meta entries that carry the round across restarts.
 */
public final class RoundMetaKeys {

    public static final String CURRENT_WORD = "cur_word";
    public static final String CURRENT_CATEGORY = "cur_cat";
    public static final String CURRENT_POINTS = "cur_points";

    public static final String ROUND_END = "round_end";
    public static final String UPDATE_ROUND = "update_round";
    public static final String DISTRIBUTE_POINTS = "distribute_points";

    private RoundMetaKeys() {
    }
}
