package com.bondplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * A timestamped price observation. {@code roundId == 0} marks an absent round.
 *
 * <p>Timestamps are epoch seconds. {@code answer} is scaled by the decimals of the
 * feed that produced it.
 */
public record PriceRound(
    @JsonProperty("roundId")          BigInteger roundId,
    @JsonProperty("answer")           BigInteger answer,
    @JsonProperty("startedAt")        long startedAt,
    @JsonProperty("updatedAt")        long updatedAt,
    @JsonProperty("answeredInRound")  BigInteger answeredInRound
) {

    public static final PriceRound EMPTY =
        new PriceRound(BigInteger.ZERO, BigInteger.ZERO, 0L, 0L, BigInteger.ZERO);

    public PriceRound {
        roundId         = roundId != null ? roundId : BigInteger.ZERO;
        answer          = answer != null ? answer : BigInteger.ZERO;
        answeredInRound = answeredInRound != null ? answeredInRound : BigInteger.ZERO;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return roundId.signum() == 0;
    }

    public PriceRound withAnswer(BigInteger newAnswer) {
        return new PriceRound(roundId, newAnswer, startedAt, updatedAt, answeredInRound);
    }
}
