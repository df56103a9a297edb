package com.bondplatform.common.oracle;

import com.bondplatform.common.model.PriceRound;

@FunctionalInterface
public interface PriceUpdateListener {

    void onPriceFeedUpdated(String feed, PriceRound round);
}
