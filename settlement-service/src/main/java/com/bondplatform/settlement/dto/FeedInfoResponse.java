package com.bondplatform.settlement.dto;

import com.bondplatform.common.feed.RoundDataFeed;
import com.fasterxml.jackson.annotation.JsonProperty;

public record FeedInfoResponse(
    @JsonProperty("description") String description,
    @JsonProperty("decimals")    int decimals,
    @JsonProperty("version")     long version
) {

    public static FeedInfoResponse of(RoundDataFeed feed) {
        return new FeedInfoResponse(feed.description(), feed.decimals(), feed.version());
    }
}
