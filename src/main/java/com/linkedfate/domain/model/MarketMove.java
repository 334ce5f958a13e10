package com.linkedfate.domain.model;

import com.linkedfate.domain.enums.MoveDirection;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Latest intraday price change for a watchlist symbol. */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarketMove {

    private String symbol;
    private String name;
    private double changePercent;
    private LocalDateTime observedAt;

    public double magnitude() {
        return Math.abs(changePercent);
    }

    public MoveDirection direction() {
        return MoveDirection.of(changePercent);
    }
}
