package com.linkedfate.correlation;

import com.linkedfate.domain.enums.Confidence;
import com.linkedfate.domain.model.MarketMove;
import java.util.ArrayList;
import java.util.List;

/**
 * Holds for every watchlist symbol whose absolute move reaches the moderate tier. Confidence is
 * STRONG at or above the strong tier, MODERATE otherwise.
 */
public class MarketMoveCondition implements RuleCondition {

    private final List<String> symbols;
    private final double moderatePct;
    private final double strongPct;

    public MarketMoveCondition(List<String> symbols, double moderatePct, double strongPct) {
        this.symbols = List.copyOf(symbols);
        this.moderatePct = moderatePct;
        this.strongPct = strongPct;
    }

    @Override
    public List<Evidence> evaluate(CorrelationContext context) {
        List<Evidence> matches = new ArrayList<>();
        for (MarketMove move : context.getSignals().getMarketMoves()) {
            if (!symbols.contains(move.getSymbol()) || move.magnitude() < moderatePct) {
                continue;
            }
            matches.add(Evidence.builder()
                    .kind(Evidence.Kind.MARKET)
                    .move(move)
                    .confidence(confidenceOf(move.magnitude()))
                    .build());
        }
        return matches;
    }

    Confidence confidenceOf(double magnitude) {
        if (magnitude >= strongPct) {
            return Confidence.STRONG;
        }
        return magnitude >= moderatePct ? Confidence.MODERATE : Confidence.WEAK;
    }
}
