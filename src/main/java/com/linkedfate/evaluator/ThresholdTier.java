package com.linkedfate.evaluator;

import com.linkedfate.domain.enums.AlertLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/** One rung of a {@link ThresholdCascade}: the level and alert code emitted past the cutoff. */
@Getter
@ToString
@AllArgsConstructor
public class ThresholdTier {

    private final AlertLevel level;
    private final String code;
    private final double cutoff;
}
