package com.linkedfate.domain.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Structured context attached to an alert, one shape per alert family.
 *
 * <p>Serialized as JSON into the alerts table and returned as-is by the alert API. The
 * {@code kind} property discriminates the concrete type on the way back in.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = GridPayload.class, name = "grid"),
    @JsonSubTypes.Type(value = WaterPayload.class, name = "water"),
    @JsonSubTypes.Type(value = PortPayload.class, name = "port"),
    @JsonSubTypes.Type(value = CompositePayload.class, name = "composite"),
    @JsonSubTypes.Type(value = MarketPayload.class, name = "market"),
    @JsonSubTypes.Type(value = PredictivePayload.class, name = "predictive"),
    @JsonSubTypes.Type(value = DegradedPayload.class, name = "degraded")
})
public interface AlertPayload {

    /** Indicator the alert was raised on, when there is a single one. */
    default String indicatorCode() {
        return null;
    }
}
