package com.linkedfate.domain.enums;

/**
 * Category of an alert as stored in the alerts table.
 *
 * <p>GRID, WATR and FLOW are the per-domain codes. LINKED, MARKET and PREDICTIVE are
 * produced by the correlation engine and are listed ahead of per-domain alerts in every
 * evaluation cycle.
 */
public enum AlertType {
    GRID,
    WATR,
    FLOW,
    LINKED,
    MARKET,
    PREDICTIVE
}
