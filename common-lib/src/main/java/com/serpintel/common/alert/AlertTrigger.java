package com.serpintel.common.alert;

/**
 * Alert trigger kinds. Names are the wire values and sort ascending as
 * declared.
 */
public enum AlertTrigger {
    /** Regime of the latest pair differs from the preceding pair. */
    T1,
    /** A pair score exceeds the spike threshold. */
    T2,
    /** Project volatility is concentrated in its three riskiest keywords. */
    T3
}
