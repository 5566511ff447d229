package com.questrail.kernel.contract;

import java.util.Locale;

public enum Decision {
    /** Proceed now. */
    ALLOW,
    /** Hold until the blocking gates clear or the defer TTL expires. */
    DEFER,
    /** Refuse; recorded as a contract violation. */
    BLOCK,
    /** Proceed past closed gates; recorded as an override. */
    OVERRIDE,
    /** Fold into the pending resize, applied when the injection ends. */
    COALESCE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
