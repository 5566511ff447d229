package com.questrail.kernel.query;

import com.questrail.kernel.api.Stage;

/**
 * @param eventId                first event observed at this stage, if any
 * @param timestamp              its producer timestamp
 * @param deltaFromPreviousMs    time since the first event of the previous seen stage
 */
public record JourneyStep(
        Stage stage,
        JourneyState state,
        String eventId,
        Long timestamp,
        Long deltaFromPreviousMs
) {
}
