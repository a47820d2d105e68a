package com.screening.service;

import com.screening.model.Disposition;
import com.screening.model.ScreeningAlert;

/**
 * What applying an assessment did to a subject's disposition.
 *
 * @param disposition the disposition as it is stored after the call
 * @param updated whether the disposition row was written
 * @param alert the alert raised by this update, or null
 */
public record DispositionOutcome(Disposition disposition, boolean updated, ScreeningAlert alert) {

    public static DispositionOutcome unchanged(Disposition disposition) {
        return new DispositionOutcome(disposition, false, null);
    }

    public boolean alertRaised() {
        return alert != null;
    }
}
