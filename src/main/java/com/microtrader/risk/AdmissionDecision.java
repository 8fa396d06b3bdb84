package com.microtrader.risk;

import com.microtrader.domain.enums.RejectionReason;
import java.math.BigDecimal;
import lombok.Getter;

/**
 * Outcome of the admission gate: either approved with a size and a held reservation, or
 * rejected with a reason. A rejection is an expected control-flow outcome, not an error.
 */
@Getter
public class AdmissionDecision {

    private final boolean approved;
    private final BigDecimal size;
    private final Reservation reservation;
    private final RejectionReason rejectionReason;
    private final String detail;

    private AdmissionDecision(
            boolean approved,
            BigDecimal size,
            Reservation reservation,
            RejectionReason rejectionReason,
            String detail) {
        this.approved = approved;
        this.size = size;
        this.reservation = reservation;
        this.rejectionReason = rejectionReason;
        this.detail = detail;
    }

    public static AdmissionDecision approved(Reservation reservation) {
        return new AdmissionDecision(true, reservation.getSize(), reservation, null, null);
    }

    public static AdmissionDecision rejected(RejectionReason reason, String detail) {
        return new AdmissionDecision(false, null, null, reason, detail);
    }

    public boolean isRejected() {
        return !approved;
    }

    @Override
    public String toString() {
        return approved ? "Approved(" + size + ")" : "Rejected(" + rejectionReason + ": " + detail + ")";
    }
}
