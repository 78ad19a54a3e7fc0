package com.chimera.core.link;

/**
 * Result of submitting a link's output.
 *
 * @param status     ACCEPTED when the link transitioned, DUPLICATE for a repeat report on a finished link,
 *                   REJECTED for protocol violations
 * @param reason     why the report was rejected, null otherwise
 * @param transition the applied transition when ACCEPTED
 */
public record ReportOutcome(Status status, RejectReason reason, Transition transition) {

    public enum Status {
        ACCEPTED,
        DUPLICATE,
        REJECTED
    }

    public enum RejectReason {
        UNKNOWN_LINK,
        WRONG_AGENT,
        DISCARDED,
        NOT_DISPATCHED,
        OPERATION_HALTED
    }

    public static ReportOutcome accepted(Transition transition) {
        return new ReportOutcome(Status.ACCEPTED, null, transition);
    }

    public static ReportOutcome duplicate() {
        return new ReportOutcome(Status.DUPLICATE, null, null);
    }

    public static ReportOutcome rejected(RejectReason reason) {
        return new ReportOutcome(Status.REJECTED, reason, null);
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }
}
