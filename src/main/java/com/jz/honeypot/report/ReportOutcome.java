package com.jz.honeypot.report;

/**
 * 一次投递的结果。未成功时 {@code note} 有值，用于追加到会话备注。
 */
public record ReportOutcome(Status status, String note) {

    public enum Status { DELIVERED, FAILED, SKIPPED }

    public static ReportOutcome delivered()          { return new ReportOutcome(Status.DELIVERED, null); }
    public static ReportOutcome failed(String note)  { return new ReportOutcome(Status.FAILED, note); }
    public static ReportOutcome skipped(String note) { return new ReportOutcome(Status.SKIPPED, note); }

    public boolean ok() {
        return status == Status.DELIVERED;
    }
}
