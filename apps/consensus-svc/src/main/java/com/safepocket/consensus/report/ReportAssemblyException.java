package com.safepocket.consensus.report;

/**
 * Report inputs violate an invariant that the harness and engine guarantee. Never swallowed.
 */
public class ReportAssemblyException extends IllegalStateException {

    public ReportAssemblyException(String message) {
        super(message);
    }
}
