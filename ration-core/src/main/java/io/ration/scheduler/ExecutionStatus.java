package io.ration.scheduler;

import java.util.Locale;

public enum ExecutionStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() { return this == COMPLETED || this == FAILED; }

    public String code() { return name().toLowerCase(Locale.ROOT); }

    public static ExecutionStatus fromCode(String code) { return valueOf(code.toUpperCase(Locale.ROOT)); }
}
