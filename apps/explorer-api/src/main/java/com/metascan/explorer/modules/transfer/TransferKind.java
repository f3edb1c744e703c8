package com.metascan.explorer.modules.transfer;

/**
 * Event shapes that collapse into a {@link CanonicalTransfer}.
 */
public enum TransferKind {
    TRANSFER("balances", "Transfer"),
    CLAIMED("claims", "Claimed"),
    DEPOSIT("balances", "Deposit"),
    REWARD("staking", "Reward"),
    UNKNOWN(null, null);

    private final String moduleId;
    private final String eventId;

    TransferKind(String moduleId, String eventId) {
        this.moduleId = moduleId;
        this.eventId = eventId;
    }

    public String getModuleId() {
        return moduleId;
    }

    public String getEventId() {
        return eventId;
    }

    public static TransferKind classify(String moduleId, String eventId) {
        for (TransferKind kind : values()) {
            if (kind.moduleId != null && kind.moduleId.equals(moduleId) && kind.eventId.equals(eventId)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
