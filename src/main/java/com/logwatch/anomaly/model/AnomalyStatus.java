package com.logwatch.anomaly.model;

public enum AnomalyStatus {
    NEW,
    ACKNOWLEDGED,
    RESOLVED,
    FALSE_POSITIVE;

    public boolean isTerminal() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }

    public boolean isOpen() {
        return !isTerminal();
    }

    /**
     * new -> acknowledged | false_positive; acknowledged -> resolved | false_positive.
     */
    public boolean canTransitionTo(AnomalyStatus target) {
        return switch (this) {
            case NEW -> target == ACKNOWLEDGED || target == FALSE_POSITIVE;
            case ACKNOWLEDGED -> target == RESOLVED || target == FALSE_POSITIVE;
            case RESOLVED, FALSE_POSITIVE -> false;
        };
    }
}
