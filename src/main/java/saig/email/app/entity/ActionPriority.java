package saig.email.app.entity;

/**
 * Declared from lowest to highest; ordinal order is significance order.
 */
public enum ActionPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
