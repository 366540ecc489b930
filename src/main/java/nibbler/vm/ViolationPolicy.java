package nibbler.vm;

/**
 * What the validator does on a violation
 */
public enum ViolationPolicy {
    /**
     * Throw a {@link ConstraintViolation}, the virtual machine stops
     */
    HALT,
    /**
     * Log and count the violation, the execution continues
     */
    RECORD
}
