package com.phillippitts.speaktolatex.service.compiler;

/**
 * Pending bounds of the most recently opened bounded construct.
 *
 * <p>Holds the index variable, lower and upper bound (for a limit the lower slot is the
 * approach target) and the readiness flags that route the next operand to a slot. Bounds are
 * written into the owner's anchor fragment at most once.
 */
public final class BoundsAccumulator {

    static final String DEFAULT_SUM_VARIABLE = "i";
    static final String DEFAULT_LIMIT_VARIABLE = "x";

    private ConstructContext owner;
    private String variable;
    private String lower;
    private String upper;
    private boolean lowerReady;
    private boolean upperReady;
    private boolean equalsReady;
    private boolean approaching;

    /** Discards pending bounds and starts collecting for {@code newOwner}. */
    public void reset(ConstructContext newOwner) {
        clear();
        this.owner = newOwner;
    }

    public void clear() {
        owner = null;
        variable = null;
        lower = null;
        upper = null;
        lowerReady = false;
        upperReady = false;
        equalsReady = false;
        approaching = false;
    }

    /**
     * Routes an operand to the slot the flags point at.
     *
     * @return false if no slot is waiting for it
     */
    public boolean offer(String operand) {
        if (owner == null || owner.boundsApplied()) {
            return false;
        }
        switch (owner.kind()) {
            case SUM, PRODUCT -> {
                if (variable == null) {
                    variable = operand;
                } else if (equalsReady) {
                    lower = operand;
                    equalsReady = false;
                } else if (upperReady) {
                    upper = operand;
                    upperReady = false;
                } else {
                    return false;
                }
                return true;
            }
            case LIMIT -> {
                if (approaching) {
                    lower = operand;
                    approaching = false;
                } else if (variable == null) {
                    variable = operand;
                } else {
                    return false;
                }
                return true;
            }
            case INTEGRAL -> {
                if (lowerReady) {
                    lower = operand;
                    lowerReady = false;
                } else if (upperReady) {
                    upper = operand;
                    upperReady = false;
                } else {
                    return false;
                }
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    /** Whether every slot the owner needs is filled. */
    public boolean isComplete() {
        if (owner == null || owner.boundsApplied()) {
            return false;
        }
        return switch (owner.kind()) {
            case INTEGRAL -> lower != null && upper != null;
            case SUM, PRODUCT -> variable != null && lower != null && upper != null;
            case LIMIT -> lower != null;
            default -> false;
        };
    }

    public boolean hasLimits() {
        return lower != null || upper != null;
    }

    public boolean isPending() {
        return owner != null && !owner.boundsApplied() && (hasLimits() || variable != null);
    }

    /**
     * Writes whatever bounds are present into the owner's anchor fragment and clears.
     *
     * @return true if anything was written
     */
    public boolean applyTo(OutputBuffer buffer) {
        if (!isPending()) {
            clear();
            return false;
        }
        String suffix = switch (owner.kind()) {
            case INTEGRAL -> integralSuffix();
            case SUM, PRODUCT -> indexedSuffix();
            case LIMIT -> limitSuffix();
            default -> "";
        };
        int anchor = owner.anchor();
        buffer.set(anchor, buffer.get(anchor) + suffix);
        owner.markBoundsApplied();
        clear();
        return !suffix.isEmpty();
    }

    private String integralSuffix() {
        StringBuilder sb = new StringBuilder();
        if (lower != null) {
            sb.append("_{").append(lower).append('}');
        }
        if (upper != null) {
            sb.append("^{").append(upper).append('}');
        }
        return sb.toString();
    }

    private String indexedSuffix() {
        StringBuilder sb = new StringBuilder();
        String index = variable != null ? variable : DEFAULT_SUM_VARIABLE;
        if (lower != null) {
            sb.append("_{").append(index).append('=').append(lower).append('}');
        } else if (variable != null) {
            sb.append("_{").append(variable).append('}');
        }
        if (upper != null) {
            sb.append("^{").append(upper).append('}');
        }
        return sb.toString();
    }

    private String limitSuffix() {
        String index = variable != null ? variable : DEFAULT_LIMIT_VARIABLE;
        if (lower == null) {
            return "_{" + index + "}";
        }
        return "_{" + index + " \\to " + lower + "}";
    }

    public boolean isOwnedBy(ConstructContext context) {
        return owner != null && owner == context;
    }

    public String variable() {
        return variable;
    }

    public void setVariable(String variable) {
        this.variable = variable;
    }

    public void markLowerReady() {
        lowerReady = true;
        upperReady = false;
    }

    public void markUpperReady() {
        upperReady = true;
        lowerReady = false;
    }

    public void markEqualsReady() {
        equalsReady = true;
    }

    public void markApproaching() {
        approaching = true;
    }
}
