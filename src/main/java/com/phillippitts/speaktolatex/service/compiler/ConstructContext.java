package com.phillippitts.speaktolatex.service.compiler;

import java.util.Objects;

/**
 * One open construct on the transducer's stack.
 *
 * <p>The anchor is the index of the output fragment the construct opened with. Bounds are
 * written into that fragment and argument closing collapses everything from it onward.
 */
public final class ConstructContext {

    private final ConstructKind kind;
    private final int anchor;
    private final Mode resumeMode;
    private int argumentsReceived;
    private boolean boundsApplied;

    public ConstructContext(ConstructKind kind, int anchor) {
        this(kind, anchor, Mode.INITIAL);
    }

    /**
     * @param resumeMode mode to restore when a group closes; ignored for other kinds
     */
    public ConstructContext(ConstructKind kind, int anchor, Mode resumeMode) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (anchor < 0) {
            throw new IllegalArgumentException("anchor must be >= 0, got: " + anchor);
        }
        this.anchor = anchor;
        this.resumeMode = Objects.requireNonNull(resumeMode, "resumeMode");
    }

    public ConstructKind kind() {
        return kind;
    }

    public int anchor() {
        return anchor;
    }

    public Mode resumeMode() {
        return resumeMode;
    }

    public int argumentsReceived() {
        return argumentsReceived;
    }

    void receiveArgument() {
        argumentsReceived++;
    }

    public boolean boundsApplied() {
        return boundsApplied;
    }

    void markBoundsApplied() {
        boundsApplied = true;
    }

    @Override
    public String toString() {
        return kind + "@" + anchor;
    }
}
