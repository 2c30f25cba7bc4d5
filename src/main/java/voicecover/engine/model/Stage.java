package voicecover.engine.model;

/**
 * Pipeline stages in execution order.
 */
public enum Stage {
    PREPROCESS,
    SEPARATE,
    INFER,
    MIX,
    FINALIZE;

    /** The stage that follows this one, or null after FINALIZE */
    public Stage next() {
        Stage[] all = values();
        return ordinal() + 1 < all.length ? all[ordinal() + 1] : null;
    }

    public boolean isLast() {
        return this == FINALIZE;
    }

    public String value() {
        return name().toLowerCase();
    }

    public static Stage first() {
        return PREPROCESS;
    }
}
