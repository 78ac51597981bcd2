package com.ddosshield.core.model;

/**
 * Kind of instruction carried by a {@link MitigationAction}.
 */
public enum ActionKind {
    BLOCK,
    UNBLOCK,
    WATCH;

    /**
     * @return {@code true} if the enforcement collaborator must act on it
     */
    public boolean isEnforced() {
        return this != WATCH;
    }
}
