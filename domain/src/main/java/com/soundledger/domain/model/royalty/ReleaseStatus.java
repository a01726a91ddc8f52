package com.soundledger.domain.model.royalty;

public enum ReleaseStatus {
    /** Share agrees with the signed contract. */
    FINAL,
    /** Paid under an ad-hoc share while contract paperwork is pending. */
    PROVISIONAL,
    /** Share disagrees with the contract; released only by explicit human override. */
    OVERRIDDEN,
    /** Share disagrees with the contract and nobody signed off. */
    BLOCKED;

    public boolean isReleasable() {
        return this != BLOCKED;
    }
}
