package com.soundledger.domain.model.royalty;

public record PayoutStatement(Payout payout, ReleaseStatus status) {
    public boolean isReleasable() {
        return status.isReleasable();
    }
}
