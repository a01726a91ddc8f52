package com.soundledger.domain.model.royalty;

public enum ShareProvenance {
    CONTRACT,
    AD_HOC
}
