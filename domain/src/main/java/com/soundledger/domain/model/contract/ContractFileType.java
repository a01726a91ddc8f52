package com.soundledger.domain.model.contract;

public enum ContractFileType {
    PDF,
    DOCX,
    SCAN
}
