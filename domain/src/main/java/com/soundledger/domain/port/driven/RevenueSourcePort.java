package com.soundledger.domain.port.driven;

import com.soundledger.domain.model.royalty.AccountingPeriod;
import com.soundledger.domain.model.royalty.RevenueRecord;

import java.util.List;

public interface RevenueSourcePort {
    List<RevenueRecord> fetch(AccountingPeriod period);
    int store(List<RevenueRecord> records);
}
