package com.soundledger.domain.port.driven;

import com.soundledger.domain.model.contract.ContractRecord;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ContractRegistryPort {
    /**
     * Artist to signed split fraction, for every contract in the registry.
     */
    Map<String, BigDecimal> snapshot();
    Optional<ContractRecord> findByArtist(String artist);
    List<ContractRecord> findAll();
    ContractRecord save(ContractRecord contract);
}
