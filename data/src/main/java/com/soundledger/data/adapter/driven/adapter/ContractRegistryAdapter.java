package com.soundledger.data.adapter.driven.adapter;

import com.soundledger.data.adapter.driven.jpa.ContractEntity;
import com.soundledger.data.adapter.driven.jpa.ContractJpaRepository;
import com.soundledger.domain.error.PersistenceException;
import com.soundledger.domain.model.contract.ContractRecord;
import com.soundledger.domain.port.driven.ContractRegistryPort;
import org.springframework.dao.DataAccessException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

public class ContractRegistryAdapter implements ContractRegistryPort {
    private final ContractJpaRepository repo;

    public ContractRegistryAdapter(ContractJpaRepository repo) {
        this.repo = repo;
    }

    private static <T> T dbInteraction(Supplier<T> interaction, String errorMessage) {
        try {
            return interaction.get();
        } catch (DataAccessException ex) {
            throw new PersistenceException(errorMessage, ex);
        }
    }

    @Override
    public Map<String, BigDecimal> snapshot() {
        return findAll()
                .stream()
                .collect(Collectors.toUnmodifiableMap(ContractRecord::getArtist, ContractRecord::getSplitFraction));
    }

    @Override
    public Optional<ContractRecord> findByArtist(String artist) {
        return dbInteraction(
                () -> repo.findById(artist).map(ContractEntity::toDomain),
                "DB error during findByArtist"
        );
    }

    @Override
    public List<ContractRecord> findAll() {
        return dbInteraction(
                () -> repo.findAllByOrderByArtistAsc().stream().map(ContractEntity::toDomain).toList(),
                "DB error during findAll contracts"
        );
    }

    @Override
    public ContractRecord save(ContractRecord contract) {
        return dbInteraction(
                () -> ContractEntity.toDomain(repo.save(ContractEntity.toEntity(contract))),
                "DB error during save of contract"
        );
    }
}
