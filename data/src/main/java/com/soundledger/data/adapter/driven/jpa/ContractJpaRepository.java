package com.soundledger.data.adapter.driven.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ContractJpaRepository extends JpaRepository<ContractEntity, String> {
    List<ContractEntity> findAllByOrderByArtistAsc();
}
