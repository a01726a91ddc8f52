package com.soundledger.data.adapter.driven.jpa;

import com.soundledger.domain.model.contract.ContractFileType;
import com.soundledger.domain.model.contract.ContractRecord;
import com.soundledger.domain.model.contract.ContractStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "contracts")
public class ContractEntity {
    @Id
    @Column(name = "artist")
    private String artist;

    @Column(name = "split_fraction", nullable = false, columnDefinition = "numeric")
    private BigDecimal splitFraction;

    @Column(name = "signed_date")
    private LocalDate signedDate;

    @Column(name = "expiry_date")
    private LocalDate expiryDate;

    @Column(name = "file_path")
    private String filePath;

    @Enumerated(EnumType.STRING)
    @Column(name = "file_type", nullable = false)
    private ContractFileType fileType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ContractStatus status;

    @Column(name = "notes", nullable = false)
    private String notes;

    protected ContractEntity() {}

    public ContractEntity(String artist,
                          BigDecimal splitFraction,
                          LocalDate signedDate,
                          LocalDate expiryDate,
                          String filePath,
                          ContractFileType fileType,
                          ContractStatus status,
                          String notes
    ) {
        this.artist = artist;
        this.splitFraction = splitFraction;
        this.signedDate = signedDate;
        this.expiryDate = expiryDate;
        this.filePath = filePath;
        this.fileType = fileType;
        this.status = status;
        this.notes = notes;
    }

    public static ContractEntity toEntity(ContractRecord contract) {
        return new ContractEntity(
                contract.getArtist(),
                contract.getSplitFraction(),
                contract.getSignedDate().orElse(null),
                contract.getExpiryDate().orElse(null),
                contract.getFilePath().orElse(null),
                contract.getFileType(),
                contract.getStatus(),
                contract.getNotes()
        );
    }

    public static ContractRecord toDomain(ContractEntity entity) {
        return ContractRecord.of(
                entity.artist,
                entity.splitFraction,
                entity.signedDate,
                entity.expiryDate,
                entity.filePath,
                entity.fileType,
                entity.status,
                entity.notes
        );
    }
}
