package com.soundledger.domain.model.contract;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static com.soundledger.domain.model.DomainValidator.assertValid;

public final class ContractRecord {
    @NotBlank(message = "Artist is required")
    @Size(max = 200, message = "Artist can be 200 characters at most")
    private final String artist;

    @NotNull(message = "Split fraction is required")
    @DecimalMin(value = "0", message = "Split fraction cannot be below 0.")
    @DecimalMax(value = "1", message = "Split fraction cannot be above 1.")
    private final BigDecimal splitFraction;

    private final LocalDate signedDate;

    private final LocalDate expiryDate;

    private final String filePath;

    @NotNull(message = "File type is required")
    private final ContractFileType fileType;

    @NotNull(message = "Contract status is required")
    private final ContractStatus status;

    @NotNull(message = "Notes can be empty but must not be null")
    private final String notes;

    private ContractRecord(String artist,
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

    public static ContractRecord of(String artist,
                                    BigDecimal splitFraction,
                                    LocalDate signedDate,
                                    LocalDate expiryDate,
                                    String filePath,
                                    ContractFileType fileType,
                                    ContractStatus status,
                                    String notes
    ) {
        return assertValid(new ContractRecord(
                artist,
                splitFraction,
                signedDate,
                expiryDate,
                filePath == null || filePath.isBlank() ? null : filePath,
                fileType == null ? ContractFileType.PDF : fileType,
                status == null ? ContractStatus.ACTIVE : status,
                notes == null ? "" : notes
        ));
    }

    public static ContractRecord active(String artist, BigDecimal splitFraction) {
        return of(artist, splitFraction, null, null, null, ContractFileType.PDF, ContractStatus.ACTIVE, "");
    }

    public ContractRecord withSplitFraction(BigDecimal newFraction) {
        return of(artist, newFraction, signedDate, expiryDate, filePath, fileType, status, notes);
    }

    @AssertTrue(message = "Contract cannot expire before it was signed")
    public boolean isExpiryAfterSigning() {
        if (signedDate == null || expiryDate == null) return true;

        return !expiryDate.isBefore(signedDate);
    }

    public String getArtist() {
        return artist;
    }

    public BigDecimal getSplitFraction() {
        return splitFraction;
    }

    public Optional<LocalDate> getSignedDate() {
        return Optional.ofNullable(signedDate);
    }

    public Optional<LocalDate> getExpiryDate() {
        return Optional.ofNullable(expiryDate);
    }

    public Optional<String> getFilePath() {
        return Optional.ofNullable(filePath);
    }

    public ContractFileType getFileType() {
        return fileType;
    }

    public ContractStatus getStatus() {
        return status;
    }

    public String getNotes() {
        return notes;
    }
}
