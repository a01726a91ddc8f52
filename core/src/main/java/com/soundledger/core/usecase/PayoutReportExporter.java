package com.soundledger.core.usecase;

import com.soundledger.domain.model.royalty.Payout;
import com.soundledger.domain.port.driven.file.CsvRecordMapping;
import com.soundledger.domain.port.driven.file.FileOutputPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Stream;

/**
 * Writes one CSV statement per payout, keyed by the payout's report label.
 */
public final class PayoutReportExporter {
    private static final Logger log = LoggerFactory.getLogger(PayoutReportExporter.class);

    static final CsvRecordMapping<Payout> PAYOUT_MAPPING = CsvRecordMapping.of(
            List.of(
                    "artist",
                    "period",
                    "grossRevenue",
                    "shareFraction",
                    "artistShare",
                    "advanceDeducted",
                    "netPayout",
                    "tracks",
                    "streams"
            ),
            p -> List.of(
                    p.getArtist(),
                    p.getPeriod().label(),
                    p.getGrossRevenue().toPlainString(),
                    p.getShareFraction().toPlainString(),
                    p.getArtistShare().toPlainString(),
                    p.getAdvanceDeducted().toPlainString(),
                    p.getNetPayout().toPlainString(),
                    String.valueOf(p.getTrackCount()),
                    String.valueOf(p.getStreamCount())
            )
    );

    private final FileOutputPort<Payout> output;
    private final String keyPrefix;

    public PayoutReportExporter(FileOutputPort<Payout> output, String keyPrefix) {
        this.output = output;
        this.keyPrefix = canonicalPrefix(keyPrefix);
    }

    public List<String> export(List<Payout> payouts) {
        return payouts
                .stream()
                .map(this::export)
                .toList();
    }

    public String export(Payout payout) {
        var key = objectKeyFor(payout);
        output.emit(Stream.of(payout), key, PAYOUT_MAPPING);
        log.info("Exported payout statement for {} in {} to {}", payout.getArtist(), payout.getPeriod(), key);
        return key;
    }

    String objectKeyFor(Payout payout) {
        return "%s%s/%s.csv".formatted(keyPrefix, payout.getPeriod().label(), payout.reportLabel());
    }

    private static String canonicalPrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";

        var trimmed = prefix.trim();
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }
}
