package com.soundledger.application.file;

import com.soundledger.core.usecase.PayoutReportExporter;
import com.soundledger.domain.model.royalty.Payout;
import io.minio.MinioClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "reports", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(S3ClientProperties.class)
public class S3Beans {

    private static final Logger log = LoggerFactory.getLogger(S3Beans.class);

    @Bean
    public MinioClient minioClient(S3ClientProperties props) {
        log.info("Connecting report output to S3 endpoint {}:{}", props.endpoint(), props.port());
        return S3ClientFactory.create(props);
    }

    @Bean(destroyMethod = "close")
    public S3FileOutput<Payout> payoutFileOutput(ReportConfigProperties reports, MinioClient client) {
        return new S3FileOutput<>(reports.bucket(), client);
    }

    @Bean
    public PayoutReportExporter payoutReportExporter(ReportConfigProperties reports, S3FileOutput<Payout> output) {
        return new PayoutReportExporter(output, reports.keyPrefix());
    }
}
