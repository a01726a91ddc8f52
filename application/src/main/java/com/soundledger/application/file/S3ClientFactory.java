package com.soundledger.application.file;

import io.minio.MinioClient;

public final class S3ClientFactory {
    private S3ClientFactory() {}

    /**
     * Anonymous access is used when no key pair is configured.
     */
    public static MinioClient create(S3ClientProperties props) {
        var builder = MinioClient.builder()
                .endpoint(props.endpoint(), props.port(), props.secure())
                .region(props.region());

        if (props.hasCredentials()) {
            builder.credentials(props.accessKey(), props.secretKey());
        }
        return builder.build();
    }
}
