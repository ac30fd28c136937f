package io.dazzleduck.sharing.table.signer;

import com.typesafe.config.Config;
import io.dazzleduck.sharing.common.ConfigConstants;
import io.dazzleduck.sharing.common.error.InternalException;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.net.URI;
import java.time.Duration;

/**
 * Pre-signs {@code s3://bucket/key} locations as HTTPS GET URLs.
 */
public class S3UrlSigner implements UrlSigner {

    private final S3Presigner presigner;

    public S3UrlSigner(S3Presigner presigner) {
        this.presigner = presigner;
    }

    public static S3UrlSigner load(Config s3Config) {
        var builder = S3Presigner.builder()
                .region(Region.of(s3Config.getString(ConfigConstants.REGION_KEY)))
                .credentialsProvider(DefaultCredentialsProvider.create());
        if (s3Config.hasPath(ConfigConstants.ENDPOINT_KEY)) {
            builder.endpointOverride(URI.create(s3Config.getString(ConfigConstants.ENDPOINT_KEY)));
        }
        return new S3UrlSigner(builder.build());
    }

    @Override
    public SignedUrl sign(URI location, Duration expiration) {
        var bucket = location.getHost();
        var key = location.getPath();
        if (bucket == null || key == null || key.length() < 2) {
            throw new InternalException("not an object location: " + location);
        }
        var request = GetObjectPresignRequest.builder()
                .signatureDuration(expiration)
                .getObjectRequest(b -> b.bucket(bucket).key(key.substring(1)))
                .build();
        try {
            var presigned = presigner.presignGetObject(request);
            return new SignedUrl(presigned.url().toString(), presigned.expiration());
        } catch (SdkException e) {
            throw new InternalException("failed to sign " + location, e);
        }
    }
}
