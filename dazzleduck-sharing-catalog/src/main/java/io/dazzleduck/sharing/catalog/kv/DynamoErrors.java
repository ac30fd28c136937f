package io.dazzleduck.sharing.catalog.kv;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;

final class DynamoErrors {

    private DynamoErrors() {
    }

    /**
     * Throttling, timeouts and errors the SDK itself flags as retryable.
     */
    static boolean isTransient(RuntimeException e) {
        if (e instanceof SdkException sdkException) {
            if (sdkException.retryable()
                    || e instanceof ApiCallTimeoutException
                    || e instanceof ApiCallAttemptTimeoutException
                    || e instanceof AbortedException) {
                return true;
            }
        }
        return e instanceof AwsServiceException awsServiceException && awsServiceException.isThrottlingException();
    }
}
