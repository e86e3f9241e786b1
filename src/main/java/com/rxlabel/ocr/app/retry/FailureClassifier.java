package com.rxlabel.ocr.app.retry;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.DeadlineExceededException;
import com.google.api.gax.rpc.UnavailableException;
import com.rxlabel.ocr.app.error.MalformedResponseException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Maps the exceptions thrown by WebClient, the Google and the AWS SDKs onto {@link FailureKind}.
 * Walks the cause chain because reactive {@code block()} wraps checked exceptions.
 */
public final class FailureClassifier {

  private FailureClassifier() {}

  public static FailureKind classify(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      FailureKind kind = classifyOne(t);
      if (kind != null) {
        return kind;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return FailureKind.OTHER;
  }

  private static FailureKind classifyOne(Throwable t) {
    if (t instanceof MalformedResponseException) return FailureKind.MALFORMED_RESPONSE;
    if (t instanceof TimeoutException
        || t instanceof SocketTimeoutException
        || t instanceof DeadlineExceededException
        || t instanceof ApiCallTimeoutException
        || t instanceof ApiCallAttemptTimeoutException) {
      return FailureKind.TIMEOUT;
    }
    if (t instanceof ConnectException
        || t instanceof UnknownHostException
        || t instanceof NoRouteToHostException
        || t instanceof UnavailableException) {
      return FailureKind.CONNECTION;
    }
    if (t instanceof WebClientResponseException
        || t instanceof AwsServiceException
        || t instanceof ApiException) {
      return FailureKind.HTTP_STATUS;
    }
    // request-level failures without a more specific cause are treated as unreachable
    if (t instanceof WebClientRequestException && t.getCause() == null) {
      return FailureKind.CONNECTION;
    }
    if (t instanceof SdkClientException && t.getCause() == null) {
      return FailureKind.CONNECTION;
    }
    return null;
  }
}
