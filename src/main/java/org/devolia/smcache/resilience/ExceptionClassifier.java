package org.devolia.smcache.resilience;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

/**
 * Classifies backend failures into categories for logging and metrics.
 *
 * <p>The category never influences caching behavior: every failure is stored and retried with the
 * same backoff. It only labels WARN log lines and the refresh failure counters.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class ExceptionClassifier {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionClassifier.class);

  public static final String NOT_FOUND = "not_found";
  public static final String THROTTLED = "throttled";
  public static final String ACCESS_DENIED = "access_denied";
  public static final String BAD_REQUEST = "bad_request";
  public static final String SERVER_ERROR = "server_error";
  public static final String CLIENT_ERROR = "client_error";
  public static final String TIMEOUT = "timeout";
  public static final String NETWORK = "network";
  public static final String SSL = "ssl";
  public static final String SDK_CLIENT = "sdk_client";
  public static final String UNKNOWN = "unknown";

  private static final int MAX_CAUSE_DEPTH = 16;

  private ExceptionClassifier() {}

  /**
   * Gets a human-readable error category for logging and metrics.
   *
   * @param exception the exception to categorize
   * @return error category string
   */
  public static String getErrorCategory(Throwable exception) {
    return categorize(exception, 0);
  }

  private static String categorize(Throwable exception, int depth) {
    if (exception == null) {
      return UNKNOWN;
    }

    if (exception instanceof ResourceNotFoundException) {
      return NOT_FOUND;
    }

    if (exception instanceof SdkServiceException serviceException) {
      if (serviceException.isThrottlingException()) {
        return THROTTLED;
      }
      int statusCode = serviceException.statusCode();
      return switch (statusCode) {
        case 400 -> BAD_REQUEST;
        case 401, 403 -> ACCESS_DENIED;
        case 404 -> NOT_FOUND;
        case 429 -> THROTTLED;
        default -> statusCode >= 500 ? SERVER_ERROR : CLIENT_ERROR;
      };
    }

    if (exception instanceof SocketTimeoutException || exception instanceof TimeoutException) {
      return TIMEOUT;
    }

    if (exception instanceof UnknownHostException || exception instanceof ConnectException) {
      return NETWORK;
    }

    if (exception instanceof SSLException) {
      return SSL;
    }

    // Client-side SDK failures usually wrap the I/O problem that caused them
    if (exception instanceof SdkClientException) {
      String causeCategory = categoryOfCause(exception, depth);
      return UNKNOWN.equals(causeCategory) ? SDK_CLIENT : causeCategory;
    }

    String causeCategory = categoryOfCause(exception, depth);
    if (UNKNOWN.equals(causeCategory)) {
      logger.debug("Unclassified failure: {}", exception.getClass().getSimpleName());
    }
    return causeCategory;
  }

  // Cause chains can be cyclic, so the walk stops after MAX_CAUSE_DEPTH links
  private static String categoryOfCause(Throwable exception, int depth) {
    Throwable cause = exception.getCause();
    if (cause != null && cause != exception && depth < MAX_CAUSE_DEPTH) {
      return categorize(cause, depth + 1);
    }
    return UNKNOWN;
  }
}
