package com.delta.scraper.scrape.util;

import com.delta.scraper.scrape.model.FetchOutcome;

public final class ReasonCodes {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String CONNECTION_REFUSED = "CONNECTION_REFUSED";
  public static final String NETWORK_ERROR = "NETWORK_ERROR";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String DEFENSE_DETECTED = "DEFENSE_DETECTED";
  public static final String NO_PROXY_AVAILABLE = "NO_PROXY_AVAILABLE";
  public static final String FETCH_EXHAUSTED = "FETCH_EXHAUSTED";
  public static final String EXTRACTION_FAILED = "EXTRACTION_FAILED";
  public static final String REQUIRED_FIELDS_MISSING = "REQUIRED_FIELDS_MISSING";
  public static final String CONSECUTIVE_FAILURES = "CONSECUTIVE_FAILURES";
  public static final String CANCELLED = "CANCELLED";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodes() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    if (status >= 400) {
      return HTTP_4XX;
    }
    return UNKNOWN;
  }

  public static String fromOutcome(FetchOutcome outcome, int statusCode) {
    if (outcome == null) {
      return UNKNOWN;
    }
    return switch (outcome) {
      case TIMEOUT -> TIMEOUT;
      case REFUSED -> CONNECTION_REFUSED;
      case DNS_FAILURE -> DNS_FAILURE;
      case NETWORK_ERROR -> NETWORK_ERROR;
      case DEFENSE_DETECTED -> DEFENSE_DETECTED;
      case HTTP_ERROR -> fromHttpStatus(statusCode);
      case SUCCESS -> UNKNOWN;
    };
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, DNS_FAILURE, CONNECTION_REFUSED, NETWORK_ERROR, HTTP_429_RATE_LIMIT, HTTP_5XX -> true;
      default -> false;
    };
  }
}
