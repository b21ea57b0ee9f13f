package com.bluejay.certdiscovery.discovery.util;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String INVALID_URL = "INVALID_URL";
  public static final String MISSING_API_KEY = "MISSING_API_KEY";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_402_PAYMENT = "HTTP_402_PAYMENT";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String EMPTY_CONTENT = "EMPTY_CONTENT";
  public static final String CRAWL_FAILED = "CRAWL_FAILED";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 402) {
      return HTTP_402_PAYMENT;
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
    return UNKNOWN;
  }

  /**
   * Maps a scraping error code (and its message, for I/O errors) to a stable reason code.
   */
  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.equals("invalid_url")) {
      return INVALID_URL;
    }
    if (code.equals("missing_api_key")) {
      return MISSING_API_KEY;
    }
    if (code.equals("interrupted") || code.equals("cancelled")) {
      return INTERRUPTED;
    }
    if (code.equals("empty_content")) {
      return EMPTY_CONTENT;
    }
    if (code.contains("invalid_payload") || code.contains("parse")) {
      return PARSING_FAILED;
    }
    if (code.equals("crawl_failed")) {
      return CRAWL_FAILED;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      return UNKNOWN;
    }
    Integer httpStatus = parseHttpStatus(code);
    if (httpStatus != null) {
      return fromHttpStatus(httpStatus);
    }
    return UNKNOWN;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, DNS_FAILURE, TLS_FAILURE, HTTP_429_RATE_LIMIT, HTTP_5XX -> true;
      default -> false;
    };
  }

  public static Integer parseHttpStatus(String key) {
    if (key == null || key.isBlank()) {
      return null;
    }
    String lower = key.toLowerCase(Locale.ROOT);
    int idx = lower.lastIndexOf("http_");
    if (idx < 0) {
      return null;
    }
    String tail = lower.substring(idx + 5);
    int end = 0;
    while (end < tail.length() && Character.isDigit(tail.charAt(end))) {
      end++;
    }
    if (end == 0) {
      return null;
    }
    try {
      return Integer.parseInt(tail.substring(0, end));
    } catch (NumberFormatException ignored) {
      return null;
    }
  }
}
