package com.scholary.narrator.api;

import java.time.Instant;

/** Error body for every failed API call. */
public record ApiError(String errorCode, String message, Instant timestamp) {

  static ApiError of(String errorCode, String message) {
    return new ApiError(errorCode, message, Instant.now());
  }
}
