package com.scholary.narrator.objectstore;

/** An upload, bucket check or link request against object storage failed. */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
