package com.gocardless.client.model;

/**
 * Cursor parameters shared by every list request.
 */
public interface ListRequest {

  /** Cursor pointing to the start of the desired set. */
  String getAfter();

  void setAfter(String after);

  /** Cursor pointing to the end of the desired set. */
  String getBefore();

  void setBefore(String before);

  /** Number of records to return. */
  Integer getLimit();

  void setLimit(Integer limit);
}
