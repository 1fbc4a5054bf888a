package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A single page of a cursor-paginated collection.
 *
 * @param <T> the resource type
 */
public abstract class ListResponse<T> extends ApiResponse {

  @JsonProperty("meta")
  private Meta meta;

  /** Items on this page, never null. */
  @JsonIgnore
  public abstract List<T> getItems();

  public Meta getMeta() {
    return meta;
  }

  public void setMeta(Meta meta) {
    this.meta = meta;
  }

  /** Cursor of the following page, or null on the last page. */
  @JsonIgnore
  public String getNextCursor() {
    if (meta == null || meta.getCursors() == null) {
      return null;
    }
    return meta.getCursors().getAfter();
  }

  public static class Meta {

    @JsonProperty("cursors")
    private Cursors cursors;

    @JsonProperty("limit")
    private Integer limit;

    public Cursors getCursors() {
      return cursors;
    }

    public void setCursors(Cursors cursors) {
      this.cursors = cursors;
    }

    public Integer getLimit() {
      return limit;
    }

    public void setLimit(Integer limit) {
      this.limit = limit;
    }
  }

  public static class Cursors {

    @JsonProperty("before")
    private String before;

    @JsonProperty("after")
    private String after;

    public String getBefore() {
      return before;
    }

    public void setBefore(String before) {
      this.before = before;
    }

    public String getAfter() {
      return after;
    }

    public void setAfter(String after) {
      this.after = after;
    }
  }
}
