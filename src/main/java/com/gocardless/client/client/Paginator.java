package com.gocardless.client.client;

import com.gocardless.client.model.ListResponse;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily walks a cursor-paginated collection.
 *
 * <p>Nothing is fetched until the first element is requested. Each page is requested with
 * the {@code after} cursor of the previous one, and iteration stops once a page comes back
 * without one. Every call to {@link #iterator()} starts again from the initial cursor.
 *
 * @param <T> the resource type
 */
public class Paginator<T> implements Iterable<T> {

  private final Function<String, ? extends ListResponse<T>> pageFetcher;
  private final String initialCursor;

  /**
   * @param pageFetcher fetches the page after the given cursor (null for the first page)
   * @param initialCursor cursor of the first page to fetch, may be null
   */
  public Paginator(Function<String, ? extends ListResponse<T>> pageFetcher,
      String initialCursor) {
    this.pageFetcher = pageFetcher;
    this.initialCursor = initialCursor;
  }

  @Override
  public Iterator<T> iterator() {
    return new ItemIterator<>(new PageIterator<>(pageFetcher, initialCursor));
  }

  /** Iterates over whole pages rather than single items. */
  public Iterable<List<T>> pages() {
    return () -> new PageIterator<>(pageFetcher, initialCursor);
  }

  public Stream<T> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
  }

  private static final class PageIterator<T> implements Iterator<List<T>> {

    private final Function<String, ? extends ListResponse<T>> pageFetcher;
    private String cursor;
    private boolean started;

    PageIterator(Function<String, ? extends ListResponse<T>> pageFetcher, String cursor) {
      this.pageFetcher = pageFetcher;
      this.cursor = cursor;
    }

    @Override
    public boolean hasNext() {
      return !started || cursor != null;
    }

    @Override
    public List<T> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      ListResponse<T> page = pageFetcher.apply(cursor);
      started = true;
      cursor = page.getNextCursor();
      return page.getItems();
    }
  }

  private static final class ItemIterator<T> implements Iterator<T> {

    private final Iterator<List<T>> pages;
    private Iterator<T> current = Collections.emptyIterator();

    ItemIterator(Iterator<List<T>> pages) {
      this.pages = pages;
    }

    @Override
    public boolean hasNext() {
      while (!current.hasNext() && pages.hasNext()) {
        current = pages.next().iterator();
      }
      return current.hasNext();
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return current.next();
    }
  }
}
