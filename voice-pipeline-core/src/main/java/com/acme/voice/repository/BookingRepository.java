package com.acme.voice.repository;

import com.acme.voice.domain.BookingSummary;
import java.util.List;

public interface BookingRepository {

  List<BookingSummary> findByUser(String userId, int limit);

  /**
   * Insert a booking request in status requested.
   *
   * @return the generated id
   */
  long createRequest(BookingSummary booking);
}
