package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.domain.BookingSummary;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.repository.BookingRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BookingListHandler implements ActionHandler<Actions.BookingList> {

  private final BookingRepository bookingRepository;
  private final int limit;

  public BookingListHandler(BookingRepository bookingRepository, int limit) {
    this.bookingRepository = bookingRepository;
    this.limit = limit;
  }

  @Override
  public ActionType type() {
    return ActionType.BOOKING_LIST;
  }

  @Override
  public Class<Actions.BookingList> actionClass() {
    return Actions.BookingList.class;
  }

  @Override
  public Map<String, Object> execute(Actions.BookingList action, CommandContext context) {
    List<BookingSummary> bookings = bookingRepository.findByUser(action.userId(), limit);
    List<Map<String, Object>> summaries =
        bookings.stream()
            .map(
                b -> {
                  Map<String, Object> m = new LinkedHashMap<>();
                  m.put("id", b.id());
                  m.put("room", b.roomName());
                  m.put("status", b.status());
                  return m;
                })
            .toList();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("count", bookings.size());
    payload.put("bookings", summaries);
    return payload;
  }
}
