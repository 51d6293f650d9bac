package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.domain.BookingSummary;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.repository.BookingRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/** Files a room booking request; confirmation happens in the booking screens. */
public class BookingCreateHandler implements ActionHandler<Actions.BookingCreate> {

  private final BookingRepository bookingRepository;
  private final Clock clock;

  public BookingCreateHandler(BookingRepository bookingRepository, Clock clock) {
    this.bookingRepository = bookingRepository;
    this.clock = clock;
  }

  @Override
  public ActionType type() {
    return ActionType.BOOKING_CREATE;
  }

  @Override
  public Class<Actions.BookingCreate> actionClass() {
    return Actions.BookingCreate.class;
  }

  @Override
  public Map<String, Object> execute(Actions.BookingCreate action, CommandContext context) {
    if (action.houseId() == null) {
      throw new IllegalStateException("Nessuna casa associata al comando");
    }
    long id =
        bookingRepository.createRequest(
            new BookingSummary(
                null,
                context.tenantId(),
                action.userId(),
                action.houseId(),
                action.request(),
                BookingSummary.STATUS_REQUESTED,
                clock.instant()));
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("booking_id", id);
    payload.put("status", BookingSummary.STATUS_REQUESTED);
    return payload;
  }
}
