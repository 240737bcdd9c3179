package outreach.wave;

import outreach.model.Treatment;

/** One row of a batch classification: the attendee and the treatment assigned. */
public record ClassifiedAttendee(long attendeeId, Treatment treatment) {
}
