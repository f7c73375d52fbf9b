package in.the13th.intel.domain.delivery;

/**
 * A rendered notification ready for a {@code Notifier}.
 */
public record Alert(
    Long eventId,
    String subject,
    String body,
    String recipient
) {}
