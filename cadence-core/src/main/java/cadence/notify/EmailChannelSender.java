package cadence.notify;

import cadence.model.Channel;
import cadence.model.Notification;
import cadence.spi.EmailSender;
import cadence.spi.RecipientDirectory;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends notifications as HTML email to the owner's address from a {@link RecipientDirectory}.
 */
public final class EmailChannelSender implements ChannelSender {
  private static final Logger logger = Logger.getLogger(EmailChannelSender.class.getName());

  private final EmailSender emailSender;
  private final RecipientDirectory recipients;
  private final String footer;

  public EmailChannelSender(EmailSender emailSender, RecipientDirectory recipients) {
    this(emailSender, recipients, "This is an automated notification.");
  }

  /**
   * @param footer plain-text line appended below the message; {@code null} or blank omits it
   */
  public EmailChannelSender(EmailSender emailSender, RecipientDirectory recipients, String footer) {
    this.emailSender = Objects.requireNonNull(emailSender, "emailSender");
    this.recipients = Objects.requireNonNull(recipients, "recipients");
    this.footer = footer;
  }

  @Override
  public Channel channel() {
    return Channel.EMAIL;
  }

  @Override
  public void deliver(Notification notification) throws Exception {
    Optional<String> address = recipients.emailFor(notification.ownerId());
    if (address.isEmpty() || address.get().isBlank()) {
      logger.log(Level.FINE, "No email address for " + notification.ownerId()
          + "; skipping notification " + notification.id());
      return;
    }
    emailSender.send(address.get(), notification.title(), renderHtml(notification));
  }

  String renderHtml(Notification notification) {
    StringBuilder html = new StringBuilder();
    html.append("<html><body>");
    html.append("<h2>").append(escapeHtml(notification.title())).append("</h2>");
    html.append("<p>").append(escapeHtml(notification.message())).append("</p>");
    if (footer != null && !footer.isBlank()) {
      html.append("<hr><p><small>").append(escapeHtml(footer)).append("</small></p>");
    }
    html.append("</body></html>");
    return html.toString();
  }

  private static String escapeHtml(String text) {
    if (text == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '<':
          sb.append("&lt;");
          break;
        case '>':
          sb.append("&gt;");
          break;
        case '&':
          sb.append("&amp;");
          break;
        case '"':
          sb.append("&quot;");
          break;
        case '\'':
          sb.append("&#39;");
          break;
        default:
          sb.append(c);
      }
    }
    return sb.toString();
  }
}
