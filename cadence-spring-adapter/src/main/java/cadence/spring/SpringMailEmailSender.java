package cadence.spring;

import cadence.spi.EmailSender;
import jakarta.mail.internet.MimeMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link EmailSender} backed by a Spring {@link JavaMailSender}.
 *
 * <p>Bodies are sent as UTF-8 HTML from a fixed sender address. Spring's
 * {@link org.springframework.mail.MailException} propagates unchanged so the dispatcher
 * records the channel as failed.
 */
public final class SpringMailEmailSender implements EmailSender {
  private final JavaMailSender mailSender;
  private final String from;

  public SpringMailEmailSender(JavaMailSender mailSender, String from) {
    this.mailSender = Objects.requireNonNull(mailSender, "mailSender");
    this.from = Objects.requireNonNull(from, "from");
    if (from.isBlank()) {
      throw new IllegalArgumentException("from must not be blank");
    }
  }

  @Override
  public void send(String to, String subject, String body) throws Exception {
    MimeMessage message = mailSender.createMimeMessage();
    MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
    helper.setFrom(from);
    helper.setTo(to);
    helper.setSubject(subject);
    helper.setText(body, true);
    mailSender.send(message);
  }
}
