package cadence.spring;

import jakarta.mail.Message;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;
import org.springframework.mail.MailException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SpringMailEmailSenderTest {

  @Test
  void sendsHtmlMessage() throws Exception {
    RecordingMailSender mailSender = new RecordingMailSender();
    SpringMailEmailSender sender = new SpringMailEmailSender(mailSender, "noreply@cadence.test");

    sender.send("alice@example.com", "Budget Alert", "<h2>Budget Alert</h2>");

    assertEquals(1, mailSender.sent.size());
    MimeMessage message = mailSender.sent.get(0);
    assertEquals("Budget Alert", message.getSubject());
    assertEquals("noreply@cadence.test", message.getFrom()[0].toString());
    assertEquals("alice@example.com",
        message.getRecipients(Message.RecipientType.TO)[0].toString());
    assertEquals("<h2>Budget Alert</h2>", message.getContent());
    assertTrue(message.getDataHandler().getContentType().startsWith("text/html"));
  }

  @Test
  void mailFailurePropagates() {
    RecordingMailSender mailSender = new RecordingMailSender();
    mailSender.failure = new MailSendException("smtp down");
    SpringMailEmailSender sender = new SpringMailEmailSender(mailSender, "noreply@cadence.test");

    MailException thrown = assertThrows(MailException.class,
        () -> sender.send("alice@example.com", "subject", "body"));
    assertEquals("smtp down", thrown.getMessage());
  }

  @Test
  void rejectsBlankFromAddress() {
    assertThrows(IllegalArgumentException.class,
        () -> new SpringMailEmailSender(new RecordingMailSender(), " "));
    assertThrows(NullPointerException.class,
        () -> new SpringMailEmailSender(null, "noreply@cadence.test"));
  }

  private static final class RecordingMailSender extends JavaMailSenderImpl {
    final List<MimeMessage> sent = new CopyOnWriteArrayList<>();
    volatile MailException failure;

    @Override
    protected void doSend(MimeMessage[] mimeMessages, Object[] originalMessages) {
      if (failure != null) {
        throw failure;
      }
      sent.addAll(List.of(mimeMessages));
    }
  }
}
