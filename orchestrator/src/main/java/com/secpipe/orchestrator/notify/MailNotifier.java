package com.secpipe.orchestrator.notify;

import com.secpipe.orchestrator.artifact.ArtifactRef;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Sends the run summary e-mail with the report artifacts attached.
 *
 * SMTP host, port and credentials are Spring Boot's {@code spring.mail.*}
 * settings; this class only knows the sender address.
 */
public class MailNotifier {

    private static final Logger log = LoggerFactory.getLogger(MailNotifier.class);

    private final JavaMailSender sender;
    private final String         from;

    public MailNotifier(JavaMailSender sender, String from) {
        this.sender = sender;
        this.from   = from;
    }

    /**
     * Dispatch one message.
     *
     * @param body            HTML body; a link paragraph is appended when
     *                        {@code linkedReportUrl} is not blank
     * @param attachments     only artifacts that exist are attached
     * @throws NotificationException if there is nobody to send to or the mail server rejects it
     */
    public void send(List<String> recipients, String subject, String body,
                     String linkedReportUrl, List<ArtifactRef> attachments) {
        if (recipients == null || recipients.isEmpty()) {
            throw new NotificationException("No notification recipients configured");
        }
        try {
            MimeMessage message = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            if (from != null && !from.isBlank()) {
                helper.setFrom(from);
            }
            helper.setTo(recipients.toArray(String[]::new));
            helper.setSubject(subject);
            helper.setText(withLink(body, linkedReportUrl), true);

            int attached = 0;
            for (ArtifactRef artifact : attachments) {
                if (!artifact.exists()) continue;
                helper.addAttachment(artifact.name(), new FileSystemResource(artifact.path()));
                attached++;
            }

            log.info("Sending '{}' to {} with {} attachment(s)", subject, recipients, attached);
            sender.send(message);
        } catch (MessagingException | MailException e) {
            throw new NotificationException("Failed to send notification: " + e.getMessage(), e);
        }
    }

    /** Insert the report link paragraph before {@code </body>}, or append it. */
    static String withLink(String body, String linkedReportUrl) {
        String paragraph;
        if (linkedReportUrl == null || linkedReportUrl.isBlank()) {
            paragraph = "<p><b>Report page:</b> (no link available)</p>";
        } else {
            String href = HtmlUtils.htmlEscape(linkedReportUrl);
            paragraph = "<p><b>Report page:</b> <a href=\"" + href + "\">" + href + "</a></p>";
        }
        int end = body.lastIndexOf("</body>");
        return end < 0 ? body + paragraph : body.substring(0, end) + paragraph + body.substring(end);
    }
}
