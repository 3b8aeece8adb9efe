package com.autoreports.sync.output;

import com.autoreports.app.properties.MailProperties;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends the end-of-run notifications over SMTP. In dry-run mode each message is written as an {@code .eml}
 * file instead.
 */
public final class Mailer {
    private static final Logger log = LogManager.getLogger(Mailer.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    /**
     * One outgoing notification. The HTML body wins over the text body when both are set.
     */
    public record Notification(List<String> to, String subject, String textBody, String htmlBody, List<Path> attachments) {
    }

    private final MailProperties props;
    private final Path dryRunDir;
    private final AtomicInteger dryRunCounter = new AtomicInteger();

    public Mailer(MailProperties props, Path workingDir, Path outputsDir) {
        this.props = props;
        this.dryRunDir = isBlank(props.getDryRunDir())
                ? outputsDir.resolve("mail_dry_run")
                : workingDir.resolve(props.getDryRunDir()).normalize();
    }

    /**
     * @return whether the message was handed to SMTP or written to the dry-run folder
     * @throws MessagingException only when {@code mail.fail-fast} is set
     */
    public boolean send(Notification notification) throws MessagingException {
        if (!props.isEnabled()) {
            log.debug("mail disabled, skipped: {}", notification.subject());
            return false;
        }
        List<String> recipients = cleanRecipients(notification.to());
        if (recipients.isEmpty()) {
            return fail("no recipients for '" + notification.subject() + "'", null);
        }
        try {
            if (props.isDryRun()) {
                Path eml = writeDryRun(compose(Session.getInstance(new Properties()), notification, recipients));
                log.info("mail dry-run written: {}", eml.toAbsolutePath());
                return true;
            }
            if (isBlank(props.getSmtpHost())) {
                return fail("mail.smtp-host is not set", null);
            }
            MimeMessage message = compose(smtpSession(), notification, recipients);
            Transport.send(message);
            log.info("mail sent: '{}' to {} recipient(s)", message.getSubject(), recipients.size());
            return true;
        } catch (MessagingException | IOException e) {
            return fail("sending '" + notification.subject() + "' via " + props.getSmtpHost() + ":" + props.getSmtpPort()
                    + " failed: " + e.getMessage(), e);
        }
    }

    String prefixedSubject(String subject) {
        String prefix = props.getSubjectPrefix() == null ? "" : props.getSubjectPrefix().trim();
        String text = subject == null ? "" : subject.trim();
        return prefix.isEmpty() ? text : prefix + " " + text;
    }

    MimeMessage compose(Session session, Notification notification, List<String> recipients) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        String from = isBlank(props.getFrom()) ? props.getSmtpUser() : props.getFrom();
        if (!isBlank(from)) {
            message.setFrom(new InternetAddress(from.trim()));
        }
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(String.join(",", recipients)));
        message.setSubject(prefixedSubject(notification.subject()), "UTF-8");

        MimeBodyPart body = new MimeBodyPart();
        if (isBlank(notification.htmlBody())) {
            body.setText(notification.textBody() == null ? "" : notification.textBody(), "UTF-8");
        } else {
            body.setContent(notification.htmlBody(), "text/html; charset=UTF-8");
        }
        MimeMultipart mixed = new MimeMultipart("mixed");
        mixed.addBodyPart(body);
        List<Path> attachments = notification.attachments() == null ? List.of() : notification.attachments();
        for (Path attachment : attachments) {
            if (attachment == null || !Files.isRegularFile(attachment)) {
                log.warn("attachment skipped, not a file: {}", attachment);
                continue;
            }
            MimeBodyPart part = new MimeBodyPart();
            try {
                part.attachFile(attachment.toFile());
            } catch (IOException e) {
                log.warn("attachment skipped {}: {}", attachment, e.getMessage());
                continue;
            }
            mixed.addBodyPart(part);
        }
        message.setContent(mixed);
        return message;
    }

    private Session smtpSession() {
        Properties smtp = new Properties();
        boolean auth = !isBlank(props.getSmtpUser());
        smtp.put("mail.smtp.host", props.getSmtpHost().trim());
        smtp.put("mail.smtp.port", String.valueOf(props.getSmtpPort()));
        smtp.put("mail.smtp.auth", String.valueOf(auth));
        smtp.put("mail.smtp.starttls.enable", String.valueOf(props.isStarttls()));
        if (!auth) {
            return Session.getInstance(smtp);
        }
        return Session.getInstance(smtp, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(props.getSmtpUser(), props.getSmtpPass());
            }
        });
    }

    private Path writeDryRun(MimeMessage message) throws IOException, MessagingException {
        Files.createDirectories(dryRunDir);
        Path eml = dryRunDir.resolve("mail_" + FILE_STAMP.format(LocalDateTime.now())
                + "_" + dryRunCounter.incrementAndGet() + ".eml");
        try (OutputStream out = Files.newOutputStream(eml)) {
            message.writeTo(out);
        }
        return eml;
    }

    private boolean fail(String message, Exception cause) throws MessagingException {
        if (props.isFailFast()) {
            throw new MessagingException(message, cause);
        }
        log.warn(message);
        return false;
    }

    private static List<String> cleanRecipients(List<String> to) {
        List<String> out = new ArrayList<>();
        if (to == null) {
            return out;
        }
        for (String address : to) {
            if (address != null && !address.isBlank()) {
                out.add(address.trim());
            }
        }
        return out;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
