package io.schemawatch.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Sends a plain-text report per event, one message per recipient.
 */
public class EmailNotificationChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);

    private static final DateTimeFormatter COMPLETED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final NotificationSettings settings;
    private final Function<EmailSettings, JavaMailSender> senderFactory;
    private final ObjectMapper objectMapper;

    public EmailNotificationChannel(NotificationSettings settings, ObjectMapper objectMapper) {
        this(settings, objectMapper, EmailNotificationChannel::smtpSender);
    }

    public EmailNotificationChannel(NotificationSettings settings,
                                    ObjectMapper objectMapper,
                                    Function<EmailSettings, JavaMailSender> senderFactory) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.senderFactory = Objects.requireNonNull(senderFactory, "senderFactory must not be null");
    }

    @Override
    public String name() {
        return "email";
    }

    @Override
    public boolean isEnabled() {
        return settings.email().enabled();
    }

    @Override
    public void deliver(NotificationEvent event) {
        EmailSettings email = settings.email();
        if (!email.enabled()) {
            return;
        }
        if (email.toAddresses().isEmpty()) {
            log.warn("email notification skipped: no recipients configured source={}", event.source());
            return;
        }

        JavaMailSender sender = senderFactory.apply(email);
        String subject = subject(event);
        String body = body(event);

        int sent = 0;
        for (String to : email.toAddresses()) {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(email.fromAddress());
            message.setTo(to);
            message.setSubject(subject);
            message.setText(body);
            try {
                sender.send(message);
                sent++;
            } catch (MailException e) {
                log.error("email notification failed to={} source={} msg={}", to, event.source(), e.getMessage(), e);
            }
        }
        log.info("email notification sent source={} status={} recipients={}/{}",
                event.source(), event.status(), sent, email.toAddresses().size());
    }

    static String subject(NotificationEvent event) {
        return "Database Documentation Job: " + event.source() + " - " + event.statusTitle();
    }

    String body(NotificationEvent event) {
        StringBuilder sb = new StringBuilder();
        sb.append("Database Documentation Job Report\n\n");
        sb.append("Source: ").append(event.source()).append('\n');
        sb.append("Status: ").append(event.statusTitle()).append('\n');
        sb.append("Completed At: ")
                .append(COMPLETED_AT.format(event.timestamp().atZone(ZoneId.systemDefault())))
                .append('\n');

        if (event.payload() != null) {
            sb.append('\n').append("Result: ").append(render(event.payload())).append('\n');
        }
        return sb.toString();
    }

    private String render(Object payload) {
        if (payload instanceof CharSequence text) {
            return text.toString();
        }
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return String.valueOf(payload);
        }
    }

    private static JavaMailSender smtpSender(EmailSettings email) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(email.smtpHost());
        sender.setPort(email.smtpPort());
        sender.setDefaultEncoding("UTF-8");

        Properties props = sender.getJavaMailProperties();
        props.put("mail.smtp.starttls.enable", String.valueOf(email.startTls()));
        if (email.hasCredentials()) {
            sender.setUsername(email.username());
            sender.setPassword(email.password());
            props.put("mail.smtp.auth", "true");
        }
        return sender;
    }
}
