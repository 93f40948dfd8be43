package com.leadflow.backend.services.notification;

import com.leadflow.backend.services.email.EmailSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Delivers owner notifications as simple HTML emails.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailNotificationPort implements NotificationPort {

    private final EmailSender emailSender;

    @Override
    public boolean notify(String recipient, String title, String content) {
        String html = "<div style=\"font-family:Arial,sans-serif;white-space:pre-wrap\">"
                + HtmlUtils.htmlEscape(content) + "</div>";
        EmailSender.SendResult result = emailSender.send(recipient, title, html);
        if (!result.success()) {
            log.warn("Notification '{}' to {} not delivered: {}", title, recipient, result.error());
        }
        return result.success();
    }
}
