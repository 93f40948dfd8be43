package com.leadflow.backend.support;

import com.leadflow.backend.services.email.EmailSender;

import java.util.ArrayList;
import java.util.List;

/**
 * Captures outbound mail. Recipients listed in failFor are rejected.
 */
public class RecordingEmailSender implements EmailSender {

    public record SentMail(String to, String subject, String html) {
    }

    private final List<SentMail> sent = new ArrayList<>();
    private final List<String> failFor = new ArrayList<>();

    public void failFor(String recipient) {
        failFor.add(recipient);
    }

    public synchronized List<SentMail> sent() {
        return new ArrayList<>(sent);
    }

    @Override
    public synchronized SendResult send(String to, String subject, String html) {
        if (failFor.contains(to)) {
            return SendResult.failed("Mailbox unavailable: " + to);
        }
        sent.add(new SentMail(to, subject, html));
        return SendResult.sent("msg-" + sent.size());
    }
}
