package com.leadflow.backend.services.email;

/**
 * Outbound email transport.
 */
public interface EmailSender {

    SendResult send(String to, String subject, String htmlBody);

    record SendResult(boolean success, String messageId, String error) {

        public static SendResult sent(String messageId) {
            return new SendResult(true, messageId, null);
        }

        public static SendResult failed(String error) {
            return new SendResult(false, null, error);
        }
    }
}
