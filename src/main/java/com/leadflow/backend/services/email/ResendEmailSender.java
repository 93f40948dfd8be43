package com.leadflow.backend.services.email;

import com.resend.Resend;
import com.resend.core.exception.ResendException;
import com.resend.services.emails.model.CreateEmailOptions;
import com.resend.services.emails.model.CreateEmailResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link EmailSender} backed by Resend. When no valid API key is configured every send
 * returns a failed result instead of throwing.
 */
@Service
@Slf4j
public class ResendEmailSender implements EmailSender {

    private final Resend resend;
    private final boolean enabled;
    private final String from;

    public ResendEmailSender(
            @Value("${resend.api-key:}") String apiKey,
            @Value("${resend.enabled:true}") boolean enabledConfig,
            @Value("${resend.from-email:outreach@leadflow.app}") String fromEmail,
            @Value("${resend.from-name:LeadFlow}") String fromName) {

        boolean hasValidKey = apiKey != null && !apiKey.isEmpty() && apiKey.startsWith("re_");
        this.enabled = enabledConfig && hasValidKey;
        this.from = String.format("%s <%s>", fromName, fromEmail);

        if (this.enabled) {
            this.resend = new Resend(apiKey);
            log.info("Resend email sender initialized, from: {}", from);
        } else {
            this.resend = null;
            if (!hasValidKey) {
                log.warn("Resend API key not configured or invalid - emails will not be sent");
            } else {
                log.warn("Resend is disabled via configuration");
            }
        }
    }

    @Override
    public SendResult send(String to, String subject, String htmlBody) {
        if (!enabled) {
            log.warn("Resend DISABLED - would send to: {} | Subject: {}", to, subject);
            return SendResult.failed("Resend service is disabled - set RESEND_API_KEY");
        }
        if (to == null || to.trim().isEmpty()) {
            return SendResult.failed("Recipient email is required");
        }
        if (subject == null || subject.trim().isEmpty()) {
            return SendResult.failed("Subject is required");
        }

        try {
            CreateEmailOptions options = CreateEmailOptions.builder()
                    .from(from)
                    .to(to)
                    .subject(subject)
                    .html(htmlBody)
                    .build();

            CreateEmailResponse response = resend.emails().send(options);
            log.info("Email sent via Resend to {} - Message ID: {}", to, response.getId());
            return SendResult.sent(response.getId());

        } catch (ResendException e) {
            log.error("Resend API error sending to {}: {}", to, e.getMessage());
            return SendResult.failed("Resend API error: " + e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error sending email to {}: {}", to, e.getMessage(), e);
            return SendResult.failed("Unexpected error: " + e.getMessage());
        }
    }
}
