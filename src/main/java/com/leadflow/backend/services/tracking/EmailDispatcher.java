package com.leadflow.backend.services.tracking;

import com.leadflow.backend.exceptions.DispatchException;
import com.leadflow.backend.models.tracking.TrackedEmail;
import com.leadflow.backend.services.email.EmailSender;
import com.leadflow.backend.store.TrackingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Binds an outbound email to a fresh tracking token, instruments its body and sends it.
 * The TrackedEmail row exists before the transport is called, so a click can never
 * arrive for an unknown token.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailDispatcher {

    private final TrackingStore trackingStore;
    private final TrackingTokenService tokenService;
    private final TrackingLinkRewriter linkRewriter;
    private final EmailSender emailSender;
    private final Clock clock;

    /**
     * @throws DispatchException when the recipient is missing or the transport rejects the email
     */
    public TrackedEmail dispatch(OutboundEmail email) {
        if (email.getRecipientEmail() == null || email.getRecipientEmail().isBlank()) {
            throw new DispatchException(email.getLeadId(), null, "Lead has no contact email");
        }

        String token = tokenService.generateToken();
        TrackedEmail tracked = trackingStore.saveTrackedEmail(TrackedEmail.builder()
                .userId(email.getUserId())
                .leadId(email.getLeadId())
                .recipientEmail(email.getRecipientEmail())
                .sequenceId(email.getSequenceId())
                .sequenceStepId(email.getSequenceStepId())
                .enrollmentId(email.getEnrollmentId())
                .templateId(email.getTemplateId())
                .subject(email.getSubject())
                .body(email.getBody())
                .trackingToken(token)
                .status(TrackedEmail.DeliveryStatus.PENDING)
                .build());

        String html = linkRewriter.instrument(email.getBody(), token);
        EmailSender.SendResult result;
        try {
            result = emailSender.send(email.getRecipientEmail(), email.getSubject(), html);
        } catch (RuntimeException e) {
            result = EmailSender.SendResult.failed(e.getMessage());
        }

        if (!result.success()) {
            tracked.markFailed(result.error());
            trackingStore.saveTrackedEmail(tracked);
            log.warn("Dispatch failed for lead {} (tracked email {}): {}",
                    email.getLeadId(), tracked.getId(), result.error());
            throw new DispatchException(email.getLeadId(), tracked.getId(),
                    result.error() != null ? result.error() : "Email transport rejected the message");
        }

        tracked.markSent(result.messageId(), OffsetDateTime.now(clock));
        TrackedEmail saved = trackingStore.saveTrackedEmail(tracked);
        log.info("Tracked email {} sent to lead {}", saved.getId(), email.getLeadId());
        return saved;
    }
}
