package com.leadflow.backend.services.scoring;

import com.leadflow.backend.models.Lead;
import com.leadflow.backend.store.EngagementCounts;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic lead score in [0, 100].
 *
 * Factors, each clamped to its own range before summing:
 * company size tier (0-25), contact completeness (0-20), data quality (0-15)
 * and engagement (0-40). Engagement grows logarithmically with distinct signals, so
 * repeated opens of the same email never move the score.
 */
@Component
public class LeadScoreCalculator {

    static final int MAX_COMPANY_SIZE = 25;
    static final int MAX_CONTACT = 20;
    static final int MAX_DATA_QUALITY = 15;
    static final int MAX_ENGAGEMENT = 40;

    private static final double ENGAGEMENT_SCALE = 15.0;

    public ScoreResult calculate(Lead lead, EngagementCounts counts) {
        EngagementCounts engagementCounts = counts != null ? counts : EngagementCounts.none();

        int companySize = clamp(scoreCompanySize(lead.getCompanySize()), MAX_COMPANY_SIZE);
        int contact = clamp(scoreContactCompleteness(lead), MAX_CONTACT);
        int dataQuality = clamp(scoreDataQuality(lead), MAX_DATA_QUALITY);
        int engagement = clamp(scoreEngagement(engagementCounts.openedEmails(), engagementCounts.distinctClicks()),
                MAX_ENGAGEMENT);

        int score = clamp(companySize + contact + dataQuality + engagement, 100);
        ScoreResult.Priority priority = ScoreResult.Priority.of(score);

        List<String> strengths = new ArrayList<>();
        List<String> improvements = new ArrayList<>();

        if (companySize >= 17) {
            strengths.add("large company size");
        } else if (companySize < 12) {
            improvements.add("small or unknown company size");
        }

        if (contact >= 14) {
            strengths.add("complete contact information");
        } else if (contact < 10) {
            improvements.add("incomplete contact details");
        }

        if (engagement > 0) {
            strengths.add("active engagement");
        }

        if (dataQuality >= 12) {
            strengths.add("high data quality");
        } else if (dataQuality < 9) {
            improvements.add("missing company information");
        }

        StringBuilder explanation = new StringBuilder()
                .append(priority.name()).append(" priority lead (score: ").append(score).append("/100).");
        if (!strengths.isEmpty()) {
            explanation.append(" Strengths: ").append(String.join(", ", strengths)).append('.');
        }
        if (!improvements.isEmpty()) {
            explanation.append(" Areas to improve: ").append(String.join(", ", improvements)).append('.');
        }

        return new ScoreResult(score, priority, companySize, contact, dataQuality, engagement,
                List.copyOf(strengths), List.copyOf(improvements), explanation.toString());
    }

    int scoreCompanySize(String companySize) {
        if (isBlank(companySize)) {
            return 0;
        }
        String size = companySize.toLowerCase(Locale.ROOT);

        if (size.contains("10000+") || size.contains("enterprise")) return 25;
        if (size.contains("1000-5000") || size.contains("5000-10000")) return 22;
        if (size.contains("500-1000")) return 20;
        if (size.contains("200-500")) return 17;
        if (size.contains("50-200")) return 15;
        if (size.contains("10-50")) return 12;
        if (size.contains("1-10") || size.contains("startup")) return 10;

        return 5;
    }

    int scoreContactCompleteness(Lead lead) {
        int present = count(lead.getContactName(), lead.getContactEmail(), lead.getContactPhone());
        return (int) Math.round(present / 3.0 * MAX_CONTACT);
    }

    int scoreDataQuality(Lead lead) {
        int present = count(lead.getWebsite(), lead.getIndustry(), lead.getLocation(), lead.getDescription());
        return (int) Math.round(present / 4.0 * MAX_DATA_QUALITY);
    }

    /**
     * Clicks weigh twice as much as opens. Negative inputs count as zero.
     */
    int scoreEngagement(long openedEmails, long distinctClicks) {
        long signals = Math.max(0, openedEmails) + 2 * Math.max(0, distinctClicks);
        if (signals == 0) {
            return 0;
        }
        return (int) Math.round(ENGAGEMENT_SCALE * Math.log1p(signals));
    }

    private static int count(String... values) {
        int present = 0;
        for (String value : values) {
            if (!isBlank(value)) {
                present++;
            }
        }
        return present;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(max, value));
    }
}
