package com.leadflow.backend.services.sequence;

import com.leadflow.backend.models.Lead;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {{variable}} placeholders of sequence steps against a lead.
 * Unknown or empty variables render as an empty string.
 */
@Service
@Slf4j
public class SequenceTemplateRenderer {

    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private final String senderName;

    public SequenceTemplateRenderer(@Value("${resend.from-name:LeadFlow}") String senderName) {
        this.senderName = senderName;
    }

    public Map<String, String> buildVariables(Lead lead) {
        Map<String, String> variables = new HashMap<>();

        String contactName = orEmpty(lead.getContactName());
        variables.put("contactName", contactName);
        variables.put("firstName", extractFirstName(contactName));
        variables.put("contactTitle", orEmpty(lead.getContactTitle()));
        variables.put("contactEmail", orEmpty(lead.getContactEmail()));
        variables.put("companyName", orEmpty(lead.getCompanyName()));
        variables.put("industry", orEmpty(lead.getIndustry()));
        variables.put("website", orEmpty(lead.getWebsite()));
        variables.put("location", orEmpty(lead.getLocation()));
        variables.put("companySize", orEmpty(lead.getCompanySize()));
        variables.put("senderName", senderName);

        return variables;
    }

    public String render(String template, Lead lead) {
        return render(template, buildVariables(lead));
    }

    public String render(String template, Map<String, String> variables) {
        if (template == null || template.isEmpty()) {
            return "";
        }

        StringBuffer result = new StringBuffer();
        Matcher matcher = TEMPLATE_PATTERN.matcher(template);

        while (matcher.find()) {
            String variableName = matcher.group(1).trim();
            String value = variables.get(variableName);
            if (value == null) {
                log.debug("Unknown template variable: {}", variableName);
                value = "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);

        return result.toString();
    }

    private static String extractFirstName(String fullName) {
        if (fullName == null || fullName.trim().isEmpty()) {
            return "there";
        }
        return fullName.trim().split("\\s+")[0];
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
