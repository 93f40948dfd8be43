package com.leadflow.backend.services.tracking;

import com.leadflow.backend.config.EngagementProperties;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Rewrites the links of an HTML body to go through the click endpoint and appends the open pixel.
 */
@Component
@RequiredArgsConstructor
public class TrackingLinkRewriter {

    static final String CLICK_PATH = "/track/click/";
    static final String OPEN_PATH = "/track/open/";

    private final EngagementProperties properties;

    public String instrument(String html, String token) {
        Document doc = Jsoup.parse(html != null ? html : "");
        doc.outputSettings().prettyPrint(false);

        for (Element link : doc.select("a[href]")) {
            String href = link.attr("href").trim();
            if (shouldTrack(href)) {
                link.attr("href", clickUrl(token, href));
            }
        }

        doc.body().appendElement("img")
                .attr("src", openUrl(token))
                .attr("width", "1")
                .attr("height", "1")
                .attr("alt", "")
                .attr("style", "display:block;border:0;outline:none;");

        return doc.outerHtml();
    }

    public String clickUrl(String token, String destination) {
        return baseUrl() + CLICK_PATH + token + "?url=" + URLEncoder.encode(destination, StandardCharsets.UTF_8);
    }

    public String openUrl(String token) {
        return baseUrl() + OPEN_PATH + token;
    }

    private boolean shouldTrack(String href) {
        if (href.isEmpty() || href.startsWith("#")) {
            return false;
        }
        String lower = href.toLowerCase();
        if (lower.startsWith("mailto:") || lower.startsWith("tel:")) {
            return false;
        }
        return !href.contains(CLICK_PATH);
    }

    private String baseUrl() {
        String base = properties.tracking().baseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
