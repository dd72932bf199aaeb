package io.fetch4j.extract;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings shared by the fetch strategies.
 */
public class ExtractorProperties {
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";

    private String userAgent = DEFAULT_USER_AGENT;
    private Duration timeout = Duration.ofSeconds(30);
    private Duration readyWait = Duration.ofSeconds(5);
    private Duration renderSettle = Duration.ofSeconds(2);
    private boolean headless = true;
    private int maxLinks = 10;
    private int maxImages = 10;
    private List<String> contentSelectors = new ArrayList<>(List.of(
            "main",
            "article",
            ".content",
            ".main-content",
            "#content",
            "#main",
            ".post-content",
            ".entry-content"
    ));

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getReadyWait() {
        return readyWait;
    }

    public void setReadyWait(Duration readyWait) {
        this.readyWait = readyWait;
    }

    public Duration getRenderSettle() {
        return renderSettle;
    }

    public void setRenderSettle(Duration renderSettle) {
        this.renderSettle = renderSettle;
    }

    public boolean isHeadless() {
        return headless;
    }

    public void setHeadless(boolean headless) {
        this.headless = headless;
    }

    public int getMaxLinks() {
        return maxLinks;
    }

    public void setMaxLinks(int maxLinks) {
        this.maxLinks = maxLinks;
    }

    public int getMaxImages() {
        return maxImages;
    }

    public void setMaxImages(int maxImages) {
        this.maxImages = maxImages;
    }

    public List<String> getContentSelectors() {
        return contentSelectors;
    }

    public void setContentSelectors(List<String> contentSelectors) {
        this.contentSelectors = contentSelectors;
    }
}
