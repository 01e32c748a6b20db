package com.forgeloop.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "forgeloop")
public class ForgeloopProperties {

    private Build build = new Build();
    private Roles roles = new Roles();
    private Webhooks webhooks = new Webhooks();
    private Knowledge knowledge = new Knowledge();

    public Build getBuild() { return build; }
    public void setBuild(Build build) { this.build = build; }
    public Roles getRoles() { return roles; }
    public void setRoles(Roles roles) { this.roles = roles; }
    public Webhooks getWebhooks() { return webhooks; }
    public void setWebhooks(Webhooks webhooks) { this.webhooks = webhooks; }
    public Knowledge getKnowledge() { return knowledge; }
    public void setKnowledge(Knowledge knowledge) { this.knowledge = knowledge; }

    public static class Build {
        /** Debug-and-retest cycles allowed per file before self-healing gives up. */
        private int maxDebugAttempts = 3;

        public int getMaxDebugAttempts() { return maxDebugAttempts; }
        public void setMaxDebugAttempts(int maxDebugAttempts) { this.maxDebugAttempts = maxDebugAttempts; }
    }

    /**
     * Path rules that route a file to the frontend coder; everything else goes to the backend coder.
     */
    public static class Roles {
        private List<String> frontendPathFragments = new ArrayList<>(List.of("src/components"));
        private List<String> frontendSuffixes = new ArrayList<>(List.of(".css", "tailwind.config.js"));

        public List<String> getFrontendPathFragments() { return frontendPathFragments; }
        public void setFrontendPathFragments(List<String> frontendPathFragments) { this.frontendPathFragments = frontendPathFragments; }
        public List<String> getFrontendSuffixes() { return frontendSuffixes; }
        public void setFrontendSuffixes(List<String> frontendSuffixes) { this.frontendSuffixes = frontendSuffixes; }
    }

    public static class Webhooks {
        private int historySize = 100;
        private int maxConcurrentDeliveries = 8;
        private int connectTimeoutSeconds = 5;
        private int requestTimeoutSeconds = 10;
        private String source = "sdlc-agent";

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }
        public int getMaxConcurrentDeliveries() { return maxConcurrentDeliveries; }
        public void setMaxConcurrentDeliveries(int maxConcurrentDeliveries) { this.maxConcurrentDeliveries = maxConcurrentDeliveries; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }
    }

    public static class Knowledge {
        private int maxSnippets = 3;
        private int maxEntries = 200;

        public int getMaxSnippets() { return maxSnippets; }
        public void setMaxSnippets(int maxSnippets) { this.maxSnippets = maxSnippets; }
        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    }
}
