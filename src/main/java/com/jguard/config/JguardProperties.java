package com.jguard.config;

import com.jguard.filtering.list.FilterListDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "jguard")
public class JguardProperties {

    private DiscordProperties discord = new DiscordProperties();
    private FilteringProperties filtering = new FilteringProperties();
    private SecurityProperties security = new SecurityProperties();

    public DiscordProperties getDiscord() { return discord; }
    public void setDiscord(DiscordProperties discord) { this.discord = discord; }

    public FilteringProperties getFiltering() { return filtering; }
    public void setFiltering(FilteringProperties filtering) { this.filtering = filtering; }

    public SecurityProperties getSecurity() { return security; }
    public void setSecurity(SecurityProperties security) { this.security = security; }

    public static class DiscordProperties {
        private String guildId;
        private String voiceVerifiedRoleId;
        private List<String> superstarNames = new ArrayList<>(List.of(
                "Ada Lovelace", "Grace Hopper", "Alan Turing", "Margaret Hamilton", "Dennis Ritchie"));

        public String getGuildId() { return guildId; }
        public void setGuildId(String guildId) { this.guildId = guildId; }
        public String getVoiceVerifiedRoleId() { return voiceVerifiedRoleId; }
        public void setVoiceVerifiedRoleId(String voiceVerifiedRoleId) { this.voiceVerifiedRoleId = voiceVerifiedRoleId; }
        public List<String> getSuperstarNames() { return superstarNames; }
        public void setSuperstarNames(List<String> superstarNames) { this.superstarNames = superstarNames; }
    }

    public static class FilteringProperties {
        private String alertChannelId;
        private String modAlertsChannelId;
        private int alertMaxLength = 4000;
        private int alertColour = 0xDE965C;
        private List<FilterListDefinition> lists = new ArrayList<>();

        public String getAlertChannelId() { return alertChannelId; }
        public void setAlertChannelId(String alertChannelId) { this.alertChannelId = alertChannelId; }
        public String getModAlertsChannelId() { return modAlertsChannelId; }
        public void setModAlertsChannelId(String modAlertsChannelId) { this.modAlertsChannelId = modAlertsChannelId; }
        public int getAlertMaxLength() { return alertMaxLength; }
        public void setAlertMaxLength(int alertMaxLength) { this.alertMaxLength = alertMaxLength; }
        public int getAlertColour() { return alertColour; }
        public void setAlertColour(int alertColour) { this.alertColour = alertColour; }
        public List<FilterListDefinition> getLists() { return lists; }
        public void setLists(List<FilterListDefinition> lists) { this.lists = lists; }
    }

    public static class SecurityProperties {
        private DataRetentionProperties dataRetention = new DataRetentionProperties();
        private PiiProperties pii = new PiiProperties();

        public DataRetentionProperties getDataRetention() { return dataRetention; }
        public void setDataRetention(DataRetentionProperties dataRetention) { this.dataRetention = dataRetention; }
        public PiiProperties getPii() { return pii; }
        public void setPii(PiiProperties pii) { this.pii = pii; }
    }

    public static class DataRetentionProperties {
        private int auditLogDays = 365;

        public int getAuditLogDays() { return auditLogDays; }
        public void setAuditLogDays(int d) { this.auditLogDays = d; }
    }

    public static class PiiProperties {
        private boolean redactInLogs = true;
        private List<String> redactPatterns = new ArrayList<>();

        public boolean isRedactInLogs() { return redactInLogs; }
        public void setRedactInLogs(boolean redactInLogs) { this.redactInLogs = redactInLogs; }
        public List<String> getRedactPatterns() { return redactPatterns; }
        public void setRedactPatterns(List<String> redactPatterns) { this.redactPatterns = redactPatterns; }
    }
}
