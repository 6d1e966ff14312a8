package com.jguard.filtering.action;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configured actions of a filter or a filter list, bound from
 * {@code jguard.filtering.lists[*].defaults} and {@code ...filters[*].actions}.
 */
public class ActionSettings {

    private String infractionType;
    private String infractionReason = "";
    private Duration infractionDuration;
    private String dmContent = "";
    private String dmEmbed = "";
    private SuperstarSettings superstar;
    private Boolean sendAlert;
    private List<String> pings = new ArrayList<>();

    public ActionSettings() {}

    public String getInfractionType() { return infractionType; }
    public void setInfractionType(String infractionType) { this.infractionType = infractionType; }
    public String getInfractionReason() { return infractionReason; }
    public void setInfractionReason(String infractionReason) { this.infractionReason = infractionReason; }
    public Duration getInfractionDuration() { return infractionDuration; }
    public void setInfractionDuration(Duration infractionDuration) { this.infractionDuration = infractionDuration; }
    public String getDmContent() { return dmContent; }
    public void setDmContent(String dmContent) { this.dmContent = dmContent; }
    public String getDmEmbed() { return dmEmbed; }
    public void setDmEmbed(String dmEmbed) { this.dmEmbed = dmEmbed; }
    public SuperstarSettings getSuperstar() { return superstar; }
    public void setSuperstar(SuperstarSettings superstar) { this.superstar = superstar; }
    public Boolean getSendAlert() { return sendAlert; }
    public void setSendAlert(Boolean sendAlert) { this.sendAlert = sendAlert; }
    public List<String> getPings() { return pings; }
    public void setPings(List<String> pings) { this.pings = pings; }

    public static class SuperstarSettings {
        private String reason = "";
        private Duration duration;

        public String getReason() { return reason; }
        public void setReason(String reason) { this.reason = reason; }
        public Duration getDuration() { return duration; }
        public void setDuration(Duration duration) { this.duration = duration; }
    }
}
