package com.nana.opsight.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Join row between an {@link Alert} and a {@link CtiObject}; keyed by both ids.
 */
public class AlertCtiLink {

    private long alertId;
    private long ctiId;
    private String matchReason;
    private LocalDateTime createdAt;

    public AlertCtiLink() {
    }

    public AlertCtiLink(long alertId, long ctiId, String matchReason) {
        this.alertId     = alertId;
        this.ctiId       = ctiId;
        this.matchReason = matchReason;
    }

    public long getAlertId()                  { return alertId; }
    public void setAlertId(long alertId)      { this.alertId = alertId; }
    public long getCtiId()                    { return ctiId; }
    public void setCtiId(long ctiId)          { this.ctiId = ctiId; }
    public String getMatchReason()            { return matchReason; }
    public void setMatchReason(String v)      { this.matchReason = v; }
    public LocalDateTime getCreatedAt()       { return createdAt; }
    public void setCreatedAt(LocalDateTime v) { this.createdAt = v; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlertCtiLink other)) return false;
        return alertId == other.alertId && ctiId == other.ctiId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertId, ctiId);
    }

    @Override
    public String toString() {
        return "AlertCtiLink{alert=" + alertId + ", cti=" + ctiId + ", reason='" + matchReason + "'}";
    }
}
