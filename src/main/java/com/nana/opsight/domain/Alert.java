package com.nana.opsight.domain;

import java.time.LocalDateTime;

/**
 * A raised alert, tied to the event, session and detection that caused it.
 */
public class Alert {

    private long id;
    private long eventId;
    private long sessionId;
    private long detectionId;
    private LocalDateTime alertTime;
    private int severity;
    private String category;
    private String description;

    public Alert() {
    }

    public Alert(long eventId, long sessionId, long detectionId,
                 int severity, String category, String description) {
        this.eventId     = eventId;
        this.sessionId   = sessionId;
        this.detectionId = detectionId;
        this.severity    = severity;
        this.category    = category;
        this.description = description;
    }

    public long getId()                         { return id; }
    public void setId(long id)                  { this.id = id; }
    public long getEventId()                    { return eventId; }
    public void setEventId(long eventId)        { this.eventId = eventId; }
    public long getSessionId()                  { return sessionId; }
    public void setSessionId(long sessionId)    { this.sessionId = sessionId; }
    public long getDetectionId()                { return detectionId; }
    public void setDetectionId(long v)          { this.detectionId = v; }
    /** @return when the alert was raised; null until stored if not set */
    public LocalDateTime getAlertTime()         { return alertTime; }
    public void setAlertTime(LocalDateTime v)   { this.alertTime = v; }
    public int getSeverity()                    { return severity; }
    public void setSeverity(int severity)       { this.severity = severity; }
    public String getCategory()                 { return category; }
    public void setCategory(String category)    { this.category = category; }
    public String getDescription()              { return description; }
    public void setDescription(String v)        { this.description = v; }

    @Override
    public String toString() {
        return "Alert{id=" + id + ", session=" + sessionId + ", severity=" + severity
               + ", category='" + category + "'}";
    }
}
