package com.nana.opsight.domain;

import java.time.LocalDateTime;

/**
 * A cyber-threat-intelligence artifact: a technique, an indicator or a rule.
 *
 * <p>{@code externalId} is the identifier in the source catalogue
 * (for example an ATT&amp;CK for ICS technique id).
 */
public class CtiObject {

    private long id;
    private String type;
    private String name;
    private String externalId;
    private String rule;
    private Integer confidence;
    private LocalDateTime createdAt;

    public CtiObject() {
    }

    public CtiObject(String type, String name, String externalId,
                     String rule, Integer confidence) {
        this.type       = type;
        this.name       = name;
        this.externalId = externalId;
        this.rule       = rule;
        this.confidence = confidence;
    }

    public long getId()                       { return id; }
    public void setId(long id)                { this.id = id; }
    public String getType()                   { return type; }
    public void setType(String type)          { this.type = type; }
    public String getName()                   { return name; }
    public void setName(String name)          { this.name = name; }
    public String getExternalId()             { return externalId; }
    public void setExternalId(String v)       { this.externalId = v; }
    public String getRule()                   { return rule; }
    public void setRule(String rule)          { this.rule = rule; }
    public Integer getConfidence()            { return confidence; }
    public void setConfidence(Integer v)      { this.confidence = v; }
    public LocalDateTime getCreatedAt()       { return createdAt; }
    public void setCreatedAt(LocalDateTime v) { this.createdAt = v; }

    @Override
    public String toString() {
        return "CtiObject{id=" + id + ", type='" + type + "', name='" + name
               + "', externalId=" + externalId + "}";
    }
}
