package com.nana.opsight.domain;

import java.time.LocalDateTime;

/**
 * A trained behavioural baseline for one operator, optionally scoped to a shift.
 *
 * <p>The profile itself is an opaque JSON document owned by the model that
 * produced it. (operator, shift, version) is unique.
 */
public class BaselineProfile {

    private long id;
    private String operatorId;
    private Long shiftId;
    private String version;
    private LocalDateTime trainedFrom;
    private LocalDateTime trainedTo;
    private String profileJson;
    private LocalDateTime createdAt;

    public BaselineProfile() {
    }

    public BaselineProfile(String operatorId, Long shiftId, String version,
                           LocalDateTime trainedFrom, LocalDateTime trainedTo,
                           String profileJson) {
        this.operatorId  = operatorId;
        this.shiftId     = shiftId;
        this.version     = version;
        this.trainedFrom = trainedFrom;
        this.trainedTo   = trainedTo;
        this.profileJson = profileJson;
    }

    public long getId()                         { return id; }
    public void setId(long id)                  { this.id = id; }
    public String getOperatorId()               { return operatorId; }
    public void setOperatorId(String v)         { this.operatorId = v; }
    /** @return the shift this baseline is scoped to, or null for all shifts */
    public Long getShiftId()                    { return shiftId; }
    public void setShiftId(Long shiftId)        { this.shiftId = shiftId; }
    public String getVersion()                  { return version; }
    public void setVersion(String version)      { this.version = version; }
    public LocalDateTime getTrainedFrom()       { return trainedFrom; }
    public void setTrainedFrom(LocalDateTime v) { this.trainedFrom = v; }
    public LocalDateTime getTrainedTo()         { return trainedTo; }
    public void setTrainedTo(LocalDateTime v)   { this.trainedTo = v; }
    public String getProfileJson()              { return profileJson; }
    public void setProfileJson(String v)        { this.profileJson = v; }
    public LocalDateTime getCreatedAt()         { return createdAt; }
    public void setCreatedAt(LocalDateTime v)   { this.createdAt = v; }

    @Override
    public String toString() {
        return "BaselineProfile{id=" + id + ", operator='" + operatorId + "', shift=" + shiftId
               + ", version='" + version + "'}";
    }
}
