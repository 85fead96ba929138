package com.nana.opsight.domain;

import java.time.LocalDateTime;

/**
 * The verdict of one anomaly model for one event, scored against one baseline.
 *
 * <p>At most one detection exists per (event, baseline, model type).
 */
public class Detection {

    private long id;
    private long eventId;
    private long baselineId;
    private String modelType;
    private double anomalyScore;
    private double threshold;
    private String evidenceJson;
    private String predictedLabel;
    private LocalDateTime detectionTime;

    public Detection() {
    }

    public Detection(long eventId, long baselineId, String modelType,
                     double anomalyScore, double threshold,
                     String evidenceJson, String predictedLabel) {
        this.eventId        = eventId;
        this.baselineId     = baselineId;
        this.modelType      = modelType;
        this.anomalyScore   = anomalyScore;
        this.threshold      = threshold;
        this.evidenceJson   = evidenceJson;
        this.predictedLabel = predictedLabel;
    }

    public long getId()                           { return id; }
    public void setId(long id)                    { this.id = id; }
    public long getEventId()                      { return eventId; }
    public void setEventId(long eventId)          { this.eventId = eventId; }
    public long getBaselineId()                   { return baselineId; }
    public void setBaselineId(long baselineId)    { this.baselineId = baselineId; }
    public String getModelType()                  { return modelType; }
    public void setModelType(String modelType)    { this.modelType = modelType; }
    public double getAnomalyScore()               { return anomalyScore; }
    public void setAnomalyScore(double v)         { this.anomalyScore = v; }
    public double getThreshold()                  { return threshold; }
    public void setThreshold(double threshold)    { this.threshold = threshold; }
    public String getEvidenceJson()               { return evidenceJson; }
    public void setEvidenceJson(String v)         { this.evidenceJson = v; }
    public String getPredictedLabel()             { return predictedLabel; }
    public void setPredictedLabel(String v)       { this.predictedLabel = v; }
    public LocalDateTime getDetectionTime()       { return detectionTime; }
    public void setDetectionTime(LocalDateTime v) { this.detectionTime = v; }

    public boolean isAnomalous() {
        return anomalyScore >= threshold;
    }

    @Override
    public String toString() {
        return "Detection{id=" + id + ", event=" + eventId + ", baseline=" + baselineId
               + ", model='" + modelType + "', score=" + anomalyScore + "}";
    }
}
