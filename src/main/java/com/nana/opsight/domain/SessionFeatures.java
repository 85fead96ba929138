package com.nana.opsight.domain;

import java.time.LocalDateTime;

/**
 * Behavioural features computed for exactly one session.
 *
 * <p>Produced by the feature-extraction stage; stored here unchanged.
 */
public class SessionFeatures {

    private long id;
    private long sessionId;
    private LocalDateTime createdAt;

    private double commandFrequency;
    private double interCommandMean;
    private double interCommandStd;
    private double commandBurstRate;
    private double controlModeChangeRate;
    private double highRiskCommandRatio;
    private double invalidCommandRate;
    private double pumpStateChangeRate;
    private double setPointShockEventRate;
    private double pidModificationRate;
    private double commandEntropy;
    private double processCommandCorrelation;

    public SessionFeatures() {
    }

    public SessionFeatures(long sessionId) {
        this.sessionId = sessionId;
    }

    public long getId()                              { return id; }
    public void setId(long id)                       { this.id = id; }
    public long getSessionId()                       { return sessionId; }
    public void setSessionId(long sessionId)         { this.sessionId = sessionId; }
    public LocalDateTime getCreatedAt()              { return createdAt; }
    public void setCreatedAt(LocalDateTime v)        { this.createdAt = v; }

    public double getCommandFrequency()              { return commandFrequency; }
    public void setCommandFrequency(double v)        { this.commandFrequency = v; }
    public double getInterCommandMean()              { return interCommandMean; }
    public void setInterCommandMean(double v)        { this.interCommandMean = v; }
    public double getInterCommandStd()               { return interCommandStd; }
    public void setInterCommandStd(double v)         { this.interCommandStd = v; }
    public double getCommandBurstRate()              { return commandBurstRate; }
    public void setCommandBurstRate(double v)        { this.commandBurstRate = v; }
    public double getControlModeChangeRate()         { return controlModeChangeRate; }
    public void setControlModeChangeRate(double v)   { this.controlModeChangeRate = v; }
    public double getHighRiskCommandRatio()          { return highRiskCommandRatio; }
    public void setHighRiskCommandRatio(double v)    { this.highRiskCommandRatio = v; }
    public double getInvalidCommandRate()            { return invalidCommandRate; }
    public void setInvalidCommandRate(double v)      { this.invalidCommandRate = v; }
    public double getPumpStateChangeRate()           { return pumpStateChangeRate; }
    public void setPumpStateChangeRate(double v)     { this.pumpStateChangeRate = v; }
    public double getSetPointShockEventRate()        { return setPointShockEventRate; }
    public void setSetPointShockEventRate(double v)  { this.setPointShockEventRate = v; }
    public double getPidModificationRate()           { return pidModificationRate; }
    public void setPidModificationRate(double v)     { this.pidModificationRate = v; }
    public double getCommandEntropy()                { return commandEntropy; }
    public void setCommandEntropy(double v)          { this.commandEntropy = v; }
    public double getProcessCommandCorrelation()     { return processCommandCorrelation; }
    public void setProcessCommandCorrelation(double v) { this.processCommandCorrelation = v; }

    @Override
    public String toString() {
        return "SessionFeatures{id=" + id + ", session=" + sessionId
               + ", frequency=" + commandFrequency + ", entropy=" + commandEntropy + "}";
    }
}
