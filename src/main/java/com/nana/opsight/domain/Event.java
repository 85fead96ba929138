package com.nana.opsight.domain;

import java.time.LocalDateTime;

/**
 * Event - one ICS command or response observed within a session.
 *
 * <p>Carries the Modbus-level protocol fields (address, function code, CRC,
 * data length) together with the process state at that instant (pump and
 * solenoid state, set point, pipeline pressure, PID parameters and their
 * deltas) and the ground-truth label of the export.
 *
 * <p>All measurement fields are boxed. A field that was not supplied stays
 * null and is bound as SQL NULL, which the store rejects, so an incomplete
 * event can never be stored with invented values.
 *
 * <p>{@code sourceRow} is the 1-based data-row number in the file the event
 * was loaded from; it is null for events written by other means.
 */
public class Event {

    private long id;
    private Long sessionId;
    private String operatorId;
    private LocalDateTime timestamp;

    private Double timeInterval;
    private String address;
    private String functionCode;
    private String commandResponse;
    private String controlMode;
    private String controlScheme;
    private Integer crc;
    private Integer dataLength;
    private String invalidFunctionCode;
    private String invalidDataLength;
    private String pumpState;
    private String solenoidState;

    private Double setPoint;
    private Double pipelinePsi;
    private Double pidCycleTime;
    private Double pidDeadband;
    private Double pidGain;
    private Double pidRate;
    private Double pidReset;

    private Double deltaSetPoint;
    private Double deltaPipelinePsi;
    private Double deltaPidCycleTime;
    private Double deltaPidDeadband;
    private Double deltaPidGain;
    private Double deltaPidRate;
    private Double deltaPidReset;

    private String label;
    private Integer sourceRow;

    public Event() {
    }

    // -----------------------------------------------------------------------
    // IDENTITY AND OWNERSHIP
    // -----------------------------------------------------------------------

    public long getId()                          { return id; }
    public void setId(long id)                   { this.id = id; }
    public Long getSessionId()                   { return sessionId; }
    public void setSessionId(Long sessionId)     { this.sessionId = sessionId; }
    public String getOperatorId()                { return operatorId; }
    public void setOperatorId(String operatorId) { this.operatorId = operatorId; }
    public LocalDateTime getTimestamp()          { return timestamp; }
    public void setTimestamp(LocalDateTime v)    { this.timestamp = v; }
    public Integer getSourceRow()                { return sourceRow; }
    public void setSourceRow(Integer sourceRow)  { this.sourceRow = sourceRow; }

    // -----------------------------------------------------------------------
    // PROTOCOL FIELDS
    // -----------------------------------------------------------------------

    public Double getTimeInterval()              { return timeInterval; }
    public void setTimeInterval(Double v)        { this.timeInterval = v; }
    public String getAddress()                   { return address; }
    public void setAddress(String v)             { this.address = v; }
    public String getFunctionCode()              { return functionCode; }
    public void setFunctionCode(String v)        { this.functionCode = v; }
    public String getCommandResponse()           { return commandResponse; }
    public void setCommandResponse(String v)     { this.commandResponse = v; }
    public String getControlMode()               { return controlMode; }
    public void setControlMode(String v)         { this.controlMode = v; }
    public String getControlScheme()             { return controlScheme; }
    public void setControlScheme(String v)       { this.controlScheme = v; }
    public Integer getCrc()                      { return crc; }
    public void setCrc(Integer v)                { this.crc = v; }
    public Integer getDataLength()               { return dataLength; }
    public void setDataLength(Integer v)         { this.dataLength = v; }
    public String getInvalidFunctionCode()       { return invalidFunctionCode; }
    public void setInvalidFunctionCode(String v) { this.invalidFunctionCode = v; }
    public String getInvalidDataLength()         { return invalidDataLength; }
    public void setInvalidDataLength(String v)   { this.invalidDataLength = v; }
    public String getPumpState()                 { return pumpState; }
    public void setPumpState(String v)           { this.pumpState = v; }
    public String getSolenoidState()             { return solenoidState; }
    public void setSolenoidState(String v)       { this.solenoidState = v; }

    // -----------------------------------------------------------------------
    // PROCESS STATE
    // -----------------------------------------------------------------------

    public Double getSetPoint()                  { return setPoint; }
    public void setSetPoint(Double v)            { this.setPoint = v; }
    public Double getPipelinePsi()               { return pipelinePsi; }
    public void setPipelinePsi(Double v)         { this.pipelinePsi = v; }
    public Double getPidCycleTime()              { return pidCycleTime; }
    public void setPidCycleTime(Double v)        { this.pidCycleTime = v; }
    public Double getPidDeadband()               { return pidDeadband; }
    public void setPidDeadband(Double v)         { this.pidDeadband = v; }
    public Double getPidGain()                   { return pidGain; }
    public void setPidGain(Double v)             { this.pidGain = v; }
    public Double getPidRate()                   { return pidRate; }
    public void setPidRate(Double v)             { this.pidRate = v; }
    public Double getPidReset()                  { return pidReset; }
    public void setPidReset(Double v)            { this.pidReset = v; }

    public Double getDeltaSetPoint()             { return deltaSetPoint; }
    public void setDeltaSetPoint(Double v)       { this.deltaSetPoint = v; }
    public Double getDeltaPipelinePsi()          { return deltaPipelinePsi; }
    public void setDeltaPipelinePsi(Double v)    { this.deltaPipelinePsi = v; }
    public Double getDeltaPidCycleTime()         { return deltaPidCycleTime; }
    public void setDeltaPidCycleTime(Double v)   { this.deltaPidCycleTime = v; }
    public Double getDeltaPidDeadband()          { return deltaPidDeadband; }
    public void setDeltaPidDeadband(Double v)    { this.deltaPidDeadband = v; }
    public Double getDeltaPidGain()              { return deltaPidGain; }
    public void setDeltaPidGain(Double v)        { this.deltaPidGain = v; }
    public Double getDeltaPidRate()              { return deltaPidRate; }
    public void setDeltaPidRate(Double v)        { this.deltaPidRate = v; }
    public Double getDeltaPidReset()             { return deltaPidReset; }
    public void setDeltaPidReset(Double v)       { this.deltaPidReset = v; }

    public String getLabel()                     { return label; }
    public void setLabel(String label)           { this.label = label; }

    @Override
    public String toString() {
        return "Event{id=" + id + ", session=" + sessionId + ", operator='" + operatorId
               + "', at=" + timestamp + ", fc=" + functionCode + ", label=" + label + "}";
    }
}
