package com.nana.opsight.service;

/**
 * Stages one chunk passes through during a load, in order. A failure at any
 * stage before {@link #COMMITTED} rolls back that chunk only.
 */
public enum ChunkState {

    /** Records read from the file. */
    READ,

    /** Identifying fields parsed; unusable rows dropped; payload converted. */
    NORMALIZED,

    /** Sessions derived and every shift label recognised. */
    VALIDATED,

    /** Missing operators and sessions inserted. */
    REFERENCES_RESOLVED,

    /** Events inserted as one batch. */
    INSERTED,

    /** Transaction committed. */
    COMMITTED
}
