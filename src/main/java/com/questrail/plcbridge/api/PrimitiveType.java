package com.questrail.plcbridge.api;

/**
 * PrimitiveType
 * -----------------------------------------------------------------------------
 * Metric datatype as seen by the telemetry protocol.
 *
 * <p>The bridge only ever produces these four representations. Numbers are
 * always published as {@link #DOUBLE} for maximum precision; structured values
 * are either a {@link #TEMPLATE} instance (nested mode) or, when no template is
 * known, a {@link #STRING} carrying their JSON rendering.</p>
 *
 * <p>A change of a variable's {@code PrimitiveType} is a schema change and
 * requires a full re-announcement.</p>
 */
public enum PrimitiveType
{
    DOUBLE,
    BOOLEAN,
    STRING,
    TEMPLATE
}
