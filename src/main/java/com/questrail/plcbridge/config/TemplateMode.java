package com.questrail.plcbridge.config;

/**
 * How structured (UDT) values are represented on the telemetry side.
 */
public enum TemplateMode
{
    /**
     * One template-instance metric per structured variable, plus one template
     * definition per template name.
     */
    NESTED,

    /**
     * One primitive metric per member, named {@code variableId/memberName}.
     */
    FLAT
}
