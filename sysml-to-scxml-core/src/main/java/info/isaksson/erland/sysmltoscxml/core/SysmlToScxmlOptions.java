package info.isaksson.erland.sysmltoscxml.core;

import info.isaksson.erland.sysmltoscxml.model.SysmlElementKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Core (server-friendly) options for sysml-to-scxml conversion.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class SysmlToScxmlOptions {
    /**
     * Name of the state definition to convert. {@code null} selects the only state definition in
     * the model.
     */
    public String stateMachineName = null;

    /** Element kinds that count as event definitions when resolving transition event names. */
    public Set<SysmlElementKind> eventDefinitionKinds = EnumSet.of(SysmlElementKind.ATTRIBUTE_DEFINITION);

    /**
     * If true, callers may treat conversion warnings as an error condition.
     * (Core does not throw on warnings; this is for upstream policy.)
     */
    public boolean failOnWarnings = false;
}
