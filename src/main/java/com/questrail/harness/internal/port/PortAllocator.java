package com.questrail.harness.internal.port;

/**
 * Source of candidate TCP ports for the service under test.
 *
 * <p>Implementations hold no state between calls and may be called
 * concurrently by independent supervisors.</p>
 */
@FunctionalInterface
public interface PortAllocator
{
    /**
     * Return a port that is unbound at the instant of the call.
     *
     * <p>The result is best effort: another process, or the OS, may take the
     * port before the child binds it. Callers absorb that race by retrying on
     * a fresh port.</p>
     */
    int allocate();
}
