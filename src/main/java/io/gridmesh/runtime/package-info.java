/**
 * Process wiring.
 *
 * <p>{@link io.gridmesh.runtime.GridMeshNode} assembles the journal, job queue, resource
 * registry, matcher, dispatcher and TLS endpoint, and runs the periodic maintenance that
 * evicts silent resources, refreshes configuration and reloads TLS material.
 */
package io.gridmesh.runtime;
