/**
 * Ports between the dispatch core and its collaborators.
 * <p><strong>Role:</strong> {@link ca.gc.cra.clicore.application.port.CommandFactory} and
 * {@link ca.gc.cra.clicore.application.port.OutputSink} are supplied by the host; middleware and validators plug
 * into the pipeline.</p>
 * <p><strong>Concurrency:</strong> Ports are invoked from the single invocation thread.</p>
 */
package ca.gc.cra.clicore.application.port;
