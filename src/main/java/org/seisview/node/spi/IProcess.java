package org.seisview.node.spi;

/**
 * A long-running component with an explicit lifecycle.
 */
public interface IProcess {

    /**
     * Starts the process. Must return once the process is serving.
     */
    void start();

    /**
     * Stops the process and releases its resources. Calling it on a stopped process is a no-op.
     */
    void stop();
}
