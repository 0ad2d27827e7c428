package org.seisview.node.processes;

import org.seisview.node.spi.IProcess;
import org.seisview.node.spi.ServiceRegistry;

import com.typesafe.config.Config;

/**
 * Base class for processes configured by name with an {@code options} block and access to the
 * shared {@link ServiceRegistry}.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final ServiceRegistry registry;
    protected final Config options;

    protected AbstractProcess(final String processName, final ServiceRegistry registry, final Config options) {
        this.processName = processName;
        this.registry = registry;
        this.options = options;
    }

    public String getProcessName() {
        return processName;
    }
}
