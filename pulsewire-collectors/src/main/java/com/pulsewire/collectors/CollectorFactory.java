package com.pulsewire.collectors;

import com.pulsewire.core.collector.Collector;
import com.pulsewire.core.config.CollectorRegistration;

/**
 * Builds a collector from its registration.
 */
@FunctionalInterface
public interface CollectorFactory {

    Collector create(CollectorRegistration registration);
}
