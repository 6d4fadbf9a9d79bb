package com.pulsewire.core.report;

/**
 * Consumes a finished run. Rendering and delivery channels live behind this interface.
 */
public interface ReportSink {

    /** Channel name recorded in the trace, e.g. "json" or "email". */
    String channel();

    void deliver(RunReport report) throws DeliveryException;
}
