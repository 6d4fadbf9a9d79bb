module com.pulsewire.core {
    // Exports
    exports com.pulsewire.core.availability;
    exports com.pulsewire.core.cache;
    exports com.pulsewire.core.collector;
    exports com.pulsewire.core.config;
    exports com.pulsewire.core.coordinator;
    exports com.pulsewire.core.json;
    exports com.pulsewire.core.model;
    exports com.pulsewire.core.pipeline;
    exports com.pulsewire.core.report;
    exports com.pulsewire.core.run;
    exports com.pulsewire.core.trace;

    // Jackson
    requires transitive com.fasterxml.jackson.databind;
    requires transitive com.fasterxml.jackson.annotation;
    requires com.fasterxml.jackson.datatype.jsr310;
    requires com.fasterxml.jackson.dataformat.yaml;

    // Logging
    requires org.slf4j;

    // Jackson reflection access
    opens com.pulsewire.core.config to com.fasterxml.jackson.databind;
    opens com.pulsewire.core.model to com.fasterxml.jackson.databind;
    opens com.pulsewire.core.report to com.fasterxml.jackson.databind;
    opens com.pulsewire.core.trace to com.fasterxml.jackson.databind;
}
