module com.pulsewire.runner {
    exports com.pulsewire.runner;

    requires com.pulsewire.core;
    requires com.pulsewire.collectors;

    // Jackson
    requires com.fasterxml.jackson.databind;

    // Logging
    requires org.slf4j;
}
