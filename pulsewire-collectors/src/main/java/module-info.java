module com.pulsewire.collectors {
    // Exports
    exports com.pulsewire.collectors;
    exports com.pulsewire.collectors.http;
    exports com.pulsewire.collectors.rss;
    exports com.pulsewire.collectors.news;
    exports com.pulsewire.collectors.financial;
    exports com.pulsewire.collectors.social;
    exports com.pulsewire.collectors.web;

    requires transitive com.pulsewire.core;

    // Jackson
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;

    // HTTP & parsing
    requires okhttp3;
    requires com.rometools.rome;
    requires org.jsoup;

    // Logging
    requires org.slf4j;

    // Jackson reflection access
    opens com.pulsewire.collectors.web to com.fasterxml.jackson.databind;
}
