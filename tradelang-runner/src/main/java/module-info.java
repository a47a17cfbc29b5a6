module com.tradelang.runner {
    // Internal modules
    requires transitive com.tradelang.core;
    requires com.tradelang.engine;

    // Data/IO
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;
    requires com.fasterxml.jackson.dataformat.yaml;
    requires okhttp3;

    // Logging
    requires org.slf4j;

    // Exports
    exports com.tradelang.runner;
    exports com.tradelang.runner.config;
    exports com.tradelang.runner.data;
    exports com.tradelang.runner.report;
    exports com.tradelang.runner.translate;

    // Jackson reflection access
    opens com.tradelang.runner.data to com.fasterxml.jackson.databind;
    opens com.tradelang.runner.report to com.fasterxml.jackson.databind;
    opens com.tradelang.runner.translate to com.fasterxml.jackson.databind;
}
