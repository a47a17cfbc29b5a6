module com.tradelang.core {
    // Exports - all public packages
    exports com.tradelang.core.dsl;
    exports com.tradelang.core.indicators;
    exports com.tradelang.core.model;

    // Jackson (for AST and model serialization)
    requires transitive com.fasterxml.jackson.databind;
    requires transitive com.fasterxml.jackson.annotation;

    // Logging
    requires org.slf4j;

    // Jackson needs reflection access to the AST and models
    opens com.tradelang.core.dsl to com.fasterxml.jackson.databind;
    opens com.tradelang.core.model to com.fasterxml.jackson.databind;
}
