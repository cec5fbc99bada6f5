module dev.mars.contentflow.core {
    requires org.slf4j;
    requires transitive com.fasterxml.jackson.annotation;
    requires transitive com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;

    exports dev.mars.contentflow.model;
    exports dev.mars.contentflow.exceptions;
    exports dev.mars.contentflow.agent;
    exports dev.mars.contentflow.config;
    exports dev.mars.contentflow.storage;

    // Jackson reads and writes the persisted run records reflectively
    opens dev.mars.contentflow.model to com.fasterxml.jackson.databind;
    opens dev.mars.contentflow.storage to com.fasterxml.jackson.databind;
}
