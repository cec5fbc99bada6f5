module dev.mars.contentflow.workflow {
    requires transitive dev.mars.contentflow.core;
    requires org.slf4j;

    // Third-party libraries used in main sources
    requires org.yaml.snakeyaml;
    requires io.opentelemetry.api;

    exports dev.mars.contentflow.workflow;
    exports dev.mars.contentflow.workflow.engine;
    exports dev.mars.contentflow.workflow.observability;
}
