module com.tradelang.engine {
    requires transitive com.tradelang.core;
    requires org.slf4j;

    exports com.tradelang.engine;
}
