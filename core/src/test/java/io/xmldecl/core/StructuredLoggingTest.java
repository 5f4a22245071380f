package io.xmldecl.core;

import static io.xmldecl.core.Processors.array;
import static io.xmldecl.core.Processors.dictionary;
import static io.xmldecl.core.Processors.integer;
import static io.xmldecl.core.Processors.string;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.xmldecl.core.dom.DomDocuments;
import io.xmldecl.core.model.ArrayProcessor;
import io.xmldecl.core.model.Processor;
import io.xmldecl.core.spec.ProcessorSchemaParser;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Log entries use {@code event key=value} messages so they can be grepped and parsed. Loggers are
 * captured per class with a {@link ListAppender}.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private final List<Runnable> cleanup = new ArrayList<>();

    private ListAppender<ILoggingEvent> capture(Class<?> type, Level level) {
        Logger logger = (Logger) LoggerFactory.getLogger(type);
        Level previous = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(level);
        cleanup.add(() -> {
            logger.detachAppender(appender);
            logger.setLevel(previous);
            appender.stop();
        });
        return appender;
    }

    @AfterEach
    void tearDown() {
        cleanup.forEach(Runnable::run);
        cleanup.clear();
    }

    @Test
    @DisplayName("decode and encode log the root alias and duration at DEBUG")
    void mapperTimings() {
        ListAppender<ILoggingEvent> appender = capture(XmlMapper.class, Level.DEBUG);
        Processor processor = dictionary("point", integer("x"));

        Object value = XmlMapper.decode(processor, "<point><x>1</x></point>");
        XmlMapper.encode(processor, value);

        assertThat(appender.list).hasSize(2);
        assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender.list.get(0).getFormattedMessage()).matches("decode\\.completed root=point duration_us=\\d+");
        assertThat(appender.list.get(1).getFormattedMessage()).matches("encode\\.completed root=point duration_us=\\d+");
    }

    @Test
    @DisplayName("loading a processor schema logs its source at INFO")
    void schemaLoaded() {
        ListAppender<ILoggingEvent> appender = capture(ProcessorSchemaParser.class, Level.INFO);

        new ProcessorSchemaParser().parse("type: dictionary\npath: author\nchildren: []\n", "authors.yaml");

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("processor.schema.loaded source=authors.yaml root=author");
    }

    @Test
    @DisplayName("omitEmpty on an embedded array is ignored with a warning")
    void embeddedOmitEmptyWarns() {
        ListAppender<ILoggingEvent> appender = capture(ArrayProcessor.class, Level.WARN);

        array(string("tag").optional()).optional().omitEmpty();

        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains("embedded array 'tag'");
        });
    }

    @Test
    @DisplayName("namespace stripping reports the number of renamed nodes")
    void namespacesStripped() {
        ListAppender<ILoggingEvent> appender = capture(DomDocuments.class, Level.DEBUG);

        DomDocuments.parse("<a:root xmlns:a=\"urn:a\"><a:x>1</a:x></a:root>");

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("namespaces.stripped renamed_nodes=3");
    }

    @Test
    @DisplayName("nothing is logged above DEBUG on the decode path")
    void quietByDefault() {
        ListAppender<ILoggingEvent> appender = capture(XmlMapper.class, Level.INFO);

        XmlMapper.decode(dictionary("m", string("s")), "<m><s>v</s></m>");

        assertThat(appender.list).isEmpty();
    }
}
