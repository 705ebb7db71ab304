package io.rpcmeta.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.rpcmeta.core.config.DerivationConfig;
import io.rpcmeta.core.engine.reflect.ReflectiveInterfaceModel;
import io.rpcmeta.core.error.AggregatedDerivationException;
import io.rpcmeta.core.spi.ContextResolver;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Every derivation emits exactly one structured completion or failure entry.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private MetadataDeriver deriver;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger deriverLogger;

    @BeforeEach
    void setUp() {
        deriver = new MetadataDeriver(
                new ReflectiveInterfaceModel(),
                ContextResolver.EMPTY,
                DerivationConfig.builder().cacheEnabled(false).build());

        deriverLogger = (Logger) LoggerFactory.getLogger(MetadataDeriver.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        deriverLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        deriverLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<ILoggingEvent> events(Level level) {
        return logAppender.list.stream().filter(e -> e.getLevel() == level).toList();
    }

    @Test
    @DisplayName("Successful derivation logs derivation.completed at INFO")
    void successLogsCompletion() {
        deriver.derive(Fixtures.ApiMeta.class, Fixtures.UserApi.class);

        assertThat(events(Level.INFO)).singleElement().satisfies(event -> assertThat(event.getFormattedMessage())
                .startsWith("derivation.completed")
                .contains("schema=" + Fixtures.ApiMeta.class.getName())
                .contains("interface=" + Fixtures.UserApi.class.getName())
                .contains("methods=3")
                .contains("duration_ms="));
        assertThat(events(Level.WARN)).isEmpty();
    }

    @Test
    @DisplayName("Matching failure logs derivation.failed at WARN with the problem count")
    void matchingFailureLogsProblemCount() {
        assertThatThrownBy(() -> deriver.derive(Fixtures.RestMeta.class, Fixtures.TwoGets.class))
                .isInstanceOf(AggregatedDerivationException.class);

        assertThat(events(Level.WARN)).singleElement().satisfies(event -> assertThat(event.getFormattedMessage())
                .startsWith("derivation.failed")
                .contains("phase=MATCHING")
                .contains("problems=1"));
        assertThat(events(Level.INFO)).isEmpty();
    }

    @Test
    @DisplayName("Unresolved deferred lookup logs derivation.failed in the finalization phase")
    void finalizationFailureLogsPhase() {
        assertThatThrownBy(() -> deriver.derive(Fixtures.LazyClock.class, Fixtures.Empty.class))
                .isInstanceOf(AggregatedDerivationException.class);

        assertThat(events(Level.WARN)).singleElement().satisfies(event -> assertThat(event.getFormattedMessage())
                .contains("phase=FINALIZATION")
                .contains("detail=Cannot derive"));
    }
}
