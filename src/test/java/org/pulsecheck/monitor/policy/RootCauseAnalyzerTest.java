package org.pulsecheck.monitor.policy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RootCauseAnalyzerTest {

    @Test
    void chainHasFiveCausesAndRemediation() {
        List<String> chain = RootCauseAnalyzer.fiveWhys("postgres", "connection refused");

        assertThat(chain).hasSize(6);
        assertThat(chain.get(0)).startsWith("1. ").contains("'postgres'").endsWith("connection refused");
        for (int i = 1; i < 5; i++) {
            assertThat(chain.get(i)).startsWith((i + 1) + ". ");
        }
        assertThat(chain.get(5)).doesNotStartWith("6.").contains("database");
    }

    @Test
    void aliasesShareTemplates() {
        assertThat(RootCauseAnalyzer.fiveWhys("redis", "x").subList(1, 6))
            .isEqualTo(RootCauseAnalyzer.fiveWhys("cache", "x").subList(1, 6));
        assertThat(RootCauseAnalyzer.fiveWhys("db", "x").get(5))
            .isEqualTo(RootCauseAnalyzer.fiveWhys("database", "x").get(5));
    }

    @Test
    void unknownComponentGetsGenericChain() {
        List<String> chain = RootCauseAnalyzer.fiveWhys("payment_gateway", "HTTP 503");

        assertThat(chain).hasSize(6);
        assertThat(chain.get(0)).isEqualTo("1. Why is 'payment_gateway' failing? The health check reported: HTTP 503");
        assertThat(chain.get(5)).contains("payment_gateway");
    }

    @Test
    void missingMessageIsTolerated() {
        assertThat(RootCauseAnalyzer.fiveWhys("websocket", null).get(0)).endsWith("no error message");
        assertThat(RootCauseAnalyzer.fiveWhys("websocket", "  ").get(0)).endsWith("no error message");
    }

    @Test
    void chainIsDeterministic() {
        assertThat(RootCauseAnalyzer.fiveWhys("clickhouse", "timeout after 10s"))
            .isEqualTo(RootCauseAnalyzer.fiveWhys("clickhouse", "timeout after 10s"));
    }
}
