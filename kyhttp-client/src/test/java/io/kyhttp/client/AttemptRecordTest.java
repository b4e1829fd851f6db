package io.kyhttp.client;

import io.kyhttp.core.RequestSpec;
import io.kyhttp.core.Response;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttemptRecordTest {

    private final RequestSpec spec = RequestSpec.get("http://localhost/").build();

    @Test
    void acceptedResponseEndsInAccepted() {
        AttemptRecord record = new AttemptRecord(3);

        assertThat(record.begin()).isEqualTo(1);
        assertThat(record.state()).isEqualTo(AttemptState.IN_FLIGHT);
        assertThat(record.complete(response(404))).isEqualTo(AttemptState.ACCEPTED);
        assertThat(record.state().isTerminal()).isTrue();
    }

    @Test
    void rejectedResponsesReturnToPendingUntilBudgetIsSpent() {
        AttemptRecord record = new AttemptRecord(2);

        record.begin();
        assertThat(record.complete(response(500))).isEqualTo(AttemptState.PENDING);
        assertThat(record.begin()).isEqualTo(2);
        assertThat(record.complete(Response.failed(spec, 2, new IOException("reset")))).isEqualTo(AttemptState.EXHAUSTED);
        assertThat(record.attempts()).isEqualTo(2);
    }

    @Test
    void singleAttemptBudgetExhaustsImmediately() {
        AttemptRecord record = new AttemptRecord(1);

        record.begin();

        assertThat(record.complete(response(502))).isEqualTo(AttemptState.EXHAUSTED);
    }

    @Test
    void rejectsOutOfOrderTransitions() {
        AttemptRecord record = new AttemptRecord(1);

        assertThatThrownBy(() -> record.complete(response(200))).isInstanceOf(IllegalStateException.class);
        record.begin();
        assertThatThrownBy(record::begin).isInstanceOf(IllegalStateException.class);
        record.complete(response(200));
        assertThatThrownBy(record::begin).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsEmptyBudget() {
        assertThatThrownBy(() -> new AttemptRecord(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private Response response(int status) {
        return new Response(spec, 1, status, null, null, null);
    }
}
