package com.adlanda.citedsearch.service.citation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamSessionTest {

    @Test
    void append_accumulatesDeltasInOrder() {
        StreamSession session = new StreamSession();

        session.append("Set it ");
        session.append(null);
        session.append("to 50 mbar");

        assertThat(session.current()).isEqualTo("Set it to 50 mbar");
        assertThat(session.isDone()).isFalse();
    }

    @Test
    void append_afterComplete_throwsException() {
        StreamSession session = new StreamSession();
        session.append("done");
        session.complete();

        assertThatThrownBy(() -> session.append("late"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(session.current()).isEqualTo("done");
    }

    @Test
    void fail_keepsPartialTextAndCause() {
        StreamSession session = new StreamSession();
        session.append("partial");
        RuntimeException cause = new RuntimeException("stream reset");

        session.fail(cause);

        assertThat(session.isDone()).isTrue();
        assertThat(session.current()).isEqualTo("partial");
        assertThat(session.error()).isSameAs(cause);
    }

    @Test
    void fail_afterComplete_isIgnored() {
        StreamSession session = new StreamSession();
        session.complete();

        session.fail(new RuntimeException("too late"));

        assertThat(session.error()).isNull();
    }
}
