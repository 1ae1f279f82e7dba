package io.apiclient.reactive;

import org.junit.jupiter.api.Test;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowInteropTest {

    @Test
    void bridgesFlowToReactiveStreams() throws Exception {
        SubmissionPublisher<String> source = new SubmissionPublisher<>();
        List<String> received = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        FlowInterop.toReactiveStreams(source).subscribe(new Subscriber<String>() {
            @Override
            public void onSubscribe(Subscription s) {
                s.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(String item) {
                received.add(item);
            }

            @Override
            public void onError(Throwable t) {
                done.countDown();
            }

            @Override
            public void onComplete() {
                done.countDown();
            }
        });
        source.submit("a");
        source.close();

        assertThat(done.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(received).containsExactly("a");
    }

    @Test
    void roundTripReturnsOriginalPublisher() {
        SubmissionPublisher<String> source = new SubmissionPublisher<>();

        assertThat(FlowInterop.toFlow(FlowInterop.toReactiveStreams(source))).isSameAs(source);
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> FlowInterop.toReactiveStreams(null)).isInstanceOf(NullPointerException.class);
    }
}
