package io.github.kusoroadeolu.oneshot.demo;

import io.github.kusoroadeolu.oneshot.FutureError;
import io.github.kusoroadeolu.oneshot.FutureState;
import io.github.kusoroadeolu.oneshot.ValueHolder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

class RequestResponseDemoTest {

    @Test
    @Timeout(5)
    void exchange_workerRespondsInTime_returnsDoubledOperand() throws InterruptedException {
        var request = new RequestResponseDemo.Request(21);
        var worker = new Thread(() -> RequestResponseDemo.serve(request, 50));
        worker.start();

        var result = ValueHolder.of(Integer.class);
        assertEquals(FutureError.SUCCESS, RequestResponseDemo.exchange(request, 2_000, result));
        assertEquals(42, result.value());

        worker.join();
        assertEquals(FutureError.SUCCESS, request.response().destroy());
        assertEquals(FutureState.DESTROYED, request.response().state());
    }

    @Test
    @Timeout(5)
    void exchange_workerTooSlow_timesOut() throws InterruptedException {
        var request = new RequestResponseDemo.Request(1);
        var worker = new Thread(() -> RequestResponseDemo.serve(request, 500));
        worker.start();

        var result = ValueHolder.of(Integer.class);
        assertEquals(FutureError.TIMED_OUT, RequestResponseDemo.exchange(request, 50, result));
        assertFalse(result.isSet());

        worker.join();
        assertTrue(request.response().isComplete());
    }

    @Test
    @Timeout(5)
    void main_runsToCompletion() {
        System.setProperty(RequestResponseDemo.DELAY_PROPERTY, "10");
        System.setProperty(RequestResponseDemo.TIMEOUT_PROPERTY, "2000");
        try {
            assertDoesNotThrow(() -> RequestResponseDemo.main(new String[0]));
        } finally {
            System.clearProperty(RequestResponseDemo.DELAY_PROPERTY);
            System.clearProperty(RequestResponseDemo.TIMEOUT_PROPERTY);
        }
    }
}
