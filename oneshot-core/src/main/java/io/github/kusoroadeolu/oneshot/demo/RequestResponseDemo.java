package io.github.kusoroadeolu.oneshot.demo;

import io.github.kusoroadeolu.oneshot.FutureError;
import io.github.kusoroadeolu.oneshot.FutureValue;
import io.github.kusoroadeolu.oneshot.ValueHolder;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hands a response from a worker thread back to the caller through a future embedded in the request.
 *
 * Run with:
 *   java -Doneshot.demo.delayMs=2000 -Doneshot.demo.timeoutMs=4000 -cp oneshot-core.jar \
 *        io.github.kusoroadeolu.oneshot.demo.RequestResponseDemo
 */
public class RequestResponseDemo {
    private static final Logger LOG = Logger.getLogger(RequestResponseDemo.class.getName());

    static final String DELAY_PROPERTY = "oneshot.demo.delayMs";
    static final String TIMEOUT_PROPERTY = "oneshot.demo.timeoutMs";
    static final int DEFAULT_DELAY_MS = 2_000;
    static final int DEFAULT_TIMEOUT_MS = 4_000;

    //The future lives inside the request, so the request owns it and destroys it in place
    record Request(int operand, FutureValue<Integer> response) {
        Request(int operand) {
            this(operand, FutureValue.create(Integer.class));
        }
    }

    public static void main(String[] args) throws InterruptedException {
        int delayMs = Integer.getInteger(DELAY_PROPERTY, DEFAULT_DELAY_MS);
        int timeoutMs = Integer.getInteger(TIMEOUT_PROPERTY, DEFAULT_TIMEOUT_MS);

        var request = new Request(21);
        var worker = new Thread(() -> serve(request, delayMs), "oneshot-worker");
        worker.start();

        var result = ValueHolder.of(Integer.class);
        var err = exchange(request, timeoutMs, result);
        if (err.isSuccess()) {
            LOG.info(() -> "Received response " + result.value());
        } else {
            LOG.warning(() -> "Request failed: " + FutureError.errorToString(err));
        }

        worker.join();
        request.response().destroy();
    }

    static FutureError exchange(Request request, int timeoutMs, ValueHolder<Integer> result) {
        return request.response().get(timeoutMs, result);
    }

    static void serve(Request request, int delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.log(Level.WARNING, "Worker interrupted before responding", e);
            return;
        }

        var err = request.response().complete(request.operand() * 2);
        if (!err.isSuccess()) {
            LOG.warning(() -> "Error completing future: " + FutureError.errorToString(err));
        }
    }
}
