package org.javai.retry.cancel;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

final class NeverCancelled implements CancellationSignal {

    static final NeverCancelled INSTANCE = new NeverCancelled();

    private NeverCancelled() {}

    @Override
    public CancellationException error() {
        return null;
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        TimeUnit.NANOSECONDS.sleep(CancellationToken.saturatedNanos(timeout));
        return false;
    }

    @Override
    public String toString() {
        return "CancellationSignal.never()";
    }
}
