package de.bsommerfeld.selfupdate.http;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Response body that fails with {@link HttpTimeoutException} once no bytes
 * have arrived for {@code idleTimeout}.
 *
 * <p>
 * {@link java.net.http.HttpRequest.Builder#timeout} only covers the wait for
 * response headers. A server that stalls mid-body, or a half-open
 * connection, would otherwise block {@link #read} indefinitely. A shared
 * watchdog thread closes the underlying stream when the deadline passes,
 * which wakes the blocked reader. The deadline is re-armed after every read.
 */
final class IdleTimeoutInputStream extends FilterInputStream {

    private static final Logger LOG = LoggerFactory.getLogger(IdleTimeoutInputStream.class);

    private static final ScheduledThreadPoolExecutor WATCHDOG = createWatchdog();

    private final Duration idleTimeout;
    private final URI url;
    private volatile boolean expired;
    private ScheduledFuture<?> deadline;

    IdleTimeoutInputStream(InputStream in, Duration idleTimeout, URI url) {
        super(in);
        this.idleTimeout = idleTimeout;
        this.url = url;
        rearm();
    }

    private static ScheduledThreadPoolExecutor createWatchdog() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
                .setNameFormat("download-watchdog-%d")
                .setDaemon(true)
                .build());
        // Deadlines are cancelled once per chunk
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Override
    public int read() throws IOException {
        int value;
        try {
            value = super.read();
        } catch (IOException e) {
            throw expired ? timeout(e) : e;
        }
        afterRead();
        return value;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        int read;
        try {
            read = super.read(buffer, offset, length);
        } catch (IOException e) {
            throw expired ? timeout(e) : e;
        }
        afterRead();
        return read;
    }

    @Override
    public void close() throws IOException {
        cancelDeadline();
        super.close();
    }

    private void afterRead() throws HttpTimeoutException {
        if (expired) {
            throw timeout(null);
        }
        rearm();
    }

    private void rearm() {
        cancelDeadline();
        deadline = WATCHDOG.schedule(this::expire, idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelDeadline() {
        if (deadline != null) {
            deadline.cancel(false);
        }
    }

    private void expire() {
        expired = true;
        LOG.warn("No data from {} for {} ms, aborting", url, idleTimeout.toMillis());
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("Closing stalled response from {} failed", url, e);
        }
    }

    private HttpTimeoutException timeout(IOException cause) {
        HttpTimeoutException timeout = new HttpTimeoutException(
                "No data received for " + idleTimeout.toMillis() + " ms from " + url);
        if (cause != null) {
            timeout.initCause(cause);
        }
        return timeout;
    }
}
