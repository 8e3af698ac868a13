package com.harbor.server.infrastructure.web;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;

/**
 * Response wrapper that remembers the status code and counts the body bytes written.
 * <p>
 * The status defaults to 200 and is overwritten by every {@code setStatus}, {@code sendError}
 * and {@code sendRedirect}. Bytes are counted whether the handler writes through the output
 * stream or the writer; discarded by {@link #resetBuffer()} they no longer count.
 * <p>
 * Characters pending in the writer only reach the container response when the handler flushes,
 * or when {@link #flushWriter()} hands them over without flushing the container. A reset drops
 * them. One instance per request.
 */
public class TelemetryResponseWrapper extends HttpServletResponseWrapper {

    private int statusCode = HttpServletResponse.SC_OK;
    private long size;
    private CountingOutputStream outputStream;
    private TelemetryWriter writer;
    private boolean outputStreamUsed;
    private boolean discarding;

    public TelemetryResponseWrapper(HttpServletResponse response) {
        super(response);
    }

    @Override
    public void setStatus(int sc) {
        super.setStatus(sc);
        this.statusCode = sc;
    }

    @Override
    public void sendError(int sc) throws IOException {
        super.sendError(sc);
        this.statusCode = sc;
    }

    @Override
    public void sendError(int sc, String msg) throws IOException {
        super.sendError(sc, msg);
        this.statusCode = sc;
    }

    @Override
    public void sendRedirect(String location) throws IOException {
        super.sendRedirect(location);
        this.statusCode = HttpServletResponse.SC_FOUND;
    }

    @Override
    public ServletOutputStream getOutputStream() throws IOException {
        if (writer != null) {
            throw new IllegalStateException("getWriter() has already been called for this response");
        }
        outputStreamUsed = true;
        return countingStream();
    }

    @Override
    public PrintWriter getWriter() throws IOException {
        if (writer == null) {
            if (outputStreamUsed) {
                throw new IllegalStateException("getOutputStream() has already been called for this response");
            }
            writer = new TelemetryWriter(new WriterSink(countingStream()), getCharacterEncoding());
        }
        return writer;
    }

    @Override
    public void flushBuffer() throws IOException {
        flushWriter();
        super.flushBuffer();
    }

    @Override
    public void resetBuffer() {
        super.resetBuffer();
        discardWriter();
        size = 0;
    }

    @Override
    public void reset() {
        super.reset();
        discardWriter();
        writer = null;
        outputStreamUsed = false;
        size = 0;
        statusCode = HttpServletResponse.SC_OK;
    }

    /**
     * Hands characters pending in the writer to the container response without flushing it.
     */
    public void flushWriter() {
        if (writer != null) {
            writer.drain();
        }
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the number of body bytes written so far.
     */
    public long getSize() {
        return size;
    }

    private void discardWriter() {
        if (writer == null) {
            return;
        }
        discarding = true;
        try {
            writer.drain();
        } finally {
            discarding = false;
        }
    }

    private CountingOutputStream countingStream() throws IOException {
        if (outputStream == null) {
            outputStream = new CountingOutputStream(super.getOutputStream());
        }
        return outputStream;
    }

    /** Writer whose own flush reaches the container, while {@link #drain()} stops short of it. */
    private final class TelemetryWriter extends PrintWriter {

        TelemetryWriter(WriterSink sink, String encoding) throws IOException {
            super(new OutputStreamWriter(sink, encoding));
        }

        void drain() {
            super.flush();
        }

        @Override
        public void flush() {
            super.flush();
            try {
                outputStream.flush();
            } catch (IOException e) {
                setError();
            }
        }
    }

    /** Sits between the writer's encoder and the counting stream; drops bytes while discarding. */
    private final class WriterSink extends OutputStream {

        private final CountingOutputStream target;

        WriterSink(CountingOutputStream target) {
            this.target = target;
        }

        @Override
        public void write(int b) throws IOException {
            if (!discarding) {
                target.write(b);
            }
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (!discarding) {
                target.write(b, off, len);
            }
        }
    }

    private final class CountingOutputStream extends ServletOutputStream {

        private final ServletOutputStream delegate;

        CountingOutputStream(ServletOutputStream delegate) {
            this.delegate = delegate;
        }

        @Override
        public void write(int b) throws IOException {
            delegate.write(b);
            size++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            delegate.write(b, off, len);
            size += len;
        }

        @Override
        public void flush() throws IOException {
            delegate.flush();
        }

        @Override
        public void close() throws IOException {
            delegate.close();
        }

        @Override
        public boolean isReady() {
            return delegate.isReady();
        }

        @Override
        public void setWriteListener(WriteListener listener) {
            delegate.setWriteListener(listener);
        }
    }
}
