package com.github.anirbanmu.shardline.log;

import com.github.anirbanmu.shardline.util.Threads;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;

// structured key=value logger. one line per event, written by a background drain thread.
// instances carry a scope (manager, shard-3, ...) and are passed around explicitly.
public final class Log {
    private static final Logger logger = System.getLogger("shardline");
    private static final BlockingQueue<String> QUEUE = new ArrayBlockingQueue<>(4096);
    private static final OutputStream OUT = new FileOutputStream(FileDescriptor.out);
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ISO_INSTANT;
    private static final String CRITICAL = "CRITICAL";

    static {
        Thread drainThread = Threads.start("shardline-log-drain", Log::drainLoop);

        // drain thread is a daemon, so need a hook to flush on exit
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            drainThread.interrupt();
            try {
                drainThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
    }

    private final String scope;
    private final Consumer<String> sink;

    private Log(String scope, Consumer<String> sink) {
        this.scope = scope;
        this.sink = sink;
    }

    // writes to stdout through the shared drain queue
    public static Log create(String scope) {
        return new Log(scope, QUEUE::offer);
    }

    // writes formatted lines to the given sink, synchronously
    public static Log to(String scope, Consumer<String> sink) {
        return new Log(scope, sink);
    }

    public Log child(String childScope) {
        return new Log(scope == null ? childScope : scope + "/" + childScope, sink);
    }

    public void info(String evt, Object... kv) {
        log(Level.INFO, Level.INFO.name(), evt, kv, null);
    }

    public void error(String evt, Throwable t, Object... kv) {
        log(Level.ERROR, Level.ERROR.name(), evt, kv, t);
    }

    public void error(String evt, Object... kv) {
        log(Level.ERROR, Level.ERROR.name(), evt, kv, null);
    }

    public void warn(String evt, Object... kv) {
        log(Level.WARNING, Level.WARNING.name(), evt, kv, null);
    }

    public void debug(String evt, Object... kv) {
        log(Level.DEBUG, Level.DEBUG.name(), evt, kv, null);
    }

    // fatal, non-retryable termination only
    public void critical(String evt, Object... kv) {
        log(Level.ERROR, CRITICAL, evt, kv, null);
    }

    private static void drainLoop() {
        List<String> batch = new ArrayList<>(128);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    batch.add(QUEUE.take());
                    QUEUE.drainTo(batch, 127);
                    write(batch);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (Exception e) {
                    System.err.println("PANIC: LOGGING FAILED");
                    e.printStackTrace();
                    batch.clear();
                }
            }
        } finally {
            try {
                if (!batch.isEmpty()) {
                    write(batch);
                }
                while (!QUEUE.isEmpty()) {
                    batch.clear();
                    QUEUE.drainTo(batch, 128);
                    write(batch);
                }
            } catch (Exception e) {
                System.err.println("PANIC: FLUSH FAILED");
            }
        }
    }

    private static void write(List<String> batch) throws IOException {
        StringBuilder chunk = new StringBuilder(batch.size() * 128);
        for (String msg : batch) {
            chunk.append(msg).append('\n');
        }
        OUT.write(chunk.toString().getBytes(StandardCharsets.UTF_8));
        OUT.flush();
        batch.clear();
    }

    private void log(Level level, String levelName, String evt, Object[] kv, Throwable t) {
        if (!logger.isLoggable(level)) {
            return;
        }

        StringBuilder sb = new StringBuilder(128);
        TIME_FMT.formatTo(Instant.now().truncatedTo(ChronoUnit.MILLIS), sb);
        sb.append(" ").append(levelName);

        if (evt != null) {
            sb.append(" evt=").append(escape(evt));
        }

        if (scope != null) {
            sb.append(" scope=").append(escape(scope));
        }

        if (kv != null && kv.length > 0) {
            for (int i = 0; i < kv.length; i += 2) {
                sb.append(" ").append(kv[i]).append("=")
                  .append(escape(String.valueOf((i + 1 < kv.length) ? kv[i + 1] : "null")));
            }
        }

        if (t != null) {
            sb.append(" err=").append(escape(t.getClass().getSimpleName()))
              .append(" msg=").append(escape(t.getMessage()));

            if (t.getStackTrace().length > 0) {
                sb.append(" loc=").append(escape(t.getStackTrace()[0].toString()));
            }
        }

        sink.accept(sb.toString());
    }

    static String escape(String s) {
        if (s == null) {
            return "null";
        }

        if (s.isEmpty()) {
            return "\"\"";
        }

        boolean safe = true;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c <= ' ' || c == '=' || c == '"') {
                safe = false;
                break;
            }
        }

        if (safe) {
            return s;
        }

        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('"');
        return sb.toString();
    }
}
