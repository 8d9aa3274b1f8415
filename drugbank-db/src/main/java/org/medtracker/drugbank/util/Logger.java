package org.medtracker.drugbank.util;

/*
 * This file is part of MedTracker.
 *
 * Copyright (C) 2025 The MedTracker Authors
 *
 * MedTracker is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * MedTracker is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with MedTracker.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Small, dependency-free logger shared by the ingestion, query and cache code.
 *
 * <p>Configuration via system properties (read once at class load):</p>
 * <ul>
 *   <li><b>medtracker.log.level</b> – minimum level to print (default: INFO)</li>
 *   <li><b>medtracker.log.datetime</b> – timestamp pattern (default: yyyy-MM-dd HH:mm:ss)</li>
 * </ul>
 *
 * <p>Messages use {@code {}} placeholders. INFO and below go to stdout,
 * WARN and ERROR to stderr.</p>
 */
public final class Logger {

    /** Log levels in increasing order of severity. */
    public enum Level {
        TRACE, DEBUG, INFO, WARN, ERROR;

        static Level parse(String s, Level fallback) {
            if (s == null) return fallback;
            try {
                return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                return fallback;
            }
        }
    }

    private static final Level MIN_LEVEL =
            Level.parse(System.getProperty("medtracker.log.level"), Level.INFO);

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern(
                    System.getProperty("medtracker.log.datetime", "yyyy-MM-dd HH:mm:ss")
            );

    private Logger() {}

    public static boolean isEnabled(Level level) {
        return level.ordinal() >= MIN_LEVEL.ordinal();
    }

    public static void trace(String msg, Object... args) { log(Level.TRACE, null, msg, args); }
    public static void debug(String msg, Object... args) { log(Level.DEBUG, null, msg, args); }
    public static void info (String msg, Object... args) { log(Level.INFO , null, msg, args); }
    public static void warn (String msg, Object... args) { log(Level.WARN , null, msg, args); }
    public static void error(String msg, Object... args) { log(Level.ERROR, null, msg, args); }

    public static void warn (String msg, Throwable t, Object... args) { log(Level.WARN , t, msg, args); }
    public static void error(String msg, Throwable t, Object... args) { log(Level.ERROR, t, msg, args); }

    private static void log(Level level, Throwable t, String msg, Object... args) {
        if (!isEnabled(level)) return;

        final String ts = LocalDateTime.now().format(TS);
        final String thread = Thread.currentThread().getName();
        final String body = format(msg, args);

        final PrintStream out = (level.ordinal() >= Level.WARN.ordinal()) ? System.err : System.out;

        synchronized (Logger.class) {
            out.println("[" + ts + "] [" + thread + "] " + level + " " + body);
            if (t != null) {
                t.printStackTrace(out);
            }
        }
    }

    /**
     * Replaces each "{}" with the stringified next argument.
     * If counts mismatch, extra args are appended.
     */
    static String format(String template, Object... args) {
        if (template == null) return "null";
        if (args == null || args.length == 0) return template;

        StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
        int argIdx = 0;
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '}' && argIdx < args.length) {
                sb.append(String.valueOf(args[argIdx++]));
                i++;
            } else {
                sb.append(c);
            }
        }
        while (argIdx < args.length) {
            sb.append(' ').append(String.valueOf(args[argIdx++]));
        }
        return sb.toString();
    }
}
