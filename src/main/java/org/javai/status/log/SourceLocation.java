package org.javai.status.log;

import java.util.Objects;
import java.util.Set;

/**
 * The call site a fatal check was evaluated at.
 *
 * @param className fully qualified name of the declaring class
 * @param methodName name of the calling method
 * @param fileName source file name (may be null when compiled without debug info)
 * @param lineNumber line number, or a negative value when unavailable
 */
public record SourceLocation(String className, String methodName, String fileName, int lineNumber) {

    /** Used when no frame outside the checking machinery could be found. */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", "<unknown>", null, -1);

    // Frames of these classes (and their nested classes) are never reported as the call site.
    private static final Set<String> MACHINERY = Set.of(
            SourceLocation.class.getName(),
            "org.javai.status.check.Check",
            "org.javai.status.check.FatalChecker",
            "org.javai.status.StatusOr",
            "org.javai.status.AStatusOrElse",
            "org.javai.status.boundary.StatusAdapter");

    public SourceLocation {
        Objects.requireNonNull(className, "className must not be null");
        Objects.requireNonNull(methodName, "methodName must not be null");
    }

    /**
     * Captures the first stack frame of the current thread that does not belong to
     * the status library's own API classes.
     */
    public static SourceLocation capture() {
        return StackWalker.getInstance().walk(frames -> frames
                .filter(frame -> !isMachinery(frame.getClassName()))
                .findFirst()
                .map(frame -> new SourceLocation(
                        frame.getClassName(),
                        frame.getMethodName(),
                        frame.getFileName(),
                        frame.getLineNumber()))
                .orElse(UNKNOWN));
    }

    private static boolean isMachinery(String className) {
        int nested = className.indexOf('$');
        String outer = nested < 0 ? className : className.substring(0, nested);
        return MACHINERY.contains(outer);
    }

    public StackTraceElement toStackTraceElement() {
        return new StackTraceElement(className, methodName, fileName, lineNumber);
    }

    @Override
    public String toString() {
        String file = fileName != null ? fileName : className;
        return lineNumber >= 0 ? file + ":" + lineNumber : file;
    }
}
