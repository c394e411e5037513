package org.javai.status.check;

/**
 * Ends the process after a failed fatal check.
 *
 * <p>Implementations must not return normally. If one does, {@link FatalChecker}
 * halts the JVM itself.</p>
 */
@FunctionalInterface
public interface Terminator {

    void terminate(int exitCode);

    /**
     * Terminates through {@link System#exit(int)}, running shutdown hooks so buffered
     * log output is flushed.
     */
    static Terminator exit() {
        return System::exit;
    }

    /**
     * Terminates through {@link Runtime#halt(int)} without running shutdown hooks.
     */
    static Terminator halt() {
        return exitCode -> Runtime.getRuntime().halt(exitCode);
    }
}
