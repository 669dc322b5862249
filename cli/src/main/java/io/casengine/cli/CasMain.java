package io.casengine.cli;

/**
 * Entry point of the {@code cas} command.
 *
 * <p>
 * Delegates to {@link CliApp#run(String[])} and exits with its status code.
 */
public final class CasMain {

    private CasMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code differentiate "x^3" --var x})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int code = new CliApp(System.out, System.err, System::getenv).run(args);
        System.exit(code);
    }
}
