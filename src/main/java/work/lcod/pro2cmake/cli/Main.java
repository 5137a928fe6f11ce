package work.lcod.pro2cmake.cli;

import picocli.CommandLine;

/**
 * Command line entry point: converts each given qmake project file into a
 * CMakeLists.txt written next to it and exits with the first failure's code.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Pro2CmakeCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .execute(args);
        System.exit(exitCode);
    }
}
